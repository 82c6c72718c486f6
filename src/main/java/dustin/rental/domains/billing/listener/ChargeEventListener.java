package dustin.rental.domains.billing.listener;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.rental.domains.billing.model.event.ChargeCreatedEvent;
import dustin.rental.domains.billing.model.event.ChargeStatusChangedEvent;
import dustin.rental.shared.kafka.BillingEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 청구 이벤트 리스너
 * Charge Event Listener
 *
 * 역할:
 * - 청구 트랜잭션 커밋 후에만 Kafka 로 발행 (롤백된 청구는 게이트웨이에 전달되지 않음)
 * - ChargeCreatedEvent → 결제 요청 토픽
 * - ChargeStatusChangedEvent → 알림 토픽
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChargeEventListener {

    private final BillingEventProducer billingEventProducer;
    private final ObjectMapper objectMapper;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onChargeCreated(ChargeCreatedEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event.getPaymentRequest());
            billingEventProducer.publishPaymentRequest(event.getPaymentRequest().getChargeToken(), payload);
        } catch (JsonProcessingException e) {
            log.error("[ChargeEventListener] 결제 요청 직렬화 실패: chargeId={}",
                    event.getPaymentRequest().getChargeId(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onChargeStatusChanged(ChargeStatusChangedEvent event) {
        try {
            billingEventProducer.publishChargeAlert(event.getChargeToken(), objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("[ChargeEventListener] 상태 변경 알림 직렬화 실패: chargeId={}", event.getChargeId(), e);
        }
    }
}
