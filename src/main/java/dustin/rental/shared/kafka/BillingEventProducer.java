package dustin.rental.shared.kafka;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 청구 이벤트 발행자
 * Billing Event Producer
 *
 * 역할:
 * - 생성된 청구를 결제 게이트웨이 연동 토픽으로 발행
 * - 청구 상태 변경을 알림 토픽으로 발행
 *
 * 주의사항:
 * - 발행은 비동기로 처리됨 (논블로킹)
 * - 발행 실패는 로그만 남기고 청구/마감 결과에는 영향 없음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BillingEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${billing.topics.payment-requests:billing-payment-requests}")
    private String paymentRequestTopic;

    @Value("${billing.topics.charge-alerts:billing-charge-alerts}")
    private String chargeAlertTopic;

    /**
     * 결제 생성 요청 발행
     * Publish payment request
     *
     * @param chargeToken 청구 토큰 (파티션 키)
     * @param payloadJson 게이트웨이 요청 페이로드 (JSON 문자열)
     */
    public void publishPaymentRequest(String chargeToken, String payloadJson) {
        send(paymentRequestTopic, chargeToken, payloadJson);
    }

    /**
     * 청구 상태 알림 발행
     * Publish charge alert
     */
    public void publishChargeAlert(String chargeToken, String payloadJson) {
        send(chargeAlertTopic, chargeToken, payloadJson);
    }

    /**
     * 전송 스레드 분리 후 브로커 응답까지 체인
     *
     * 메타데이터 대기(max.block.ms)와 브로커 거절 모두 같은 실패 로그로 남는다.
     */
    CompletableFuture<SendResult<String, String>> send(String topic, String key, String payloadJson) {
        return CompletableFuture.supplyAsync(() -> kafkaTemplate.send(topic, key, payloadJson))
                .thenCompose(future -> future)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("[BillingEventProducer] 이벤트 발행 실패: topic={}, key={}, error={}",
                                topic, key, ex.getMessage());
                        return;
                    }
                    log.debug("[BillingEventProducer] 이벤트 발행 완료: topic={}, key={}, offset={}",
                            topic, key, result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : null);
                });
    }
}
