package dustin.rental.domains.billing.model.event;

import dustin.rental.domains.billing.model.dto.PaymentGatewayRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 청구 생성 이벤트 (커밋 후 게이트웨이 요청 발행)
 */
@Getter
@AllArgsConstructor
public class ChargeCreatedEvent {

    private final PaymentGatewayRequest paymentRequest;
}
