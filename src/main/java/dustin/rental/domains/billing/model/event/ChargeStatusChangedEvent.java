package dustin.rental.domains.billing.model.event;

import java.math.BigDecimal;

import dustin.rental.domains.billing.model.ChargeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청구 상태 변경 이벤트 (커밋 후 알림 발행)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargeStatusChangedEvent {

    private Long chargeId;
    private String chargeToken;
    private ChargeStatus previousStatus;
    private ChargeStatus newStatus;
    private BigDecimal amount;
    private String reason;
}
