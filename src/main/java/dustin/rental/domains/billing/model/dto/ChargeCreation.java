package dustin.rental.domains.billing.model.dto;

import dustin.rental.domains.billing.model.entity.BillingCharge;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 청구 생성 결과 (경고는 없으면 null)
 */
@Getter
@AllArgsConstructor
public class ChargeCreation {

    private final BillingCharge charge;
    private final String warning;
}
