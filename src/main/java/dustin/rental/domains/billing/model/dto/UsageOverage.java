package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.billing.model.UsageFeature;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 기능별 사용량/초과 요금
 * Usage Overage
 *
 * overage = max(0, used - freeLimit), totalCharge = overage × unitPrice
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageOverage {

    private UsageFeature feature;
    private long used;
    private int freeLimit;
    private long overage;
    private BigDecimal unitPrice;
    private BigDecimal totalCharge;
}
