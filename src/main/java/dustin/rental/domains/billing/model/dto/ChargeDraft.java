package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import dustin.rental.domains.split.model.ChargeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청구 생성 입력 (API 요청과 주기 마감에서 공통 사용)
 * Charge Draft
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargeDraft {

    private Long agencyId;
    private Long ownerId;
    private Long contractId;
    private Long propertyId;
    private Long tenantId;
    private Long billingCycleId;
    private ChargeType chargeType;
    private String description;
    private String billingMonth;
    private BigDecimal grossValue;
    private LocalDate dueDate;
}
