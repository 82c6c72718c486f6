package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.billing.model.BillingCycleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청구 주기 응답 DTO
 * Billing Cycle Response DTO
 *
 * usage 는 마감 시점 스냅샷. OPEN 주기는 비어 있으며 현재 사용량은 /overages 로 조회한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingCycleResponse {

    private Long id;
    private Long agencyId;
    private Long ownerId;
    private String billingMonth;
    private BillingCycleStatus status;
    private String planName;

    @Builder.Default
    private List<UsageOverage> usage = new ArrayList<>();

    private BigDecimal overuseChargeValue;
    private Integer boletoCount;
    private BigDecimal operationalCharges;
    private BigDecimal totalPlatformFee;

    @Builder.Default
    private List<Long> chargeIds = new ArrayList<>();

    private LocalDateTime closedAt;
    private String closedBy;
    private LocalDateTime createdAt;
}
