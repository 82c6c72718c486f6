package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.dto.SplitResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingChargeResponse {

    private Long id;
    private String token;
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
    private BigDecimal platformFee;
    private BigDecimal netValue;
    private Long splitConfigurationId;
    private SplitResult splitBreakdown;
    private ChargeStatus status;
    private LocalDate dueDate;
    private String gatewayPaymentId;
    private String paymentLink;
    private String paymentMethod;
    private BigDecimal paidValue;
    private LocalDateTime paidAt;
    private BigDecimal refundedValue;
    private LocalDateTime refundedAt;
    private String refundReason;
    private String lastGatewayEvent;
    private LocalDateTime createdAt;

    /**
     * 생성 시 경고 (활성 분할 설정 없음 등)
     */
    private String warning;
}
