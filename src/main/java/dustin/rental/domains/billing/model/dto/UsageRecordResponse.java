package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.rental.domains.billing.model.UsageFeature;
import dustin.rental.domains.billing.model.entity.UsageRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecordResponse {

    private Long id;
    private Long agencyId;
    private Long ownerId;
    private UsageFeature feature;
    private Integer quantity;
    private BigDecimal unitPrice;
    private BigDecimal totalAmount;
    private String billingMonth;
    private String planName;
    private String referenceId;
    private String referenceType;
    private LocalDateTime createdAt;

    public static UsageRecordResponse from(UsageRecord record) {
        return UsageRecordResponse.builder()
                .id(record.getId())
                .agencyId(record.getAgencyId())
                .ownerId(record.getOwnerId())
                .feature(record.getFeature())
                .quantity(record.getQuantity())
                .unitPrice(record.getUnitPrice())
                .totalAmount(record.getTotalAmount())
                .billingMonth(record.getBillingMonth())
                .planName(record.getPlanName())
                .referenceId(record.getReferenceId())
                .referenceType(record.getReferenceType())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
