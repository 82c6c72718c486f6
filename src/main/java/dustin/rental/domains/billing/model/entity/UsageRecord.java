package dustin.rental.domains.billing.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.rental.domains.billing.model.UsageFeature;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용량 기록 엔티티
 * Usage Record Entity
 *
 * 기록 시점 요금제의 단가로 금액을 함께 저장한다. 한도 초과 여부는 마감 시 월 합계로 판단.
 */
@Entity
@Table(name = "usage_records",
       indexes = {
           @Index(name = "idx_usage_records_scope_month", columnList = "scope_key,billing_month,feature")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scope_key", nullable = false, length = 50)
    private String scopeKey;

    @Column(name = "agency_id")
    private Long agencyId;

    @Column(name = "owner_id")
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "feature", nullable = false, length = 30)
    private UsageFeature feature;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 15, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "billing_month", nullable = false, length = 7)
    private String billingMonth;

    @Column(name = "plan_name", nullable = false, length = 30)
    private String planName;

    @Column(name = "reference_id", length = 100)
    private String referenceId;

    @Column(name = "reference_type", length = 50)
    private String referenceType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
