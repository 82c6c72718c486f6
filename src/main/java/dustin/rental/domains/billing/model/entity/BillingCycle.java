package dustin.rental.domains.billing.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.BillingScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 월별 청구 주기 엔티티
 * Billing Cycle Entity
 *
 * 역할:
 * - 범위(기관/소유자)별 월 단위 사용량 집계 단위
 * - 마감 시 사용량 스냅샷과 생성된 청구 ID 목록 보관
 *
 * (scope_key, billing_month) 유니크: 같은 달의 주기는 하나만 존재
 */
@Entity
@Table(name = "billing_cycles",
       indexes = {
           @Index(name = "idx_billing_cycles_status_month", columnList = "status,billing_month")
       },
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_billing_cycles_scope_month", columnNames = {"scope_key", "billing_month"})
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agency_id")
    private Long agencyId;

    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "scope_key", nullable = false, length = 50)
    private String scopeKey;

    /**
     * YYYY-MM
     */
    @Column(name = "billing_month", nullable = false, length = 7)
    private String billingMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BillingCycleStatus status;

    @Column(name = "plan_name", nullable = false, length = 30)
    private String planName;

    /**
     * 마감 시점 기능별 사용량 (JSON 배열)
     */
    @Column(name = "usage_snapshot_json", columnDefinition = "TEXT")
    private String usageSnapshotJson;

    @Column(name = "overuse_charge_value", precision = 15, scale = 2)
    private BigDecimal overuseChargeValue;

    @Column(name = "boleto_count")
    private Integer boletoCount;

    @Column(name = "operational_charges", precision = 15, scale = 2)
    private BigDecimal operationalCharges;

    @Column(name = "total_platform_fee", precision = 15, scale = 2)
    private BigDecimal totalPlatformFee;

    /**
     * 생성된 청구 ID 목록 (JSON 배열)
     */
    @Column(name = "charge_ids_json", columnDefinition = "TEXT")
    private String chargeIdsJson;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "closed_by", length = 100)
    private String closedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public BillingScope toScope() {
        return BillingScope.of(agencyId, ownerId);
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
