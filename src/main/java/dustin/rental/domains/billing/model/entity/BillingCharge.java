package dustin.rental.domains.billing.model.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.split.model.ChargeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostUpdate;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 청구 엔티티
 * Billing Charge Entity
 *
 * 역할:
 * - 총액, 플랫폼 수수료, 순액, 분할 결과(JSON 원문) 보관
 * - 결제 게이트웨이 상태 추적
 *
 * 불변 조건:
 * - 게이트웨이 결제 ID 가 붙은 뒤에는 gross_value / split_breakdown 을 바꿀 수 없다 (PreUpdate 에서 차단)
 */
@Entity
@Table(name = "billing_charges",
       indexes = {
           @Index(name = "idx_billing_charges_agency", columnList = "agency_id,billing_month"),
           @Index(name = "idx_billing_charges_owner", columnList = "owner_id,billing_month"),
           @Index(name = "idx_billing_charges_status", columnList = "status")
       },
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_billing_charges_token", columnNames = "token"),
           @UniqueConstraint(name = "uk_billing_charges_gateway_payment", columnNames = "gateway_payment_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingCharge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", nullable = false, length = 36)
    private String token;

    @Column(name = "agency_id")
    private Long agencyId;

    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "contract_id")
    private Long contractId;

    @Column(name = "property_id")
    private Long propertyId;

    /**
     * 납부자 (임차인)
     */
    @Column(name = "tenant_id")
    private Long tenantId;

    @Column(name = "billing_cycle_id")
    private Long billingCycleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_type", nullable = false, length = 30)
    private ChargeType chargeType;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "billing_month", length = 7)
    private String billingMonth;

    @Column(name = "gross_value", nullable = false, precision = 15, scale = 2)
    private BigDecimal grossValue;

    @Column(name = "platform_fee", nullable = false, precision = 15, scale = 2)
    private BigDecimal platformFee;

    @Column(name = "net_value", nullable = false, precision = 15, scale = 2)
    private BigDecimal netValue;

    @Column(name = "split_configuration_id")
    private Long splitConfigurationId;

    /**
     * SplitResult JSON 원문
     */
    @Column(name = "split_breakdown", columnDefinition = "TEXT")
    private String splitBreakdown;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChargeStatus status;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "gateway_payment_id", length = 100)
    private String gatewayPaymentId;

    @Column(name = "payment_link", length = 500)
    private String paymentLink;

    @Column(name = "payment_method", length = 30)
    private String paymentMethod;

    @Column(name = "paid_value", precision = 15, scale = 2)
    private BigDecimal paidValue;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "refunded_value", precision = 15, scale = 2)
    private BigDecimal refundedValue;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Column(name = "refund_reason", columnDefinition = "TEXT")
    private String refundReason;

    @Column(name = "last_gateway_event", length = 50)
    private String lastGatewayEvent;

    @Column(name = "last_gateway_event_at")
    private LocalDateTime lastGatewayEventAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // 마지막으로 DB 와 동기화된 값 (불변 조건 확인용)
    @Transient
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BigDecimal persistedGrossValue;

    @Transient
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private String persistedSplitBreakdown;

    @Transient
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private String persistedGatewayPaymentId;

    /**
     * 게이트웨이 결제 ID 가 붙었는지 여부
     */
    public boolean isSubmittedToGateway() {
        return gatewayPaymentId != null;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        if (persistedGatewayPaymentId != null
                && (persistedGrossValue.compareTo(grossValue) != 0
                    || !Objects.equals(persistedSplitBreakdown, splitBreakdown))) {
            throw new IllegalStateException("Charge " + id
                    + " was submitted to the payment gateway; gross value and split breakdown are immutable");
        }
        updatedAt = LocalDateTime.now();
    }

    @PostLoad
    @PostPersist
    @PostUpdate
    protected void capturePersistedState() {
        persistedGrossValue = grossValue;
        persistedSplitBreakdown = splitBreakdown;
        persistedGatewayPaymentId = gatewayPaymentId;
    }
}
