package dustin.rental.domains.split.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.SplitRuleType;
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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 규칙 엔티티
 * Split Rule Entity
 *
 * 역할:
 * - 수신자 한 명에게 배정되는 금액 계산식 (백분율 또는 고정 금액)
 * - 최소/최대 금액 제한, 청구 유형 필터, 우선순위
 */
@Entity
@Table(name = "split_rules",
       indexes = {
           @Index(name = "idx_split_rules_configuration", columnList = "configuration_id"),
           @Index(name = "idx_split_rules_receiver", columnList = "receiver_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "configuration_id", nullable = false)
    private Long configurationId;

    @Column(name = "receiver_id", nullable = false)
    private Long receiverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_type", nullable = false, length = 20)
    private SplitRuleType ruleType;

    /**
     * PERCENTAGE: 백분율, FIXED: 고정 금액 (모두 0 이상)
     */
    @Column(name = "rule_value", nullable = false, precision = 15, scale = 4)
    private BigDecimal value;

    @Column(name = "minimum_amount", precision = 15, scale = 2)
    private BigDecimal minimumAmount;

    @Column(name = "maximum_amount", precision = 15, scale = 2)
    private BigDecimal maximumAmount;

    /**
     * NULL 이면 모든 청구 유형에 적용
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "charge_type", length = 30)
    private ChargeType chargeType;

    /**
     * 높을수록 먼저 배정
     */
    @Column(name = "priority", nullable = false)
    private Integer priority;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
