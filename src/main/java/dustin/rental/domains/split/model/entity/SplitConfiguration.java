package dustin.rental.domains.split.model.entity;

import java.time.LocalDate;
import java.time.LocalDateTime;

import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
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
 * 분할 설정 엔티티
 * Split Configuration Entity
 *
 * 역할:
 * - 청구 금액을 수신자들에게 나누는 규칙 묶음의 헤더
 * - 범위(GLOBAL / PER_CONTRACT / PER_PROPERTY)와 버전 계보 관리
 *
 * 동시성:
 * - active_scope_key 는 ACTIVE 일 때만 scope_key 값을 가지며 유니크 제약이 걸려 있다.
 *   같은 범위에서 두 개의 ACTIVE 설정이 커밋되는 것을 DB 가 막는다.
 */
@Entity
@Table(name = "split_configurations",
       indexes = {
           @Index(name = "idx_split_configurations_scope_status", columnList = "scope_key,status"),
           @Index(name = "idx_split_configurations_agency", columnList = "agency_id"),
           @Index(name = "idx_split_configurations_owner", columnList = "owner_id")
       },
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_split_configurations_token", columnNames = "token"),
           @UniqueConstraint(name = "uk_split_configurations_active_scope", columnNames = "active_scope_key"),
           @UniqueConstraint(name = "uk_split_configurations_lineage_version",
                             columnNames = {"scope_key", "name", "version"})
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 외부 노출용 식별자
     */
    @Column(name = "token", nullable = false, length = 36)
    private String token;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 20)
    private ConfigurationScope scope;

    @Column(name = "agency_id")
    private Long agencyId;

    @Column(name = "owner_id")
    private Long ownerId;

    @Column(name = "contract_id")
    private Long contractId;

    @Column(name = "property_id")
    private Long propertyId;

    /**
     * 정규화된 범위 키 (ScopeKey.asString)
     */
    @Column(name = "scope_key", nullable = false, length = 120)
    private String scopeKey;

    /**
     * ACTIVE 일 때만 scope_key, 그 외에는 NULL
     */
    @Column(name = "active_scope_key", length = 120)
    private String activeScopeKey;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "previous_version_id")
    private Long previousVersionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ConfigurationStatus status;

    @Column(name = "is_validated", nullable = false)
    private Boolean isValidated;

    @Column(name = "validation_notes", columnDefinition = "TEXT")
    private String validationNotes;

    @Column(name = "change_reason", columnDefinition = "TEXT")
    private String changeReason;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "effective_date")
    private LocalDate effectiveDate;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "validated_at")
    private LocalDateTime validatedAt;

    @Column(name = "validated_by", length = 100)
    private String validatedBy;

    @Column(name = "activated_at")
    private LocalDateTime activatedAt;

    @Column(name = "activated_by", length = 100)
    private String activatedBy;

    @Column(name = "deactivated_at")
    private LocalDateTime deactivatedAt;

    @Column(name = "deactivated_by", length = 100)
    private String deactivatedBy;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;

    @Column(name = "archived_by", length = 100)
    private String archivedBy;

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
