package dustin.rental.domains.audit.model.entity;

import java.time.Instant;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PreRemove;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할/청구 감사 로그 엔티티
 * Split Audit Log Entity
 *
 * 역할:
 * - 설정/수신자/규칙/청구 주기 변경 이력 (변경 전/후 스냅샷)
 * - 항목별 무결성 해시로 저장된 이력의 변조 탐지
 *
 * 추가 전용(append-only): 수정/삭제 시 예외가 발생한다.
 */
@Entity
@Table(name = "split_audit_logs",
       indexes = {
           @Index(name = "idx_split_audit_logs_configuration", columnList = "configuration_id,performed_at"),
           @Index(name = "idx_split_audit_logs_entity", columnList = "entity_type,entity_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 청구 주기 항목은 NULL
     */
    @Column(name = "configuration_id", updatable = false)
    private Long configurationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 30)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 30)
    private AuditEntityType entityType;

    @Column(name = "entity_id", updatable = false)
    private Long entityId;

    @Column(name = "before_state", columnDefinition = "TEXT", updatable = false)
    private String beforeState;

    @Column(name = "after_state", columnDefinition = "TEXT", updatable = false)
    private String afterState;

    @Column(name = "reason", columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "performed_by", nullable = false, updatable = false, length = 100)
    private String performedBy;

    /**
     * 밀리초 단위로 절삭 (해시 재계산 시 DB 정밀도와 일치)
     */
    @Column(name = "performed_at", nullable = false, updatable = false)
    private Instant performedAt;

    /**
     * SHA-256 hex
     */
    @Column(name = "integrity_hash", nullable = false, updatable = false, length = 64)
    private String integrityHash;

    @PreUpdate
    protected void onUpdate() {
        throw new IllegalStateException("Audit log entries are append-only: id=" + id);
    }

    @PreRemove
    protected void onRemove() {
        throw new IllegalStateException("Audit log entries cannot be deleted: id=" + id);
    }
}
