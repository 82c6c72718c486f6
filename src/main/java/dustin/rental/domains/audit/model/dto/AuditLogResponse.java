package dustin.rental.domains.audit.model.dto;

import java.time.Instant;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.model.entity.SplitAuditLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogResponse {

    private Long id;
    private Long configurationId;
    private AuditAction action;
    private AuditEntityType entityType;
    private Long entityId;
    private String beforeState;
    private String afterState;
    private String reason;
    private String performedBy;
    private Instant performedAt;
    private String integrityHash;
    private Boolean integrityVerified;

    public static AuditLogResponse from(SplitAuditLog log, boolean verified) {
        return AuditLogResponse.builder()
                .id(log.getId())
                .configurationId(log.getConfigurationId())
                .action(log.getAction())
                .entityType(log.getEntityType())
                .entityId(log.getEntityId())
                .beforeState(log.getBeforeState())
                .afterState(log.getAfterState())
                .reason(log.getReason())
                .performedBy(log.getPerformedBy())
                .performedAt(log.getPerformedAt())
                .integrityHash(log.getIntegrityHash())
                .integrityVerified(verified)
                .build();
    }
}
