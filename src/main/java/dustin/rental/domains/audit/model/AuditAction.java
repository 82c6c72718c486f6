package dustin.rental.domains.audit.model;

/**
 * 감사 로그 작업 유형
 * Audit Action
 */
public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    VALIDATE,
    ACTIVATE,
    DEACTIVATE,
    CREATE_VERSION,
    ARCHIVE,
    CLOSE_CYCLE
}
