package dustin.rental.domains.audit.model;

/**
 * 감사 대상 엔티티 유형
 * Audit Entity Type
 */
public enum AuditEntityType {
    CONFIGURATION,
    RECEIVER,
    RULE,
    BILLING_CYCLE
}
