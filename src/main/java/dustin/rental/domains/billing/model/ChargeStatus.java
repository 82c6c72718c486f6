package dustin.rental.domains.billing.model;

/**
 * 청구 상태
 * Charge Status
 */
public enum ChargeStatus {
    PENDING,
    PROCESSING,
    PAID,
    OVERDUE,
    REFUNDED
}
