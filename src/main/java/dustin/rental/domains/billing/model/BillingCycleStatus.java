package dustin.rental.domains.billing.model;

/**
 * 청구 주기 상태
 * Billing Cycle Status
 *
 * OPEN → CLOSED 단방향 전이
 */
public enum BillingCycleStatus {
    OPEN,
    CLOSED
}
