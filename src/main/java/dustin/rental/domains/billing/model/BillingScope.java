package dustin.rental.domains.billing.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 청구 범위 (기관 또는 개인 소유자 중 정확히 하나)
 * Billing Scope
 */
@Getter
@EqualsAndHashCode
public final class BillingScope {

    private final Long agencyId;
    private final Long ownerId;

    private BillingScope(Long agencyId, Long ownerId) {
        this.agencyId = agencyId;
        this.ownerId = ownerId;
    }

    public static BillingScope of(Long agencyId, Long ownerId) {
        if ((agencyId == null) == (ownerId == null)) {
            throw new IllegalArgumentException("Exactly one of agencyId or ownerId is required");
        }
        return new BillingScope(agencyId, ownerId);
    }

    public static BillingScope agency(Long agencyId) {
        return of(agencyId, null);
    }

    public static BillingScope owner(Long ownerId) {
        return of(null, ownerId);
    }

    /**
     * 예: {@code agency:3}, {@code owner:12}
     */
    public String getScopeKey() {
        return agencyId != null ? "agency:" + agencyId : "owner:" + ownerId;
    }

    @Override
    public String toString() {
        return getScopeKey();
    }
}
