package dustin.rental.domains.split.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 설정 범위 키
 * Scope Key
 *
 * 범위 종류와 범위 식별자로 만든 정규 문자열. 같은 키를 가진 설정끼리 활성 상태를 다툰다.
 * 예: {@code PER_CONTRACT:a=3:o=-:c=17:p=-}
 */
@Getter
@EqualsAndHashCode
public final class ScopeKey {

    private final ConfigurationScope scope;
    private final Long agencyId;
    private final Long ownerId;
    private final Long contractId;
    private final Long propertyId;

    private ScopeKey(ConfigurationScope scope, Long agencyId, Long ownerId, Long contractId, Long propertyId) {
        this.scope = scope;
        this.agencyId = agencyId;
        this.ownerId = ownerId;
        this.contractId = contractId;
        this.propertyId = propertyId;
    }

    /**
     * 범위 종류에 해당하지 않는 식별자는 버린다.
     * GLOBAL 은 contract/property 를, PER_CONTRACT 는 property 를, PER_PROPERTY 는 contract 를 무시한다.
     */
    public static ScopeKey of(ConfigurationScope scope, Long agencyId, Long ownerId, Long contractId, Long propertyId) {
        switch (scope) {
            case PER_CONTRACT:
                if (contractId == null) {
                    throw new IllegalArgumentException("PER_CONTRACT scope requires contractId");
                }
                return new ScopeKey(scope, agencyId, ownerId, contractId, null);
            case PER_PROPERTY:
                if (propertyId == null) {
                    throw new IllegalArgumentException("PER_PROPERTY scope requires propertyId");
                }
                return new ScopeKey(scope, agencyId, ownerId, null, propertyId);
            default:
                return new ScopeKey(scope, agencyId, ownerId, null, null);
        }
    }

    public static ScopeKey global(Long agencyId, Long ownerId) {
        return of(ConfigurationScope.GLOBAL, agencyId, ownerId, null, null);
    }

    public String asString() {
        return scope.name()
                + ":a=" + part(agencyId)
                + ":o=" + part(ownerId)
                + ":c=" + part(contractId)
                + ":p=" + part(propertyId);
    }

    private static String part(Long id) {
        return id == null ? "-" : id.toString();
    }

    @Override
    public String toString() {
        return asString();
    }
}
