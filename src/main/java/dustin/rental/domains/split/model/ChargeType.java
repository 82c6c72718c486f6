package dustin.rental.domains.split.model;

/**
 * 청구 유형
 * Charge Type
 *
 * 규칙의 chargeType 이 null 이면 모든 청구 유형에 적용된다.
 */
public enum ChargeType {
    RENT,
    OVERUSE,
    OPERATIONAL_FEE,
    DEPOSIT,
    PENALTY
}
