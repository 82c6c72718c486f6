package dustin.rental.domains.split.model;

/**
 * 분할 규칙 유형
 * Split Rule Type
 */
public enum SplitRuleType {
    /** value 는 총액 대비 백분율. 설정 전체의 활성 백분율 합은 100 이하 */
    PERCENTAGE,
    /** value 는 고정 금액 */
    FIXED
}
