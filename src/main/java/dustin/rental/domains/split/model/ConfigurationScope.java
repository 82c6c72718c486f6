package dustin.rental.domains.split.model;

/**
 * 분할 설정 적용 범위
 * Configuration Scope
 *
 * 활성 설정 조회 우선순위: PER_CONTRACT → PER_PROPERTY → GLOBAL
 */
public enum ConfigurationScope {
    GLOBAL,
    PER_CONTRACT,
    PER_PROPERTY
}
