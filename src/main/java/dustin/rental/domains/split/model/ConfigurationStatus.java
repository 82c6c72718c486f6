package dustin.rental.domains.split.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 분할 설정 상태
 * Configuration Status
 *
 * DRAFT → VALIDATED → ACTIVE ⇄ INACTIVE, 그리고 ACTIVE 가 아닌 상태 → ARCHIVED (종료 상태)
 */
@Getter
@RequiredArgsConstructor
public enum ConfigurationStatus {
    DRAFT(true),
    VALIDATED(true),
    ACTIVE(false),
    INACTIVE(true),
    ARCHIVED(false);

    /**
     * 수신자/규칙/기본 정보 수정 가능 여부
     */
    private final boolean editable;
}
