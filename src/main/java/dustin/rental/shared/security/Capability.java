package dustin.rental.shared.security;

/**
 * 행위자 권한
 * Actor Capability
 */
public enum Capability {
    /** 분할 설정 생성/수정/삭제 */
    SPLIT_CONFIGURE,
    /** 검증/활성화/비활성화/보관 */
    SPLIT_APPROVE,
    /** 잠긴 수신자 생성 */
    RECEIVER_LOCK,
    /** 청구 주기 마감 */
    BILLING_CLOSE,
    /** 청구/사용량 관리 */
    BILLING_MANAGE
}
