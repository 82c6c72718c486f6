package dustin.rental.domains.split.model;

/**
 * 분배 수신자 유형
 * Receiver Type
 *
 * PLATFORM 이외의 수신자는 정산용 지갑(walletId)이 있어야 검증을 통과한다.
 */
public enum ReceiverType {
    PLATFORM,
    AGENCY,
    OWNER
}
