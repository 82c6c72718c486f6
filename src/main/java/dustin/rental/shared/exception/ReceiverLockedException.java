package dustin.rental.shared.exception;

import lombok.Getter;

/**
 * 잠긴 수신자 변경 시도 예외
 * Receiver Locked Exception
 */
@Getter
public class ReceiverLockedException extends StateConflictException {

    private final Long receiverId;

    public ReceiverLockedException(Long receiverId) {
        super("Receiver " + receiverId + " is locked and cannot be modified or removed");
        this.receiverId = receiverId;
    }
}
