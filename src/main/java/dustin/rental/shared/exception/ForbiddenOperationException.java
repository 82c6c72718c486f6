package dustin.rental.shared.exception;

/**
 * 권한 부족 예외
 * Forbidden Operation Exception
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
