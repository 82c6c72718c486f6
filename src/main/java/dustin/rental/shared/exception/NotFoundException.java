package dustin.rental.shared.exception;

/**
 * 조회 대상 없음 예외
 * Not Found Exception
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
