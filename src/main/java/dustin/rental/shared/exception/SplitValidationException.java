package dustin.rental.shared.exception;

import java.util.List;

import lombok.Getter;

/**
 * 분할 설정 검증 실패 예외
 * Split Validation Exception
 *
 * 위반 사항 전체 목록을 함께 전달한다.
 */
@Getter
public class SplitValidationException extends RuntimeException {

    private final List<String> errors;

    public SplitValidationException(List<String> errors) {
        super("Split configuration validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
