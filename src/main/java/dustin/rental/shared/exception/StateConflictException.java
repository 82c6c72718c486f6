package dustin.rental.shared.exception;

import java.util.List;

import lombok.Getter;

/**
 * 상태 충돌 예외
 * State Conflict Exception
 *
 * 역할:
 * - 현재 상태에서 허용되지 않는 전이/변경 요청을 거부
 * - 예: ACTIVE 설정 수정, 이미 마감된 청구 주기 재마감
 */
@Getter
public class StateConflictException extends RuntimeException {

    private final List<String> violations;

    public StateConflictException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public StateConflictException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }
}
