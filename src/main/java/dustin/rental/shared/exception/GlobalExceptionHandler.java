package dustin.rental.shared.exception;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 *
 * 상태 코드 매핑:
 * - 검증 실패 → 400
 * - 권한 부족 → 403
 * - 대상 없음 → 404
 * - 상태 충돌 / 잠긴 수신자 / 동시 활성화 → 409
 * - 분배 합계 불일치 → 422
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SplitValidationException.class)
    public ResponseEntity<Map<String, Object>> handleSplitValidation(SplitValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "Split configuration validation failed", e.getErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return body(HttpStatus.BAD_REQUEST, "Request validation failed", violations);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), List.of(e.getMessage()));
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<Map<String, Object>> handleForbidden(ForbiddenOperationException e) {
        return body(HttpStatus.FORBIDDEN, e.getMessage(), List.of(e.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage(), List.of(e.getMessage()));
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<Map<String, Object>> handleStateConflict(StateConflictException e) {
        return body(HttpStatus.CONFLICT, e.getMessage(), e.getViolations());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("[GlobalExceptionHandler] 무결성 제약 위반: {}", e.getMostSpecificCause().getMessage());
        String message = "Concurrent modification conflict";
        return body(HttpStatus.CONFLICT, message, List.of(message));
    }

    @ExceptionHandler(CalculationInconsistencyException.class)
    public ResponseEntity<Map<String, Object>> handleCalculationInconsistency(CalculationInconsistencyException e) {
        log.error("[GlobalExceptionHandler] 분배 합계 불일치: configurationId={}, totalDistributed={}, grossAmount={}",
                e.getConfigurationId(), e.getTotalDistributed(), e.getGrossAmount());
        ResponseEntity<Map<String, Object>> response =
                body(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.getErrors());
        response.getBody().put("configurationId", e.getConfigurationId());
        response.getBody().put("totalDistributed", e.getTotalDistributed());
        response.getBody().put("grossAmount", e.getGrossAmount());
        return response;
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, List<String> violations) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        error.put("violations", violations);
        error.put("status", status.value());
        return ResponseEntity.status(status).body(error);
    }
}
