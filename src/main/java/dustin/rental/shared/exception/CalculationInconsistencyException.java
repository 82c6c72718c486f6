package dustin.rental.shared.exception;

import java.math.BigDecimal;
import java.util.List;

import lombok.Getter;

/**
 * 분배 합계 불일치 예외
 * Calculation Inconsistency Exception
 *
 * 역할:
 * - 실제 청구 생성 시 분배 합계가 총액과 일치하지 않으면 청구 자체를 차단
 * - 운영자 확인이 필요한 중대 오류
 */
@Getter
public class CalculationInconsistencyException extends RuntimeException {

    private final Long configurationId;
    private final BigDecimal totalDistributed;
    private final BigDecimal grossAmount;
    private final List<String> errors;

    public CalculationInconsistencyException(Long configurationId, BigDecimal totalDistributed,
                                             BigDecimal grossAmount, List<String> errors) {
        super("Split calculation is inconsistent for configuration " + configurationId
                + ": distributed " + totalDistributed + " of " + grossAmount);
        this.configurationId = configurationId;
        this.totalDistributed = totalDistributed;
        this.grossAmount = grossAmount;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
