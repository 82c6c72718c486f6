package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.SplitRuleType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 규칙 수정 요청 DTO
 * Update Split Rule Request DTO
 *
 * null 필드는 변경하지 않는다. clearChargeType/clearLimits 로 선택 항목을 비울 수 있다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 규칙 수정 요청")
public class UpdateSplitRuleRequest {

    private SplitRuleType ruleType;

    @DecimalMin(value = "0", message = "규칙 값은 0 이상이어야 합니다")
    private BigDecimal value;

    @DecimalMin(value = "0", message = "최소 금액은 0 이상이어야 합니다")
    private BigDecimal minimumAmount;

    @DecimalMin(value = "0", message = "최대 금액은 0 이상이어야 합니다")
    private BigDecimal maximumAmount;

    private ChargeType chargeType;

    @Schema(description = "true 이면 청구 유형 필터 제거")
    private Boolean clearChargeType;

    @Schema(description = "true 이면 최소/최대 금액 제한 제거")
    private Boolean clearLimits;

    private Integer priority;

    private Boolean isActive;
}
