package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.SplitRuleType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 규칙 생성 요청 DTO
 * Create Split Rule Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 규칙 생성 요청")
public class CreateSplitRuleRequest {

    @NotNull(message = "규칙 유형은 필수입니다 (PERCENTAGE 또는 FIXED)")
    @Schema(description = "규칙 유형", example = "PERCENTAGE", requiredMode = Schema.RequiredMode.REQUIRED)
    private SplitRuleType ruleType;

    @NotNull(message = "규칙 값은 필수입니다")
    @DecimalMin(value = "0", message = "규칙 값은 0 이상이어야 합니다")
    @Schema(description = "백분율(0~100) 또는 고정 금액", example = "10", requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal value;

    @DecimalMin(value = "0", message = "최소 금액은 0 이상이어야 합니다")
    @Schema(description = "최소 배정 금액", example = "5.00")
    private BigDecimal minimumAmount;

    @DecimalMin(value = "0", message = "최대 금액은 0 이상이어야 합니다")
    @Schema(description = "최대 배정 금액", example = "500.00")
    private BigDecimal maximumAmount;

    @Schema(description = "적용 청구 유형 (비우면 전체)", example = "RENT")
    private ChargeType chargeType;

    @Schema(description = "우선순위 (높을수록 먼저 배정)", example = "10")
    private Integer priority;

    @Schema(description = "활성 여부 (기본 true)", example = "true")
    private Boolean isActive;
}
