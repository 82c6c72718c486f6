package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.split.model.ChargeType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 계산/미리보기 요청 DTO
 * Calculate Split Request DTO
 *
 * 미리보기(preview)일 때는 범위 식별자로 활성 설정을 찾는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 계산 요청")
public class CalculateSplitRequest {

    @NotNull(message = "총액은 필수입니다")
    @DecimalMin(value = "0", message = "총액은 0 이상이어야 합니다")
    @Schema(description = "총액", example = "1000.00", requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal grossAmount;

    @Schema(description = "청구 유형", example = "RENT")
    private ChargeType chargeType;

    private Long agencyId;

    private Long ownerId;

    private Long contractId;

    private Long propertyId;
}
