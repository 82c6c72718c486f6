package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import dustin.rental.domains.split.model.ChargeType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청구 생성 요청 DTO
 * Create Charge Request DTO
 *
 * 범위의 활성 분할 설정으로 플랫폼 수수료를 계산한 뒤 저장한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "청구 생성 요청")
public class CreateChargeRequest {

    private Long agencyId;

    private Long ownerId;

    private Long contractId;

    private Long propertyId;

    private Long tenantId;

    @NotNull(message = "청구 유형은 필수입니다")
    @Schema(description = "청구 유형", example = "RENT", requiredMode = Schema.RequiredMode.REQUIRED)
    private ChargeType chargeType;

    private String description;

    @Pattern(regexp = "^\\d{4}-(0[1-9]|1[0-2])$", message = "청구 월은 YYYY-MM 형식이어야 합니다")
    @Schema(description = "청구 월 (비우면 이번 달)", example = "2026-10")
    private String billingMonth;

    @NotNull(message = "총액은 필수입니다")
    @DecimalMin(value = "0", inclusive = false, message = "총액은 0보다 커야 합니다")
    @Schema(description = "총액", example = "2500.00", requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal grossValue;

    @Schema(description = "납부 기한 (비우면 다음 달 기본 납부일)")
    private LocalDate dueDate;

    public ChargeDraft toDraft() {
        return ChargeDraft.builder()
                .agencyId(agencyId)
                .ownerId(ownerId)
                .contractId(contractId)
                .propertyId(propertyId)
                .tenantId(tenantId)
                .chargeType(chargeType)
                .description(description)
                .billingMonth(billingMonth)
                .grossValue(grossValue)
                .dueDate(dueDate)
                .build();
    }
}
