package dustin.rental.domains.billing.model.dto;

import dustin.rental.domains.billing.model.UsageFeature;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용량 기록 요청 DTO
 * Track Usage Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "사용량 기록 요청 (agencyId 또는 ownerId 중 하나)")
public class TrackUsageRequest {

    private Long agencyId;

    private Long ownerId;

    @NotNull(message = "기능은 필수입니다")
    @Schema(description = "사용 기능", example = "INSPECTIONS", requiredMode = Schema.RequiredMode.REQUIRED)
    private UsageFeature feature;

    @Min(value = 1, message = "수량은 1 이상이어야 합니다")
    @Schema(description = "수량 (기본 1)", example = "1")
    private Integer quantity;

    @Schema(description = "원본 참조 ID (예: 점검 ID)")
    private String referenceId;

    @Schema(description = "원본 참조 유형", example = "INSPECTION")
    private String referenceType;
}
