package dustin.rental.domains.split.model.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.split.model.ConfigurationScope;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 설정 생성 요청 DTO
 * Create Split Configuration Request DTO
 *
 * 범위별 필수값:
 * - PER_CONTRACT: contractId
 * - PER_PROPERTY: propertyId
 * - GLOBAL: agencyId/ownerId 선택 (둘 다 없으면 플랫폼 전체 기본 설정)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 설정 생성 요청")
public class CreateSplitConfigurationRequest {

    @NotBlank(message = "설정 이름은 필수입니다")
    @Size(max = 255)
    @Schema(description = "설정 이름 (같은 범위에서 버전 계보를 식별)", example = "Default rent split",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    private String description;

    @NotNull(message = "적용 범위는 필수입니다")
    @Schema(description = "적용 범위", example = "GLOBAL", requiredMode = Schema.RequiredMode.REQUIRED)
    private ConfigurationScope scope;

    private Long agencyId;

    private Long ownerId;

    private Long contractId;

    private Long propertyId;

    private LocalDate effectiveDate;

    private String changeReason;

    private String notes;

    @Valid
    @Builder.Default
    private List<CreateSplitReceiverRequest> receivers = new ArrayList<>();
}
