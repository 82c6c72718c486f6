package dustin.rental.domains.split.model.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
import dustin.rental.domains.split.model.entity.SplitConfiguration;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 설정 상세 DTO
 * Split Configuration Detail DTO
 *
 * 역할:
 * - API 응답 (설정 + 수신자 + 규칙 트리)
 * - 감사 로그의 before/after 스냅샷
 * - 계산기/검증기의 입력
 *
 * 수신자와 규칙은 id 오름차순으로 정렬되어 있다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 설정 상세 (수신자 및 규칙 포함)")
public class SplitConfigurationDetail {

    private Long id;
    private String token;
    private String name;
    private String description;
    private ConfigurationScope scope;
    private Long agencyId;
    private Long ownerId;
    private Long contractId;
    private Long propertyId;
    private ConfigurationStatus status;
    private Integer version;
    private Long previousVersionId;
    private Boolean isValidated;
    private String validationNotes;
    private String changeReason;
    private String notes;
    private LocalDate effectiveDate;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime validatedAt;
    private String validatedBy;
    private LocalDateTime activatedAt;
    private String activatedBy;
    private LocalDateTime deactivatedAt;
    private String deactivatedBy;
    private LocalDateTime archivedAt;
    private String archivedBy;

    @Builder.Default
    private List<SplitReceiverDetail> receivers = new ArrayList<>();

    public static SplitConfigurationDetail from(SplitConfiguration configuration, List<SplitReceiverDetail> receivers) {
        return SplitConfigurationDetail.builder()
                .id(configuration.getId())
                .token(configuration.getToken())
                .name(configuration.getName())
                .description(configuration.getDescription())
                .scope(configuration.getScope())
                .agencyId(configuration.getAgencyId())
                .ownerId(configuration.getOwnerId())
                .contractId(configuration.getContractId())
                .propertyId(configuration.getPropertyId())
                .status(configuration.getStatus())
                .version(configuration.getVersion())
                .previousVersionId(configuration.getPreviousVersionId())
                .isValidated(configuration.getIsValidated())
                .validationNotes(configuration.getValidationNotes())
                .changeReason(configuration.getChangeReason())
                .notes(configuration.getNotes())
                .effectiveDate(configuration.getEffectiveDate())
                .createdBy(configuration.getCreatedBy())
                .createdAt(configuration.getCreatedAt())
                .validatedAt(configuration.getValidatedAt())
                .validatedBy(configuration.getValidatedBy())
                .activatedAt(configuration.getActivatedAt())
                .activatedBy(configuration.getActivatedBy())
                .deactivatedAt(configuration.getDeactivatedAt())
                .deactivatedBy(configuration.getDeactivatedBy())
                .archivedAt(configuration.getArchivedAt())
                .archivedBy(configuration.getArchivedBy())
                .receivers(new ArrayList<>(receivers))
                .build();
    }
}
