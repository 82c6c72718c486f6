package dustin.rental.domains.split.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상태 전이 요청 DTO (검증/활성화/비활성화/보관/삭제)
 * Lifecycle Action Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleActionRequest {

    @Schema(description = "변경 사유 (감사 로그에 기록)", example = "Contract renegotiated")
    private String reason;

    @Schema(description = "검증 메모 (validate 전용)")
    private String notes;
}
