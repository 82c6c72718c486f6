package dustin.rental.domains.split.model.dto;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 설정 수정 요청 DTO
 * Update Split Configuration Request DTO
 *
 * 이름과 범위는 버전 계보를 결정하므로 수정할 수 없다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSplitConfigurationRequest {

    private String description;

    private LocalDate effectiveDate;

    private String changeReason;

    private String notes;
}
