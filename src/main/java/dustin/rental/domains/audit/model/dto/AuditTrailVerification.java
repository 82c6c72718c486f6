package dustin.rental.domains.audit.model.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 감사 이력 무결성 검증 결과
 * Audit Trail Verification
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditTrailVerification {

    private Long configurationId;
    private int totalEntries;
    private Boolean intact;

    @Builder.Default
    private List<Long> tamperedEntryIds = new ArrayList<>();
}
