package dustin.rental.domains.billing.model.dto;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청구 주기 마감 결과
 * Closed Cycle Result
 *
 * warnings: 활성 분할 설정이 없어 플랫폼 수수료 0 으로 기록된 청구 등
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosedCycleResult {

    private BillingCycleResponse cycle;

    @Builder.Default
    private List<BillingChargeResponse> charges = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
