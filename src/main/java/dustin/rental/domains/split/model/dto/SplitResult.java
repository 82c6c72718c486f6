package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.split.model.ChargeType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분할 계산 결과
 * Split Result
 *
 * isValid 가 false 이면 errors 에 사유가 담긴다. 결과는 항상 반환되며 예외로 바뀌지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분할 계산 결과")
public class SplitResult {

    private Long configurationId;
    private ChargeType chargeType;
    private BigDecimal grossAmount;

    @Builder.Default
    private List<ReceiverSplit> receivers = new ArrayList<>();

    private BigDecimal totalDistributed;
    private Boolean isValid;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static SplitResult invalid(BigDecimal grossAmount, ChargeType chargeType, String error) {
        return SplitResult.builder()
                .chargeType(chargeType)
                .grossAmount(grossAmount)
                .totalDistributed(BigDecimal.ZERO.setScale(2))
                .isValid(false)
                .errors(new ArrayList<>(List.of(error)))
                .build();
    }
}
