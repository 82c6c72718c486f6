package dustin.rental.domains.billing.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 게이트웨이 결제 참조 등록 요청 DTO
 * Gateway Reference Request DTO
 *
 * 외부 게이트웨이 클라이언트가 결제를 만든 뒤 호출한다. 등록 후 총액/분할 결과는 불변.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayReferenceRequest {

    @NotBlank(message = "게이트웨이 결제 ID 는 필수입니다")
    private String gatewayPaymentId;

    private String paymentLink;
}
