package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 결제 게이트웨이 웹훅 요청 DTO
 * Payment Webhook Request DTO
 *
 * event: PAYMENT_RECEIVED, PAYMENT_CONFIRMED, PAYMENT_OVERDUE, PAYMENT_REFUNDED
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "결제 게이트웨이 웹훅")
public class PaymentWebhookRequest {

    @NotBlank(message = "이벤트는 필수입니다")
    @Schema(example = "PAYMENT_RECEIVED")
    private String event;

    @NotBlank(message = "게이트웨이 결제 ID 는 필수입니다")
    private String gatewayPaymentId;

    private BigDecimal value;

    @Schema(description = "결제 수단", example = "PIX")
    private String billingType;
}
