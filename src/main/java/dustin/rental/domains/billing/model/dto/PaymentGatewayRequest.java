package dustin.rental.domains.billing.model.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import dustin.rental.domains.split.model.dto.SplitResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 결제 게이트웨이 클라이언트로 전달하는 결제 생성 요청
 * Payment Gateway Request
 *
 * customerId: 임차인 청구는 tenant, 플랫폼 청구(OVERUSE/OPERATIONAL_FEE)는 agency/owner 범위 키
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentGatewayRequest {

    private Long chargeId;
    private String chargeToken;
    private String customerId;
    private BigDecimal amount;
    private LocalDate dueDate;
    private String description;
    private SplitResult splitBreakdown;
}
