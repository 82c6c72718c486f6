package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.split.model.ReceiverType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수신자별 분배 결과
 * Receiver Split
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiverSplit {

    private Long receiverId;
    private ReceiverType receiverType;
    private String name;
    private String walletId;

    /** 소수점 2자리 */
    private BigDecimal amount;

    /** 총액 대비 비율, 소수점 2자리 */
    private BigDecimal percentage;
}
