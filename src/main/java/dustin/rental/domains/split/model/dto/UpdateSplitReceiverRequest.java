package dustin.rental.domains.split.model.dto;

import dustin.rental.domains.split.model.ReceiverType;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분배 수신자 수정 요청 DTO
 * Update Split Receiver Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSplitReceiverRequest {

    private ReceiverType receiverType;

    @Size(max = 255)
    private String name;

    @Size(max = 20)
    private String document;

    private Long userId;

    private Long agencyId;

    @Size(max = 100)
    private String walletId;
}
