package dustin.rental.domains.split.model.dto;

import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.split.model.ReceiverType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분배 수신자 생성 요청 DTO
 * Create Split Receiver Request DTO
 *
 * isLocked=true 는 RECEIVER_LOCK 권한이 필요하다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "분배 수신자 생성 요청")
public class CreateSplitReceiverRequest {

    @NotNull(message = "수신자 유형은 필수입니다")
    @Schema(description = "수신자 유형", example = "OWNER", requiredMode = Schema.RequiredMode.REQUIRED)
    private ReceiverType receiverType;

    @NotBlank(message = "수신자 이름은 필수입니다")
    @Size(max = 255)
    @Schema(description = "수신자 이름", example = "Maria Souza", requiredMode = Schema.RequiredMode.REQUIRED)
    private String name;

    @Size(max = 20)
    @Schema(description = "CPF/CNPJ", example = "12345678901")
    private String document;

    private Long userId;

    private Long agencyId;

    @Size(max = 100)
    @Schema(description = "결제 게이트웨이 지갑 ID")
    private String walletId;

    @Schema(description = "잠금 여부 (생성 후 수정/삭제 불가)", example = "false")
    private Boolean isLocked;

    @Valid
    @Builder.Default
    private List<CreateSplitRuleRequest> rules = new ArrayList<>();
}
