package dustin.rental.domains.split.model.dto;

import java.util.ArrayList;
import java.util.List;

import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.model.entity.SplitReceiver;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitReceiverDetail {

    private Long id;
    private ReceiverType receiverType;
    private String name;
    private String document;
    private Long userId;
    private Long agencyId;
    private String walletId;
    private Boolean isLocked;

    @Builder.Default
    private List<SplitRuleDetail> rules = new ArrayList<>();

    public static SplitReceiverDetail from(SplitReceiver receiver, List<SplitRuleDetail> rules) {
        return SplitReceiverDetail.builder()
                .id(receiver.getId())
                .receiverType(receiver.getReceiverType())
                .name(receiver.getName())
                .document(receiver.getDocument())
                .userId(receiver.getUserId())
                .agencyId(receiver.getAgencyId())
                .walletId(receiver.getWalletId())
                .isLocked(receiver.getIsLocked())
                .rules(new ArrayList<>(rules))
                .build();
    }
}
