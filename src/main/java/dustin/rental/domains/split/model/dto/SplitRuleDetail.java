package dustin.rental.domains.split.model.dto;

import java.math.BigDecimal;

import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.SplitRuleType;
import dustin.rental.domains.split.model.entity.SplitRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitRuleDetail {

    private Long id;
    private Long receiverId;
    private SplitRuleType ruleType;
    private BigDecimal value;
    private BigDecimal minimumAmount;
    private BigDecimal maximumAmount;
    private ChargeType chargeType;
    private Integer priority;
    private Boolean isActive;

    public static SplitRuleDetail from(SplitRule rule) {
        return SplitRuleDetail.builder()
                .id(rule.getId())
                .receiverId(rule.getReceiverId())
                .ruleType(rule.getRuleType())
                .value(rule.getValue())
                .minimumAmount(rule.getMinimumAmount())
                .maximumAmount(rule.getMaximumAmount())
                .chargeType(rule.getChargeType())
                .priority(rule.getPriority())
                .isActive(rule.getIsActive())
                .build();
    }
}
