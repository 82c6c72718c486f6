package dustin.rental.domains.split.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.model.SplitRuleType;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitRuleDetail;
import lombok.extern.slf4j.Slf4j;

/**
 * 분할 설정 검증기
 * Split Configuration Validator
 *
 * 검증 항목 (모든 위반 사항을 한 번에 보고):
 * =========
 * 1. 수신자가 1명 이상
 * 2. 활성 규칙이 1개 이상
 * 3. 활성 PERCENTAGE 규칙 값의 합 ≤ 100 (청구 유형 구분 없이 설정 전체 기준)
 * 4. PLATFORM 이 아닌 수신자는 지갑(walletId) 필수
 * 5. 최소/최대 금액이 모두 있으면 최소 ≤ 최대
 */
@Slf4j
@Component
public class SplitConfigurationValidator {

    private static final BigDecimal MAX_PERCENTAGE = new BigDecimal("100");

    public ValidationResult validate(SplitConfigurationDetail configuration) {
        ValidationResult result = new ValidationResult();
        List<SplitReceiverDetail> receivers = configuration.getReceivers() == null
                ? List.of()
                : configuration.getReceivers();

        if (receivers.isEmpty()) {
            result.addError("Configuration must have at least one receiver");
        }

        int activeRuleCount = 0;
        BigDecimal percentageSum = BigDecimal.ZERO;

        for (SplitReceiverDetail receiver : receivers) {
            if (receiver.getReceiverType() != ReceiverType.PLATFORM
                    && (receiver.getWalletId() == null || receiver.getWalletId().isBlank())) {
                result.addError("Receiver '" + receiver.getName() + "' (" + receiver.getReceiverType()
                        + ") has no payout wallet");
            }
            if (receiver.getRules() == null) {
                continue;
            }
            for (SplitRuleDetail rule : receiver.getRules()) {
                if (rule.getMinimumAmount() != null && rule.getMaximumAmount() != null
                        && rule.getMinimumAmount().compareTo(rule.getMaximumAmount()) > 0) {
                    result.addError("Rule " + rule.getId() + " of receiver '" + receiver.getName()
                            + "' has minimumAmount greater than maximumAmount");
                }
                if (!Boolean.TRUE.equals(rule.getIsActive())) {
                    continue;
                }
                activeRuleCount++;
                if (rule.getRuleType() == SplitRuleType.PERCENTAGE) {
                    percentageSum = percentageSum.add(rule.getValue());
                }
            }
        }

        if (activeRuleCount == 0) {
            result.addError("Configuration must have at least one active rule");
        }
        if (percentageSum.compareTo(MAX_PERCENTAGE) > 0) {
            result.addError("Sum of active percentage rules (" + percentageSum.stripTrailingZeros().toPlainString()
                    + "%) exceeds 100%");
        }

        result.setPercentageSum(percentageSum);
        result.setActiveRuleCount(activeRuleCount);

        if (!result.isValid()) {
            log.info("[SplitConfigurationValidator] 검증 실패: configurationId={}, errors={}",
                    configuration.getId(), result.getErrors());
        }
        return result;
    }

    /**
     * 검증 결과
     * Validation Result
     */
    public static class ValidationResult {
        private final List<String> errors = new ArrayList<>();
        private BigDecimal percentageSum = BigDecimal.ZERO;
        private int activeRuleCount;

        public void addError(String error) {
            this.errors.add(error);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() { return errors; }

        public BigDecimal getPercentageSum() { return percentageSum; }
        public void setPercentageSum(BigDecimal percentageSum) { this.percentageSum = percentageSum; }

        public int getActiveRuleCount() { return activeRuleCount; }
        public void setActiveRuleCount(int activeRuleCount) { this.activeRuleCount = activeRuleCount; }
    }
}
