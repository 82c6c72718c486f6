package dustin.rental.domains.split.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.SplitRuleType;
import dustin.rental.domains.split.model.dto.ReceiverSplit;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitResult;
import dustin.rental.domains.split.model.dto.SplitRuleDetail;

/**
 * 분할 계산기
 * Split Calculator
 *
 * 역할:
 * - 총액을 설정의 규칙에 따라 수신자별 금액으로 분배
 * - 분배 합계와 총액 일치 여부 판단 (허용 오차 0.01)
 *
 * 계산 순서:
 * ==========
 * 1. 활성 규칙 중 청구 유형이 맞는 (수신자, 규칙) 쌍 수집
 * 2. 우선순위 내림차순 정렬 (동순위는 입력 순서 유지)
 * 3. 규칙별 금액 계산 → 최소/최대 제한 → 남은 금액으로 상한
 * 4. 수신자별 합계를 마지막에 한 번만 반올림 (HALF_UP, 소수점 2자리)
 *
 * 순수 함수이며 상태를 가지지 않는다. 리포지토리에 접근하지 않는다.
 */
@Component
public class SplitCalculator {

    public static final int MONEY_SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    public SplitResult calculate(SplitConfigurationDetail configuration, BigDecimal grossAmount, ChargeType chargeType) {
        Objects.requireNonNull(configuration, "configuration");
        if (grossAmount == null || grossAmount.signum() < 0) {
            throw new IllegalArgumentException("Gross amount must be zero or positive: " + grossAmount);
        }

        List<SplitReceiverDetail> receivers = configuration.getReceivers() == null
                ? List.of()
                : configuration.getReceivers();

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 1. 적용 대상 (수신자, 규칙) 수집
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        List<Assignment> assignments = new ArrayList<>();
        for (int index = 0; index < receivers.size(); index++) {
            SplitReceiverDetail receiver = receivers.get(index);
            if (receiver.getRules() == null) {
                continue;
            }
            for (SplitRuleDetail rule : receiver.getRules()) {
                if (applies(rule, chargeType)) {
                    assignments.add(new Assignment(index, rule));
                }
            }
        }

        if (assignments.isEmpty()) {
            SplitResult empty = SplitResult.invalid(grossAmount, chargeType,
                    "No applicable split rules" + (chargeType == null ? "" : " for charge type " + chargeType));
            empty.setConfigurationId(configuration.getId());
            return empty;
        }

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 2. 우선순위 내림차순 (List.sort 는 안정 정렬)
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        assignments.sort(Comparator.comparingInt(Assignment::priority).reversed());

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 3. 배정
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        BigDecimal[] totals = new BigDecimal[receivers.size()];
        BigDecimal[] declaredPercentages = new BigDecimal[receivers.size()];
        BigDecimal remaining = grossAmount;

        for (Assignment assignment : assignments) {
            SplitRuleDetail rule = assignment.rule();
            BigDecimal amount = ruleAmount(rule, grossAmount);

            if (rule.getMaximumAmount() != null && amount.compareTo(rule.getMaximumAmount()) > 0) {
                amount = rule.getMaximumAmount();
            }
            if (rule.getMinimumAmount() != null && amount.compareTo(rule.getMinimumAmount()) < 0) {
                amount = rule.getMinimumAmount();
            }
            if (amount.compareTo(remaining) > 0) {
                amount = remaining;
            }

            int index = assignment.receiverIndex();
            totals[index] = totals[index] == null ? amount : totals[index].add(amount);
            if (rule.getRuleType() == SplitRuleType.PERCENTAGE) {
                BigDecimal declared = declaredPercentages[index];
                declaredPercentages[index] = declared == null ? rule.getValue() : declared.add(rule.getValue());
            }
            remaining = remaining.subtract(amount);
        }

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 4. 수신자별 반올림 및 합계 검증
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        List<ReceiverSplit> splits = new ArrayList<>();
        BigDecimal totalDistributed = BigDecimal.ZERO.setScale(MONEY_SCALE);
        for (int index = 0; index < receivers.size(); index++) {
            if (totals[index] == null) {
                continue;
            }
            SplitReceiverDetail receiver = receivers.get(index);
            BigDecimal amount = totals[index].setScale(MONEY_SCALE, ROUNDING);
            splits.add(ReceiverSplit.builder()
                    .receiverId(receiver.getId())
                    .receiverType(receiver.getReceiverType())
                    .name(receiver.getName())
                    .walletId(receiver.getWalletId())
                    .amount(amount)
                    .percentage(percentage(amount, grossAmount, declaredPercentages[index]))
                    .build());
            totalDistributed = totalDistributed.add(amount);
        }

        List<String> errors = new ArrayList<>();
        if (totalDistributed.subtract(grossAmount).abs().compareTo(TOLERANCE) > 0) {
            errors.add("Total distributed (" + totalDistributed + ") does not match gross amount ("
                    + grossAmount + ")");
        }

        return SplitResult.builder()
                .configurationId(configuration.getId())
                .chargeType(chargeType)
                .grossAmount(grossAmount)
                .receivers(splits)
                .totalDistributed(totalDistributed)
                .isValid(errors.isEmpty())
                .errors(errors)
                .build();
    }

    private boolean applies(SplitRuleDetail rule, ChargeType chargeType) {
        if (!Boolean.TRUE.equals(rule.getIsActive())) {
            return false;
        }
        return chargeType == null || rule.getChargeType() == null || rule.getChargeType() == chargeType;
    }

    private BigDecimal ruleAmount(SplitRuleDetail rule, BigDecimal grossAmount) {
        if (rule.getRuleType() == SplitRuleType.PERCENTAGE) {
            return grossAmount.multiply(rule.getValue()).movePointLeft(2);
        }
        return rule.getValue();
    }

    private BigDecimal percentage(BigDecimal amount, BigDecimal grossAmount, BigDecimal declared) {
        if (grossAmount.signum() > 0) {
            return amount.multiply(ONE_HUNDRED).divide(grossAmount, MONEY_SCALE, ROUNDING);
        }
        return declared == null
                ? BigDecimal.ZERO.setScale(MONEY_SCALE)
                : declared.setScale(MONEY_SCALE, ROUNDING);
    }

    private static final class Assignment {

        private final int receiverIndex;
        private final SplitRuleDetail rule;

        private Assignment(int receiverIndex, SplitRuleDetail rule) {
            this.receiverIndex = receiverIndex;
            this.rule = rule;
        }

        int receiverIndex() {
            return receiverIndex;
        }

        SplitRuleDetail rule() {
            return rule;
        }

        int priority() {
            return rule.getPriority() == null ? 0 : rule.getPriority();
        }
    }
}
