package dustin.rental.domains.split.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.model.SplitRuleType;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitRuleDetail;

/**
 * 분할 설정 검증기 테스트
 * Split Configuration Validator Test
 */
class SplitConfigurationValidatorTest {

    private final SplitConfigurationValidator validator = new SplitConfigurationValidator();

    @Test
    @DisplayName("지갑 있는 수신자 + 활성 규칙 + 비율 합 100% 이하면 통과")
    void validConfiguration() {
        SplitConfigurationValidator.ValidationResult result = validator.validate(configuration(
                receiver(ReceiverType.PLATFORM, null, rule(SplitRuleType.PERCENTAGE, "10", true)),
                receiver(ReceiverType.OWNER, "wallet-owner", rule(SplitRuleType.PERCENTAGE, "90", true))));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getPercentageSum()).isEqualByComparingTo("100");
        assertThat(result.getActiveRuleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("수신자가 없으면 수신자/규칙 오류를 모두 반환")
    void emptyConfiguration() {
        SplitConfigurationValidator.ValidationResult result = validator.validate(configuration());

        assertThat(result.getErrors()).containsExactly(
                "Configuration must have at least one receiver",
                "Configuration must have at least one active rule");
    }

    @Test
    @DisplayName("위반 사항은 첫 번째에서 멈추지 않고 전부 수집")
    void collectsEveryViolation() {
        SplitRuleDetail inverted = rule(SplitRuleType.FIXED, "10", true);
        inverted.setMinimumAmount(new BigDecimal("20"));
        inverted.setMaximumAmount(new BigDecimal("5"));

        SplitConfigurationValidator.ValidationResult result = validator.validate(configuration(
                receiver(ReceiverType.AGENCY, " ", rule(SplitRuleType.PERCENTAGE, "60", true), inverted),
                receiver(ReceiverType.OWNER, "wallet-owner", rule(SplitRuleType.PERCENTAGE, "50.5", true))));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(3);
        assertThat(result.getErrors()).anyMatch(error -> error.contains("has no payout wallet"));
        assertThat(result.getErrors()).anyMatch(error -> error.contains("minimumAmount greater than maximumAmount"));
        assertThat(result.getErrors()).contains("Sum of active percentage rules (110.5%) exceeds 100%");
    }

    @Test
    @DisplayName("비활성 규칙은 비율 합과 활성 규칙 수에서 제외")
    void ignoresInactiveRules() {
        SplitConfigurationValidator.ValidationResult result = validator.validate(configuration(
                receiver(ReceiverType.PLATFORM, null,
                        rule(SplitRuleType.PERCENTAGE, "80", false),
                        rule(SplitRuleType.PERCENTAGE, "30", true)),
                receiver(ReceiverType.OWNER, "wallet-owner", rule(SplitRuleType.PERCENTAGE, "70", true))));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getActiveRuleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("활성 규칙이 하나도 없으면 실패")
    void requiresActiveRule() {
        SplitConfigurationValidator.ValidationResult result = validator.validate(configuration(
                receiver(ReceiverType.OWNER, "wallet-owner", rule(SplitRuleType.FIXED, "10", false))));

        assertThat(result.getErrors()).containsExactly("Configuration must have at least one active rule");
    }

    private SplitConfigurationDetail configuration(SplitReceiverDetail... receivers) {
        return SplitConfigurationDetail.builder()
                .id(1L)
                .receivers(new ArrayList<>(List.of(receivers)))
                .build();
    }

    private SplitReceiverDetail receiver(ReceiverType type, String walletId, SplitRuleDetail... rules) {
        return SplitReceiverDetail.builder()
                .receiverType(type)
                .name(type.name().toLowerCase())
                .walletId(walletId)
                .rules(new ArrayList<>(List.of(rules)))
                .build();
    }

    private SplitRuleDetail rule(SplitRuleType type, String value, boolean active) {
        return SplitRuleDetail.builder()
                .ruleType(type)
                .value(new BigDecimal(value))
                .priority(0)
                .isActive(active)
                .build();
    }
}
