package dustin.rental.domains.billing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import dustin.rental.domains.billing.config.BillingPlanProperties;
import dustin.rental.domains.billing.model.BillingScope;
import dustin.rental.domains.billing.model.UsageFeature;
import dustin.rental.domains.billing.model.dto.UsageOverage;
import dustin.rental.domains.billing.repository.UsageRecordRepository;
import lombok.RequiredArgsConstructor;

/**
 * 월별 초과 사용량/운영 수수료 계산
 * Overage Calculator
 *
 * - 초과 요금: 측정 기능마다 max(0, 사용량 - 무료 한도) × 단가
 * - 운영 수수료: 보레토 발행 건수 × 마크업
 */
@Component
@RequiredArgsConstructor
public class OverageCalculator {

    private final UsageRecordRepository usageRecordRepository;
    private final BillingPlanProperties billingPlanProperties;

    public List<UsageOverage> calculateOverages(BillingScope scope, String billingMonth, String planName) {
        BillingPlanProperties.PlanLimits limits = billingPlanProperties.getPlanLimits(planName);
        List<UsageOverage> overages = new ArrayList<>();
        for (UsageFeature feature : UsageFeature.values()) {
            if (!feature.isMetered()) {
                continue;
            }
            long used = usageRecordRepository.sumQuantity(scope.getScopeKey(), billingMonth, feature);
            int freeLimit = limits.freeLimit(feature);
            long overage = Math.max(0, used - freeLimit);
            BigDecimal unitPrice = limits.unitPrice(feature);
            overages.add(UsageOverage.builder()
                    .feature(feature)
                    .used(used)
                    .freeLimit(freeLimit)
                    .overage(overage)
                    .unitPrice(unitPrice)
                    .totalCharge(unitPrice.multiply(BigDecimal.valueOf(overage)).setScale(2, RoundingMode.HALF_UP))
                    .build());
        }
        return overages;
    }

    public BigDecimal totalOverageCharge(List<UsageOverage> overages) {
        return overages.stream()
                .map(UsageOverage::getTotalCharge)
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    }

    /**
     * 월 보레토 발행 건수 (int 범위를 넘으면 ArithmeticException 으로 마감 중단)
     */
    public int countBoletos(BillingScope scope, String billingMonth) {
        return Math.toIntExact(usageRecordRepository.sumQuantity(scope.getScopeKey(), billingMonth, UsageFeature.BOLETOS));
    }

    public BigDecimal operationalFee(int boletoCount) {
        return billingPlanProperties.getBoletoMarkup()
                .multiply(BigDecimal.valueOf(boletoCount))
                .setScale(2, RoundingMode.HALF_UP);
    }
}
