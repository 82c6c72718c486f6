package dustin.rental.domains.billing.service;

import org.springframework.stereotype.Component;

import dustin.rental.domains.billing.config.BillingPlanProperties;
import dustin.rental.domains.billing.model.BillingScope;
import lombok.RequiredArgsConstructor;

/**
 * 설정 파일 기반 요금제 결정 (billing.assignments → billing.default-plan)
 */
@Component
@RequiredArgsConstructor
public class ConfiguredPlanResolver implements PlanResolver {

    private final BillingPlanProperties billingPlanProperties;

    @Override
    public String resolvePlan(BillingScope scope) {
        return billingPlanProperties.getAssignments()
                .getOrDefault(scope.getScopeKey(), billingPlanProperties.getDefaultPlan());
    }
}
