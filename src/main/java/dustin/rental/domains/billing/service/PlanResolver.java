package dustin.rental.domains.billing.service;

import dustin.rental.domains.billing.model.BillingScope;

/**
 * 범위의 현재 요금제 결정
 * Plan Resolver
 *
 * 구독 관리 시스템과 연동할 때 이 인터페이스의 구현을 교체한다.
 */
public interface PlanResolver {

    String resolvePlan(BillingScope scope);
}
