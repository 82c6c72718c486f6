package dustin.rental.domains.billing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.billing.config.BillingPlanProperties;
import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.BillingScope;
import dustin.rental.domains.billing.model.dto.TrackUsageRequest;
import dustin.rental.domains.billing.model.dto.UsageOverage;
import dustin.rental.domains.billing.model.dto.UsageRecordResponse;
import dustin.rental.domains.billing.model.entity.BillingCycle;
import dustin.rental.domains.billing.model.entity.UsageRecord;
import dustin.rental.domains.billing.repository.UsageRecordRepository;
import dustin.rental.shared.exception.StateConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 사용량 추적 서비스
 * Usage Tracking Service
 *
 * 역할:
 * - 기능 사용 1건(또는 N건)을 현재 월 주기에 기록
 * - 기록 시점의 요금제 단가를 함께 저장
 * - 마감된 주기에는 기록 불가 (주기 행 락으로 마감과 직렬화)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageTrackingService {

    private final UsageRecordRepository usageRecordRepository;
    private final BillingCycleService billingCycleService;
    private final BillingPlanProperties billingPlanProperties;
    private final OverageCalculator overageCalculator;
    private final PlanResolver planResolver;

    @Transactional
    public UsageRecordResponse trackUsage(TrackUsageRequest request) {
        BillingScope scope = BillingScope.of(request.getAgencyId(), request.getOwnerId());
        BillingCycle cycle = billingCycleService.lockCurrentCycle(scope);
        if (cycle.getStatus() != BillingCycleStatus.OPEN) {
            throw new StateConflictException("Billing cycle " + cycle.getBillingMonth() + " for " + scope
                    + " is closed; usage can no longer be recorded");
        }

        int quantity = request.getQuantity() != null ? request.getQuantity() : 1;
        BigDecimal unitPrice = billingPlanProperties.getPlanLimits(cycle.getPlanName()).unitPrice(request.getFeature());
        UsageRecord saved = usageRecordRepository.save(UsageRecord.builder()
                .scopeKey(scope.getScopeKey())
                .agencyId(scope.getAgencyId())
                .ownerId(scope.getOwnerId())
                .feature(request.getFeature())
                .quantity(quantity)
                .unitPrice(unitPrice)
                .totalAmount(unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP))
                .billingMonth(cycle.getBillingMonth())
                .planName(cycle.getPlanName())
                .referenceId(request.getReferenceId())
                .referenceType(request.getReferenceType())
                .build());

        log.debug("[UsageTrackingService] 사용량 기록: scope={}, feature={}, quantity={}, month={}",
                scope, request.getFeature(), quantity, cycle.getBillingMonth());
        return UsageRecordResponse.from(saved);
    }

    /**
     * 지정 월(비우면 이번 달)의 현재 초과 사용량
     */
    @Transactional(readOnly = true)
    public List<UsageOverage> getOverages(BillingScope scope, String billingMonth) {
        String month = billingMonth != null ? billingMonth : YearMonth.now().toString();
        return overageCalculator.calculateOverages(scope, month, planResolver.resolvePlan(scope));
    }
}
