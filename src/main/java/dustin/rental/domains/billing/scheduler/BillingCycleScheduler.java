package dustin.rental.domains.billing.scheduler;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.rental.domains.billing.model.dto.ClosedCycleResult;
import dustin.rental.domains.billing.service.BillingCycleService;
import dustin.rental.shared.exception.StateConflictException;
import dustin.rental.shared.security.ActorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 청구 주기 마감 스케줄러
 * Billing Cycle Scheduler
 *
 * 역할:
 * - 매월 1일에 지난 달 이전의 OPEN 주기를 모두 마감
 * - 이미 마감된 주기(동시 수동 마감)는 건너뜀
 *
 * 실행 시점:
 * - billing.close-cron (기본 "0 0 1 1 * ?" = 매월 1일 01:00)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BillingCycleScheduler {

    private final BillingCycleService billingCycleService;

    /**
     * 지난 달 청구 주기 마감 배치 (재시도 지원)
     * Close previous month cycles (with Retry)
     *
     * 재시도 전략:
     * - 최대 3회, 지수 백오프 2초 → 4초
     * - 각 주기 마감은 독립 트랜잭션이라 재시도 시 이미 마감된 주기는 건너뜀
     */
    @Scheduled(cron = "${billing.close-cron:0 0 1 1 * ?}")
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public void closePreviousMonthCycles() {
        closeOpenCyclesBefore(YearMonth.now().toString());
    }

    /**
     * 지정 월 이전의 OPEN 주기 마감
     *
     * @param billingMonth 이 월(YYYY-MM)보다 앞선 주기만 마감
     * @return 이번 실행에서 마감된 주기 수
     */
    public int closeOpenCyclesBefore(String billingMonth) {
        List<Long> cycleIds = billingCycleService.findOpenCycleIdsBefore(billingMonth);
        log.info("[BillingCycleScheduler] 청구 주기 마감 시작: before={}, 대상 주기 수={}", billingMonth, cycleIds.size());

        int closedCount = 0;
        List<Long> failedCycleIds = new ArrayList<>();
        for (Long cycleId : cycleIds) {
            try {
                ClosedCycleResult result = billingCycleService.closeCycle(cycleId, ActorContext.SYSTEM_ACTOR);
                closedCount++;
                for (String warning : result.getWarnings()) {
                    log.warn("[BillingCycleScheduler] 마감 경고: cycleId={}, warning={}", cycleId, warning);
                }
            } catch (StateConflictException e) {
                log.info("[BillingCycleScheduler] 이미 마감된 주기 건너뜀: cycleId={}", cycleId);
            } catch (RuntimeException e) {
                // 개별 주기 실패는 나머지 주기 마감을 막지 않음
                log.error("[BillingCycleScheduler] 청구 주기 마감 실패: cycleId={}", cycleId, e);
                failedCycleIds.add(cycleId);
            }
        }

        log.info("[BillingCycleScheduler] 청구 주기 마감 완료: closed={}, failed={}", closedCount, failedCycleIds);
        if (!failedCycleIds.isEmpty()) {
            throw new IllegalStateException("Failed to close billing cycles: " + failedCycleIds);
        }
        return closedCount;
    }

    @Recover
    public void recoverClosePreviousMonthCycles(RuntimeException e) {
        log.error("[BillingCycleScheduler] 청구 주기 마감 재시도 실패", e);
    }
}
