package dustin.rental.domains.billing.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.YearMonth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.entity.BillingCycle;
import dustin.rental.domains.billing.repository.BillingCycleRepository;

/**
 * 청구 주기 마감 스케줄러 테스트
 * Billing Cycle Scheduler Test
 *
 * 지난 달 이전의 OPEN 주기만 마감하는지 검증 (스케줄 자체는 test 프로필에서 비활성)
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class BillingCycleSchedulerTest {

    @Autowired
    private BillingCycleScheduler billingCycleScheduler;

    @Autowired
    private BillingCycleRepository billingCycleRepository;

    @Test
    @DisplayName("이전 월의 OPEN 주기는 마감, 현재 월 주기는 유지")
    void closesOnlyPastOpenCycles() {
        BillingCycle past = billingCycleRepository.save(cycle(801L, "2019-06"));
        BillingCycle current = billingCycleRepository.save(cycle(802L, YearMonth.now().toString()));

        int closed = billingCycleScheduler.closeOpenCyclesBefore(YearMonth.now().toString());

        assertThat(closed).isGreaterThanOrEqualTo(1);
        BillingCycle reloadedPast = billingCycleRepository.findById(past.getId()).orElseThrow();
        assertThat(reloadedPast.getStatus()).isEqualTo(BillingCycleStatus.CLOSED);
        assertThat(reloadedPast.getClosedBy()).isEqualTo("SYSTEM");
        assertThat(billingCycleRepository.findById(current.getId()).orElseThrow().getStatus())
                .isEqualTo(BillingCycleStatus.OPEN);
    }

    @Test
    @DisplayName("마감된 주기는 다시 선택되지 않음")
    void skipsClosedCycles() {
        BillingCycle past = billingCycleRepository.save(cycle(803L, "2019-07"));
        billingCycleScheduler.closeOpenCyclesBefore("2019-08");

        billingCycleScheduler.closeOpenCyclesBefore("2019-08");

        assertThat(billingCycleRepository.findById(past.getId()).orElseThrow().getStatus())
                .isEqualTo(BillingCycleStatus.CLOSED);
        assertThat(billingCycleRepository.findIdsByStatusAndBillingMonthBefore(BillingCycleStatus.OPEN, "2019-08"))
                .doesNotContain(past.getId());
    }

    private BillingCycle cycle(Long agencyId, String billingMonth) {
        return BillingCycle.builder()
                .agencyId(agencyId)
                .scopeKey("agency:" + agencyId)
                .billingMonth(billingMonth)
                .status(BillingCycleStatus.OPEN)
                .planName("FREE")
                .build();
    }
}
