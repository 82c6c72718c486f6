package dustin.rental.domains.billing.service;

import static dustin.rental.support.SplitFixtures.agencyGlobal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.BillingScope;
import dustin.rental.domains.billing.model.UsageFeature;
import dustin.rental.domains.billing.model.dto.BillingChargeResponse;
import dustin.rental.domains.billing.model.dto.ClosedCycleResult;
import dustin.rental.domains.billing.model.entity.BillingCycle;
import dustin.rental.domains.billing.model.entity.UsageRecord;
import dustin.rental.domains.billing.repository.BillingChargeRepository;
import dustin.rental.domains.billing.repository.UsageRecordRepository;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.dto.CreateSplitConfigurationRequest;
import dustin.rental.domains.split.service.SplitConfigurationService;
import dustin.rental.shared.exception.CalculationInconsistencyException;
import dustin.rental.shared.exception.StateConflictException;

/**
 * 청구 주기 서비스 통합 테스트
 * Billing Cycle Service Test
 *
 * 주기 생성은 별도 트랜잭션으로 커밋되므로 테스트마다 다른 기관 ID 를 사용한다.
 *
 * 테스트 항목:
 * 1. (범위, 월) 주기 멱등 생성, 요금제 지정
 * 2. 마감 시 초과 사용량/운영 수수료 청구 생성과 플랫폼 수수료
 * 3. 중복 마감 차단, 활성 설정 없음 경고, 분할 합계 불일치 차단
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class BillingCycleServiceTest {

    private static final String MONTH = "2020-01";
    private static final String ACTOR = "billing-admin";

    @Autowired
    private BillingCycleService billingCycleService;

    @Autowired
    private SplitConfigurationService splitConfigurationService;

    @Autowired
    private UsageRecordRepository usageRecordRepository;

    @Autowired
    private BillingChargeRepository billingChargeRepository;

    @Test
    @DisplayName("같은 (범위, 월) 주기는 한 번만 생성")
    void getOrCreateIsIdempotent() {
        BillingScope scope = BillingScope.agency(301L);

        BillingCycle first = billingCycleService.getOrCreateCycle(scope, MONTH);
        BillingCycle second = billingCycleService.getOrCreateCycle(scope, MONTH);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getStatus()).isEqualTo(BillingCycleStatus.OPEN);
        assertThat(first.getPlanName()).isEqualTo("FREE");
    }

    @Test
    @DisplayName("범위에 지정된 요금제로 주기 생성")
    void usesAssignedPlan() {
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.agency(9001L), MONTH);

        assertThat(cycle.getPlanName()).isEqualTo("PROFESSIONAL");
    }

    @Test
    @DisplayName("마감: 초과 사용량 + 보레토 수수료 청구, 활성 설정으로 플랫폼 수수료 계산")
    void closeCreatesCharges() {
        Long agencyId = 302L;
        activate(agencyGlobal("billing-302", agencyId, "10"));
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.agency(agencyId), MONTH);
        recordUsage(agencyId, UsageFeature.INSPECTIONS, 5);
        recordUsage(agencyId, UsageFeature.SETTLEMENTS, 1);
        recordUsage(agencyId, UsageFeature.BOLETOS, 10);

        ClosedCycleResult result = billingCycleService.closeCycle(cycle.getId(), ACTOR);

        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getCharges()).extracting(BillingChargeResponse::getChargeType)
                .containsExactly(ChargeType.OVERUSE, ChargeType.OPERATIONAL_FEE);

        BillingChargeResponse overuse = result.getCharges().get(0);
        assertThat(overuse.getGrossValue()).isEqualByComparingTo("15.00");
        assertThat(overuse.getPlatformFee()).isEqualByComparingTo("1.50");
        assertThat(overuse.getNetValue()).isEqualByComparingTo("13.50");
        assertThat(overuse.getDescription()).isEqualTo("Extra usage - inspections: 3 units x R$5.00");
        assertThat(overuse.getBillingCycleId()).isEqualTo(cycle.getId());
        assertThat(overuse.getDueDate()).hasToString("2020-02-10");

        BillingChargeResponse operational = result.getCharges().get(1);
        assertThat(operational.getGrossValue()).isEqualByComparingTo("15.10");
        assertThat(operational.getPlatformFee()).isEqualByComparingTo("1.51");

        assertThat(result.getCycle().getStatus()).isEqualTo(BillingCycleStatus.CLOSED);
        assertThat(result.getCycle().getClosedBy()).isEqualTo(ACTOR);
        assertThat(result.getCycle().getBoletoCount()).isEqualTo(10);
        assertThat(result.getCycle().getOveruseChargeValue()).isEqualByComparingTo("15.00");
        assertThat(result.getCycle().getOperationalCharges()).isEqualByComparingTo("15.10");
        assertThat(result.getCycle().getTotalPlatformFee()).isEqualByComparingTo("3.01");
        assertThat(result.getCycle().getChargeIds()).hasSize(2);
        assertThat(result.getCycle().getUsage()).hasSize(4);
    }

    @Test
    @DisplayName("이미 마감된 주기는 다시 마감할 수 없고 청구도 추가되지 않음")
    void closeIsOneShot() {
        Long agencyId = 303L;
        activate(agencyGlobal("billing-303", agencyId, "10"));
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.agency(agencyId), MONTH);
        recordUsage(agencyId, UsageFeature.BOLETOS, 2);

        billingCycleService.closeCycle(cycle.getId(), ACTOR);

        assertThatThrownBy(() -> billingCycleService.closeCycle(cycle.getId(), ACTOR))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("already closed");
        assertThat(billingChargeRepository.findByBillingCycleIdOrderByIdAsc(cycle.getId())).hasSize(1);
    }

    @Test
    @DisplayName("사용량이 없으면 청구 없이 마감")
    void closeWithoutUsage() {
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.owner(304L), MONTH);

        ClosedCycleResult result = billingCycleService.closeCycle(cycle.getId(), ACTOR);

        assertThat(result.getCharges()).isEmpty();
        assertThat(result.getCycle().getStatus()).isEqualTo(BillingCycleStatus.CLOSED);
        assertThat(result.getCycle().getTotalPlatformFee()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("활성 분할 설정이 없으면 플랫폼 수수료 0 과 경고")
    void closeWithoutConfigurationWarns() {
        Long agencyId = 305L;
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.agency(agencyId), MONTH);
        recordUsage(agencyId, UsageFeature.SCREENINGS, 1);

        ClosedCycleResult result = billingCycleService.closeCycle(cycle.getId(), ACTOR);

        assertThat(result.getCharges()).hasSize(1);
        assertThat(result.getCharges().get(0).getPlatformFee()).isEqualByComparingTo("0");
        assertThat(result.getCharges().get(0).getSplitConfigurationId()).isNull();
        assertThat(result.getWarnings()).singleElement().asString().contains("No active split configuration");
    }

    @Test
    @DisplayName("분할 합계가 총액과 다르면 청구 생성 차단, 주기는 OPEN 유지")
    void inconsistentSplitBlocksClose() {
        Long agencyId = 306L;
        // 10% + 80%: 검증은 통과하지만 총액의 90% 만 배분
        CreateSplitConfigurationRequest underAllocated = agencyGlobal("billing-306", agencyId, "10");
        underAllocated.getReceivers().get(1).getRules().get(0).setValue(new BigDecimal("80"));
        activate(underAllocated);
        BillingCycle cycle = billingCycleService.getOrCreateCycle(BillingScope.agency(agencyId), MONTH);
        recordUsage(agencyId, UsageFeature.INSPECTIONS, 4);

        assertThatThrownBy(() -> billingCycleService.closeCycle(cycle.getId(), ACTOR))
                .isInstanceOfSatisfying(CalculationInconsistencyException.class, e -> {
                    assertThat(e.getGrossAmount()).isEqualByComparingTo("10.00");
                    assertThat(e.getTotalDistributed()).isEqualByComparingTo("9.00");
                });
        assertThat(billingCycleService.findOne(cycle.getId()).getStatus()).isEqualTo(BillingCycleStatus.OPEN);
    }

    private void activate(CreateSplitConfigurationRequest request) {
        Long id = splitConfigurationService.create(request, ACTOR).getId();
        splitConfigurationService.validate(id, null, ACTOR);
        splitConfigurationService.activate(id, null, ACTOR);
    }

    private void recordUsage(Long agencyId, UsageFeature feature, int quantity) {
        usageRecordRepository.save(UsageRecord.builder()
                .scopeKey(BillingScope.agency(agencyId).getScopeKey())
                .agencyId(agencyId)
                .feature(feature)
                .quantity(quantity)
                .unitPrice(BigDecimal.ZERO)
                .totalAmount(BigDecimal.ZERO)
                .billingMonth(MONTH)
                .planName("FREE")
                .build());
    }
}
