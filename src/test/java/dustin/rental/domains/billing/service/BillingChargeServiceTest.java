package dustin.rental.domains.billing.service;

import static dustin.rental.support.SplitFixtures.agencyGlobal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.billing.model.dto.BillingChargeResponse;
import dustin.rental.domains.billing.model.dto.ChargeCreation;
import dustin.rental.domains.billing.model.dto.ChargeDraft;
import dustin.rental.domains.billing.model.dto.GatewayReferenceRequest;
import dustin.rental.domains.billing.model.dto.PaymentWebhookRequest;
import dustin.rental.domains.billing.model.entity.BillingCharge;
import dustin.rental.domains.billing.repository.BillingChargeRepository;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.service.SplitConfigurationService;
import dustin.rental.shared.exception.StateConflictException;
import jakarta.persistence.EntityManager;

/**
 * 청구 서비스 통합 테스트
 * Billing Charge Service Test
 *
 * 테스트 항목:
 * 1. 활성 설정으로 플랫폼 수수료/순액/분할 내역 계산
 * 2. 게이트웨이 등록 후 총액/분할 내역 불변
 * 3. 웹훅 상태 반영, 환불은 PAID 만
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class BillingChargeServiceTest {

    private static final String ACTOR = "billing-admin";

    @Autowired
    private BillingChargeService billingChargeService;

    @Autowired
    private SplitConfigurationService splitConfigurationService;

    @Autowired
    private BillingChargeRepository billingChargeRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    @DisplayName("임대료 청구: 플랫폼 수수료와 분할 내역 저장")
    void createChargeWithSplit() {
        activate(601L, "8");

        ChargeCreation creation = billingChargeService.createCharge(rent(601L, "2500.00"));

        BillingCharge charge = creation.getCharge();
        assertThat(creation.getWarning()).isNull();
        assertThat(charge.getStatus()).isEqualTo(ChargeStatus.PENDING);
        assertThat(charge.getToken()).hasSize(8);
        assertThat(charge.getPlatformFee()).isEqualByComparingTo("200.00");
        assertThat(charge.getNetValue()).isEqualByComparingTo("2300.00");
        assertThat(charge.getDueDate()).hasToString("2024-04-10");
        assertThat(charge.getSplitConfigurationId()).isNotNull();

        BillingChargeResponse response = billingChargeService.findOne(charge.getToken());
        assertThat(response.getId()).isEqualTo(charge.getId());
        assertThat(response.getSplitBreakdown().getIsValid()).isTrue();
        assertThat(response.getSplitBreakdown().getReceivers())
                .extracting(split -> split.getReceiverType())
                .containsExactly(ReceiverType.PLATFORM, ReceiverType.OWNER);
        assertThat(billingChargeService.findOne(charge.getId().toString()).getToken()).isEqualTo(charge.getToken());
    }

    @Test
    @DisplayName("활성 설정이 없으면 수수료 0 으로 저장하고 경고")
    void createChargeWithoutConfiguration() {
        ChargeCreation creation = billingChargeService.createCharge(rent(602L, "100.00"));

        assertThat(creation.getWarning()).contains("No active split configuration");
        assertThat(creation.getCharge().getPlatformFee()).isEqualByComparingTo("0");
        assertThat(creation.getCharge().getNetValue()).isEqualByComparingTo("100.00");
        assertThat(creation.getCharge().getSplitBreakdown()).isNull();
    }

    @Test
    @DisplayName("0 이하 총액은 거부")
    void rejectsNonPositiveGross() {
        assertThatThrownBy(() -> billingChargeService.createCharge(rent(603L, "0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("게이트웨이 등록 후 총액 변경은 저장 시 거부")
    void grossIsImmutableAfterGatewaySubmission() {
        activate(604L, "10");
        BillingCharge charge = billingChargeService.createCharge(rent(604L, "1000.00")).getCharge();
        billingChargeService.attachGatewayReference(charge.getId(), gateway("pay_604"));
        entityManager.flush();

        BillingCharge managed = billingChargeRepository.findById(charge.getId()).orElseThrow();
        assertThat(managed.getStatus()).isEqualTo(ChargeStatus.PROCESSING);
        managed.setGrossValue(new BigDecimal("999.00"));

        assertThatThrownBy(() -> entityManager.flush())
                .hasStackTraceContaining("immutable");
        entityManager.clear();
    }

    @Test
    @DisplayName("게이트웨이 결제는 한 번만 등록")
    void gatewayReferenceOnlyOnce() {
        BillingCharge charge = billingChargeService.createCharge(rent(605L, "50.00")).getCharge();
        billingChargeService.attachGatewayReference(charge.getId(), gateway("pay_605"));

        assertThatThrownBy(() -> billingChargeService.attachGatewayReference(charge.getId(), gateway("pay_605b")))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("결제 확인 웹훅 → PAID, 이후 환불 가능")
    void webhookThenRefund() {
        BillingCharge charge = billingChargeService.createCharge(rent(606L, "80.00")).getCharge();
        assertThatThrownBy(() -> billingChargeService.refund(charge.getId(), "too early"))
                .isInstanceOf(StateConflictException.class);

        billingChargeService.attachGatewayReference(charge.getId(), gateway("pay_606"));
        billingChargeService.handleGatewayEvent(PaymentWebhookRequest.builder()
                .event("PAYMENT_RECEIVED")
                .gatewayPaymentId("pay_606")
                .value(new BigDecimal("80.00"))
                .billingType("PIX")
                .build());

        BillingChargeResponse paid = billingChargeService.findOne(charge.getId().toString());
        assertThat(paid.getStatus()).isEqualTo(ChargeStatus.PAID);
        assertThat(paid.getPaidValue()).isEqualByComparingTo("80.00");
        assertThat(paid.getPaymentMethod()).isEqualTo("PIX");
        assertThat(paid.getLastGatewayEvent()).isEqualTo("PAYMENT_RECEIVED");

        BillingChargeResponse refunded = billingChargeService.refund(charge.getId(), "tenant moved out");
        assertThat(refunded.getStatus()).isEqualTo(ChargeStatus.REFUNDED);
        assertThat(refunded.getRefundedValue()).isEqualByComparingTo("80.00");
        assertThat(refunded.getRefundReason()).isEqualTo("tenant moved out");
    }

    @Test
    @DisplayName("알 수 없는 게이트웨이 결제 웹훅은 무시")
    void unknownWebhookIsIgnored() {
        billingChargeService.handleGatewayEvent(PaymentWebhookRequest.builder()
                .event("PAYMENT_RECEIVED")
                .gatewayPaymentId("pay_unknown")
                .build());

        assertThat(billingChargeRepository.findByGatewayPaymentId("pay_unknown")).isEmpty();
    }

    @Test
    @DisplayName("청구 목록 필터")
    void searchCharges() {
        billingChargeService.createCharge(rent(607L, "10.00"));
        billingChargeService.createCharge(rent(607L, "20.00"));
        billingChargeService.createCharge(rent(608L, "30.00"));

        assertThat(billingChargeService.findAll(607L, null, null, null, ChargeType.RENT, ChargeStatus.PENDING,
                "2024-03", PageRequest.of(0, 10)).getTotalElements()).isEqualTo(2);
    }

    private void activate(Long agencyId, String platformPercent) {
        Long id = splitConfigurationService.create(agencyGlobal("charges-" + agencyId, agencyId, platformPercent),
                ACTOR).getId();
        splitConfigurationService.validate(id, null, ACTOR);
        splitConfigurationService.activate(id, null, ACTOR);
    }

    private ChargeDraft rent(Long agencyId, String gross) {
        return ChargeDraft.builder()
                .agencyId(agencyId)
                .contractId(agencyId * 10)
                .tenantId(agencyId * 100)
                .chargeType(ChargeType.RENT)
                .description("Rent 2024-03")
                .billingMonth("2024-03")
                .grossValue(new BigDecimal(gross))
                .build();
    }

    private GatewayReferenceRequest gateway(String paymentId) {
        return GatewayReferenceRequest.builder()
                .gatewayPaymentId(paymentId)
                .paymentLink("https://pay.example/" + paymentId)
                .build();
    }
}
