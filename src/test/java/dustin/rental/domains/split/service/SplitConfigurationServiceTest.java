package dustin.rental.domains.split.service;

import static dustin.rental.support.SplitFixtures.agencyGlobal;
import static dustin.rental.support.SplitFixtures.configuration;
import static dustin.rental.support.SplitFixtures.fixed;
import static dustin.rental.support.SplitFixtures.percentage;
import static dustin.rental.support.SplitFixtures.receiver;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.entity.SplitAuditLog;
import dustin.rental.domains.audit.repository.SplitAuditLogRepository;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.model.dto.CreateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitResult;
import dustin.rental.domains.split.model.dto.UpdateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.UpdateSplitReceiverRequest;
import dustin.rental.shared.exception.ReceiverLockedException;
import dustin.rental.shared.exception.SplitValidationException;
import dustin.rental.shared.exception.StateConflictException;
import jakarta.persistence.EntityManager;

/**
 * 분할 설정 서비스 통합 테스트
 * Split Configuration Service Test
 *
 * 테스트 항목:
 * 1. DRAFT → VALIDATED → ACTIVE → INACTIVE → ARCHIVED 전이
 * 2. 범위당 ACTIVE 하나 (기존 활성 설정 강등)
 * 3. ACTIVE/ARCHIVED 변경 차단, 잠긴 수신자 변경 차단
 * 4. 새 버전, 범위 해석 우선순위, 감사 로그
 * 5. 동시 활성화 충돌 (active_scope_key 유니크 제약)
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SplitConfigurationServiceTest {

    private static final String ACTOR = "admin-1";

    @Autowired
    private SplitConfigurationService splitConfigurationService;

    @Autowired
    private SplitAuditLogRepository splitAuditLogRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    @DisplayName("생성 → 검증 → 활성화, 활성 설정으로 범위 해석")
    void lifecycleToActive() {
        SplitConfigurationDetail created = splitConfigurationService.create(agencyGlobal("standard", 101L, "10"), ACTOR);
        assertThat(created.getStatus()).isEqualTo(ConfigurationStatus.DRAFT);
        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getIsValidated()).isFalse();
        assertThat(created.getReceivers()).hasSize(2);

        SplitConfigurationDetail validated = splitConfigurationService.validate(created.getId(), "ok", ACTOR);
        assertThat(validated.getStatus()).isEqualTo(ConfigurationStatus.VALIDATED);
        assertThat(validated.getIsValidated()).isTrue();

        SplitConfigurationDetail active = splitConfigurationService.activate(created.getId(), "go live", ACTOR);
        assertThat(active.getStatus()).isEqualTo(ConfigurationStatus.ACTIVE);
        assertThat(active.getActivatedBy()).isEqualTo(ACTOR);

        assertThat(splitConfigurationService.findActiveForScope(101L, null, null, null))
                .get().extracting(SplitConfigurationDetail::getId).isEqualTo(created.getId());
    }

    @Test
    @DisplayName("같은 범위의 두 번째 활성화는 기존 ACTIVE 를 INACTIVE 로 강등")
    void activationDemotesSibling() {
        Long first = activeConfiguration(agencyGlobal("first", 102L, "10"));
        Long second = splitConfigurationService.create(agencyGlobal("second", 102L, "15"), ACTOR).getId();
        splitConfigurationService.validate(second, null, ACTOR);
        splitConfigurationService.activate(second, "replace", ACTOR);

        assertThat(splitConfigurationService.findOne(first).getStatus()).isEqualTo(ConfigurationStatus.INACTIVE);
        assertThat(splitConfigurationService.findOne(second).getStatus()).isEqualTo(ConfigurationStatus.ACTIVE);
        assertThat(splitConfigurationService.findActiveForScope(102L, null, null, null))
                .get().extracting(SplitConfigurationDetail::getId).isEqualTo(second);

        assertThat(splitAuditLogRepository.countByConfigurationIdAndAction(first, AuditAction.DEACTIVATE)).isEqualTo(1);
        SplitAuditLog activation = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(second).stream()
                .filter(entry -> entry.getAction() == AuditAction.ACTIVATE)
                .findFirst()
                .orElseThrow();
        assertThat(activation.getAfterState()).contains("demotedConfigurationIds").contains(first.toString());
    }

    @Test
    @DisplayName("ACTIVE 설정의 설정/수신자/규칙 변경은 상태 충돌")
    void activeConfigurationIsImmutable() {
        Long id = activeConfiguration(agencyGlobal("immutable", 103L, "10"));
        SplitConfigurationDetail detail = splitConfigurationService.findOne(id);
        Long receiverId = detail.getReceivers().get(0).getId();
        Long ruleId = detail.getReceivers().get(0).getRules().get(0).getId();

        assertThatThrownBy(() -> splitConfigurationService.update(id,
                UpdateSplitConfigurationRequest.builder().description("changed").build(), ACTOR))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("Deactivate it or create a new version first");
        assertThatThrownBy(() -> splitConfigurationService.createReceiver(id,
                receiver(ReceiverType.AGENCY, "Agency", "wallet-a", false), ACTOR))
                .isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> splitConfigurationService.deleteRule(id, ruleId, ACTOR))
                .isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> splitConfigurationService.deleteReceiver(id, receiverId, ACTOR))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("잠긴 수신자와 그 규칙은 DRAFT 에서도 변경 불가")
    void lockedReceiverIsProtected() {
        SplitConfigurationDetail created = splitConfigurationService.create(configuration("locked",
                ConfigurationScope.GLOBAL, 104L, null, null, null,
                receiver(ReceiverType.PLATFORM, "Platform", null, true, percentage(new BigDecimal("10"))),
                receiver(ReceiverType.OWNER, "Owner", "wallet-o", false, percentage(new BigDecimal("90")))), ACTOR);
        SplitReceiverDetail locked = created.getReceivers().get(0);
        Long lockedRuleId = locked.getRules().get(0).getId();

        assertThatThrownBy(() -> splitConfigurationService.updateReceiver(created.getId(), locked.getId(),
                UpdateSplitReceiverRequest.builder().name("renamed").build(), ACTOR))
                .isInstanceOf(ReceiverLockedException.class);
        assertThatThrownBy(() -> splitConfigurationService.deleteReceiver(created.getId(), locked.getId(), ACTOR))
                .isInstanceOf(ReceiverLockedException.class);
        assertThatThrownBy(() -> splitConfigurationService.deleteRule(created.getId(), lockedRuleId, ACTOR))
                .isInstanceOf(ReceiverLockedException.class);
        assertThatThrownBy(() -> splitConfigurationService.createRule(created.getId(), locked.getId(),
                fixed(new BigDecimal("1.00"), 0), ACTOR))
                .isInstanceOf(ReceiverLockedException.class);
    }

    @Test
    @DisplayName("검증 실패 시 모든 위반 사항을 반환하고 상태는 그대로")
    void validationReportsAllViolations() {
        SplitConfigurationDetail created = splitConfigurationService.create(configuration("broken",
                ConfigurationScope.GLOBAL, 105L, null, null, null,
                receiver(ReceiverType.PLATFORM, "Platform", null, false, percentage(new BigDecimal("60"))),
                receiver(ReceiverType.OWNER, "Owner", null, false, percentage(new BigDecimal("50")))), ACTOR);

        assertThatThrownBy(() -> splitConfigurationService.validate(created.getId(), null, ACTOR))
                .isInstanceOfSatisfying(SplitValidationException.class, e -> assertThat(e.getErrors())
                        .containsExactly("Receiver 'Owner' (OWNER) has no payout wallet",
                                "Sum of active percentage rules (110%) exceeds 100%"));

        SplitConfigurationDetail reloaded = splitConfigurationService.findOne(created.getId());
        assertThat(reloaded.getStatus()).isEqualTo(ConfigurationStatus.DRAFT);
        assertThat(reloaded.getIsValidated()).isFalse();
    }

    @Test
    @DisplayName("검증 후 변경하면 DRAFT 로 돌아가 활성화 불가")
    void mutationResetsValidation() {
        Long id = splitConfigurationService.create(agencyGlobal("reset", 106L, "10"), ACTOR).getId();
        splitConfigurationService.validate(id, null, ACTOR);
        Long ownerReceiverId = splitConfigurationService.findOne(id).getReceivers().get(1).getId();

        splitConfigurationService.createRule(id, ownerReceiverId, fixed(new BigDecimal("5.00"), 1), ACTOR);

        SplitConfigurationDetail reloaded = splitConfigurationService.findOne(id);
        assertThat(reloaded.getStatus()).isEqualTo(ConfigurationStatus.DRAFT);
        assertThat(reloaded.getIsValidated()).isFalse();
        assertThatThrownBy(() -> splitConfigurationService.activate(id, null, ACTOR))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("must be validated");
    }

    @Test
    @DisplayName("새 버전은 수신자/규칙을 복사한 DRAFT, 원본은 ACTIVE 유지")
    void newVersionCopiesTree() {
        Long id = activeConfiguration(agencyGlobal("versioned", 107L, "10"));

        SplitConfigurationDetail copy = splitConfigurationService.createNewVersion(id, "raise fee", ACTOR);

        assertThat(copy.getStatus()).isEqualTo(ConfigurationStatus.DRAFT);
        assertThat(copy.getVersion()).isEqualTo(2);
        assertThat(copy.getPreviousVersionId()).isEqualTo(id);
        assertThat(copy.getReceivers()).extracting(SplitReceiverDetail::getName).containsExactly("Platform", "Owner");
        assertThat(copy.getReceivers().get(0).getRules()).hasSize(1);
        assertThat(splitConfigurationService.findOne(id).getStatus()).isEqualTo(ConfigurationStatus.ACTIVE);
        assertThat(splitAuditLogRepository.countByConfigurationIdAndAction(copy.getId(), AuditAction.CREATE_VERSION))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("ARCHIVED 는 종료 상태")
    void archivedIsTerminal() {
        Long id = activeConfiguration(agencyGlobal("archived", 108L, "10"));
        assertThatThrownBy(() -> splitConfigurationService.archive(id, null, ACTOR))
                .isInstanceOf(StateConflictException.class);

        splitConfigurationService.deactivate(id, "retire", ACTOR);
        splitConfigurationService.archive(id, "retire", ACTOR);

        assertThatThrownBy(() -> splitConfigurationService.activate(id, null, ACTOR))
                .isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> splitConfigurationService.validate(id, null, ACTOR))
                .isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> splitConfigurationService.update(id,
                UpdateSplitConfigurationRequest.builder().notes("x").build(), ACTOR))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    @DisplayName("비활성화 후 재활성화는 검증 플래그가 유지되면 가능")
    void reactivateInactive() {
        Long id = activeConfiguration(agencyGlobal("reactivate", 109L, "10"));
        splitConfigurationService.deactivate(id, null, ACTOR);
        assertThat(splitConfigurationService.findActiveForScope(109L, null, null, null)).isEmpty();

        SplitConfigurationDetail reactivated = splitConfigurationService.activate(id, null, ACTOR);

        assertThat(reactivated.getStatus()).isEqualTo(ConfigurationStatus.ACTIVE);
    }

    @Test
    @DisplayName("ACTIVE 설정 삭제는 상태 충돌, DRAFT 삭제 후에도 감사 로그 유지")
    void deleteRules() {
        Long activeId = activeConfiguration(agencyGlobal("keep", 110L, "10"));
        assertThatThrownBy(() -> splitConfigurationService.delete(activeId, null, ACTOR))
                .isInstanceOf(StateConflictException.class);

        Long draftId = splitConfigurationService.create(agencyGlobal("drop", 110L, "10"), ACTOR).getId();
        splitConfigurationService.delete(draftId, "mistake", ACTOR);

        List<SplitAuditLog> trail = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(draftId);
        assertThat(trail).extracting(SplitAuditLog::getAction).containsExactly(AuditAction.CREATE, AuditAction.DELETE);
    }

    @Test
    @DisplayName("범위 해석: 계약 → GLOBAL(기관) → GLOBAL(플랫폼)")
    void resolvesMostSpecificScope() {
        Long agencyWide = activeConfiguration(agencyGlobal("agency-wide", 111L, "10"));
        Long contractOnly = activeConfiguration(configuration("contract-5", ConfigurationScope.PER_CONTRACT,
                111L, null, 5L, null,
                receiver(ReceiverType.PLATFORM, "Platform", null, false, percentage(new BigDecimal("5"))),
                receiver(ReceiverType.OWNER, "Owner", "wallet-o", false, percentage(new BigDecimal("95")))));
        Long platformWide = activeConfiguration(configuration("platform", ConfigurationScope.GLOBAL,
                null, null, null, null,
                receiver(ReceiverType.PLATFORM, "Platform", null, false, percentage(new BigDecimal("100")))));

        assertThat(splitConfigurationService.findActiveForScope(111L, null, 5L, null))
                .get().extracting(SplitConfigurationDetail::getId).isEqualTo(contractOnly);
        assertThat(splitConfigurationService.findActiveForScope(111L, null, 6L, null))
                .get().extracting(SplitConfigurationDetail::getId).isEqualTo(agencyWide);
        assertThat(splitConfigurationService.findActiveForScope(999111L, null, null, null))
                .get().extracting(SplitConfigurationDetail::getId).isEqualTo(platformWide);
    }

    @Test
    @DisplayName("미리보기: 활성 설정 없으면 invalid, 있으면 계산 결과")
    void previewUsesActiveConfiguration() {
        SplitResult missing = splitConfigurationService.preview(112L, null, null, null,
                new BigDecimal("100.00"), ChargeType.RENT);
        assertThat(missing.getIsValid()).isFalse();
        assertThat(missing.getErrors()).containsExactly("No active split configuration found for this scope");

        activeConfiguration(agencyGlobal("preview", 112L, "10"));
        SplitResult result = splitConfigurationService.preview(112L, null, null, null,
                new BigDecimal("100.00"), ChargeType.RENT);
        assertThat(result.getIsValid()).isTrue();
        assertThat(result.getReceivers().get(0).getAmount()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("다른 트랜잭션이 범위 키를 먼저 점유하면 활성화는 409, ACTIVE 키는 하나만 남음")
    void concurrentActivationLosesOnActiveScopeKey() {
        Long winner = splitConfigurationService.create(agencyGlobal("racer-a", 113L, "10"), ACTOR).getId();
        splitConfigurationService.validate(winner, null, ACTOR);
        Long loser = splitConfigurationService.create(agencyGlobal("racer-b", 113L, "15"), ACTOR).getId();
        splitConfigurationService.validate(loser, null, ACTOR);

        entityManager.flush();

        // 커밋 전 활성화: 강등 조회에는 ACTIVE 로 보이지 않고 유니크 키만 점유
        entityManager.createNativeQuery(
                        "UPDATE split_configurations SET active_scope_key = scope_key WHERE id = :id")
                .setParameter("id", winner)
                .executeUpdate();
        entityManager.clear();

        assertThatThrownBy(() -> splitConfigurationService.activate(loser, "race", ACTOR))
                .isInstanceOf(StateConflictException.class)
                .hasMessageContaining("activated concurrently");
        entityManager.clear();

        Number holders = (Number) entityManager.createNativeQuery(
                        "SELECT COUNT(*) FROM split_configurations WHERE agency_id = 113 AND active_scope_key IS NOT NULL")
                .getSingleResult();
        assertThat(holders.intValue()).isEqualTo(1);
        Object loserStatus = entityManager.createNativeQuery(
                        "SELECT status FROM split_configurations WHERE id = :id")
                .setParameter("id", loser)
                .getSingleResult();
        assertThat(loserStatus).hasToString("VALIDATED");
    }

    private Long activeConfiguration(CreateSplitConfigurationRequest request) {
        Long id = splitConfigurationService.create(request, ACTOR).getId();
        splitConfigurationService.validate(id, null, ACTOR);
        splitConfigurationService.activate(id, null, ACTOR);
        return id;
    }
}
