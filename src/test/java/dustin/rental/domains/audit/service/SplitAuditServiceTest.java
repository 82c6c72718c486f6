package dustin.rental.domains.audit.service;

import static dustin.rental.support.SplitFixtures.agencyGlobal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.model.dto.AuditLogResponse;
import dustin.rental.domains.audit.model.dto.AuditTrailVerification;
import dustin.rental.domains.audit.model.entity.SplitAuditLog;
import dustin.rental.domains.audit.repository.SplitAuditLogRepository;
import dustin.rental.domains.split.service.SplitConfigurationService;
import dustin.rental.shared.model.dto.PageResponse;
import jakarta.persistence.EntityManager;

/**
 * 감사 로그 서비스 테스트
 * Split Audit Service Test
 *
 * 테스트 항목:
 * 1. 작업당 감사 로그 1건, 무결성 해시 검증
 * 2. DB 에서 직접 수정된 로그 감지
 * 3. 트랜잭션 밖 기록 거부
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SplitAuditServiceTest {

    private static final String ACTOR = "auditor";

    @Autowired
    private SplitAuditService splitAuditService;

    @Autowired
    private SplitConfigurationService splitConfigurationService;

    @Autowired
    private SplitAuditLogRepository splitAuditLogRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    @DisplayName("설정 작업마다 감사 로그가 남고 해시가 일치")
    void recordsOneEntryPerOperation() {
        Long id = splitConfigurationService.create(agencyGlobal("audited", 201L, "10"), ACTOR).getId();
        splitConfigurationService.validate(id, "checked", ACTOR);
        splitConfigurationService.activate(id, "launch", ACTOR);

        List<SplitAuditLog> trail = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(id);
        assertThat(trail).extracting(SplitAuditLog::getAction)
                .containsExactly(AuditAction.CREATE, AuditAction.VALIDATE, AuditAction.ACTIVATE);
        assertThat(trail).allSatisfy(entry -> {
            assertThat(entry.getPerformedBy()).isEqualTo(ACTOR);
            assertThat(entry.getIntegrityHash()).hasSize(64);
            assertThat(splitAuditService.verify(entry)).isTrue();
        });
        assertThat(trail.get(0).getBeforeState()).isNull();
        assertThat(trail.get(0).getAfterState()).contains("\"name\":\"audited\"");
        assertThat(trail.get(2).getReason()).isEqualTo("launch");

        PageResponse<AuditLogResponse> page = splitAuditService.findByConfiguration(id, PageRequest.of(0, 10));
        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getContent().get(0).getAction()).isEqualTo(AuditAction.ACTIVATE);
    }

    @Test
    @DisplayName("저장 후 변경된 감사 로그는 검증 실패")
    void detectsTampering() {
        Long id = splitConfigurationService.create(agencyGlobal("tampered", 202L, "10"), ACTOR).getId();
        splitConfigurationService.validate(id, null, ACTOR);
        SplitAuditLog validation = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(id).get(1);
        entityManager.flush();

        entityManager.createNativeQuery("UPDATE split_audit_logs SET after_state = :state WHERE id = :id")
                .setParameter("state", "{\"status\":\"ACTIVE\"}")
                .setParameter("id", validation.getId())
                .executeUpdate();
        entityManager.clear();

        AuditTrailVerification verification = splitAuditService.verifyTrail(id);
        assertThat(verification.getTotalEntries()).isEqualTo(2);
        assertThat(verification.getIntact()).isFalse();
        assertThat(verification.getTamperedEntryIds()).containsExactly(validation.getId());
    }

    @Test
    @DisplayName("null 필드를 포함해도 저장된 필드로 해시 재계산 가능")
    void hashIsReproducible() {
        Long id = splitConfigurationService.create(agencyGlobal("hash", 203L, "10"), ACTOR).getId();
        SplitAuditLog created = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(id).get(0);

        assertThat(SplitAuditService.computeIntegrityHash(created)).isEqualTo(created.getIntegrityHash());

        created.setPerformedBy("someone-else");
        assertThat(splitAuditService.verify(created)).isFalse();
        entityManager.detach(created);
    }

    @Test
    @DisplayName("필드 경계를 넘겨 옮긴 값도 변조로 감지")
    void detectsTextShiftedAcrossFields() {
        Long id = splitConfigurationService.create(agencyGlobal("shifted", 204L, "10"), ACTOR).getId();
        SplitAuditLog entry = splitAuditService.record(id, AuditAction.UPDATE, AuditEntityType.RULE, 77L,
                null, "{\"value\":90}|admin", "eve", null);
        entityManager.flush();

        entityManager.createNativeQuery(
                        "UPDATE split_audit_logs SET after_state = :state, performed_by = :actor WHERE id = :id")
                .setParameter("state", "{\"value\":90}")
                .setParameter("actor", "admin|eve")
                .setParameter("id", entry.getId())
                .executeUpdate();
        entityManager.clear();

        AuditTrailVerification verification = splitAuditService.verifyTrail(id);
        assertThat(verification.getIntact()).isFalse();
        assertThat(verification.getTamperedEntryIds()).containsExactly(entry.getId());
    }

    @Test
    @DisplayName("구분자를 다른 필드로 옮긴 두 항목은 해시가 다름")
    void shiftedSeparatorChangesHash() {
        Instant at = Instant.parse("2024-01-15T10:00:00Z");
        SplitAuditLog original = SplitAuditLog.builder()
                .configurationId(1L)
                .action(AuditAction.UPDATE)
                .entityType(AuditEntityType.RULE)
                .entityId(2L)
                .afterState("{\"value\":90}|admin")
                .performedBy("eve")
                .performedAt(at)
                .build();
        SplitAuditLog shifted = SplitAuditLog.builder()
                .configurationId(1L)
                .action(AuditAction.UPDATE)
                .entityType(AuditEntityType.RULE)
                .entityId(2L)
                .afterState("{\"value\":90}")
                .performedBy("admin|eve")
                .performedAt(at)
                .build();

        assertThat(SplitAuditService.computeIntegrityHash(original))
                .isNotEqualTo(SplitAuditService.computeIntegrityHash(shifted));
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("감사 로그는 호출자 트랜잭션 안에서만 기록")
    void requiresSurroundingTransaction() {
        assertThatThrownBy(() -> splitAuditService.record(null, AuditAction.UPDATE, AuditEntityType.CONFIGURATION,
                1L, null, null, ACTOR, null))
                .isInstanceOf(IllegalTransactionStateException.class);
    }
}
