package dustin.rental.domains.audit.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.model.dto.AuditLogResponse;
import dustin.rental.domains.audit.model.dto.AuditTrailVerification;
import dustin.rental.domains.audit.model.entity.SplitAuditLog;
import dustin.rental.domains.audit.repository.SplitAuditLogRepository;
import dustin.rental.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 감사 로그 서비스
 * Split Audit Service
 *
 * 역할:
 * - 변경 작업과 같은 트랜잭션에서 감사 로그 기록 (MANDATORY: 호출자 트랜잭션 필수)
 * - 무결성 해시 계산 및 검증
 *
 * 기록 실패(직렬화 오류, DB 오류)는 예외로 전파되어 변경 작업 전체가 롤백된다.
 *
 * 무결성 해시:
 * ===========
 * SHA-256( configurationId | action | entityType | entityId | before | after | performedBy | performedAtEpochMillis )
 * NULL 값은 빈 문자열로 취급
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SplitAuditService {

    private final SplitAuditLogRepository splitAuditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * 감사 로그 기록
     * Record audit entry
     *
     * @param before 변경 전 상태 (객체는 JSON 직렬화, 문자열은 그대로)
     * @param after 변경 후 상태
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SplitAuditLog record(Long configurationId, AuditAction action, AuditEntityType entityType,
                                Long entityId, Object before, Object after, String performedBy, String reason) {
        SplitAuditLog entry = SplitAuditLog.builder()
                .configurationId(configurationId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .beforeState(serialize(before))
                .afterState(serialize(after))
                .reason(reason)
                .performedBy(performedBy)
                .performedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .build();
        entry.setIntegrityHash(computeIntegrityHash(entry));

        SplitAuditLog saved = splitAuditLogRepository.save(entry);
        log.info("[SplitAuditService] 감사 로그 기록: configurationId={}, action={}, entityType={}, entityId={}, performedBy={}",
                configurationId, action, entityType, entityId, performedBy);
        return saved;
    }

    @Transactional(readOnly = true)
    public PageResponse<AuditLogResponse> findByConfiguration(Long configurationId, Pageable pageable) {
        Page<SplitAuditLog> page =
                splitAuditLogRepository.findByConfigurationIdOrderByPerformedAtDescIdDesc(configurationId, pageable);
        return PageResponse.of(page, entry -> AuditLogResponse.from(entry, verify(entry)));
    }

    /**
     * 저장된 필드로 해시를 재계산하여 일치 여부 반환
     */
    public boolean verify(SplitAuditLog entry) {
        return computeIntegrityHash(entry).equals(entry.getIntegrityHash());
    }

    @Transactional(readOnly = true)
    public AuditTrailVerification verifyTrail(Long configurationId) {
        List<SplitAuditLog> entries = splitAuditLogRepository.findByConfigurationIdOrderByIdAsc(configurationId);
        List<Long> tampered = new ArrayList<>();
        for (SplitAuditLog entry : entries) {
            if (!verify(entry)) {
                tampered.add(entry.getId());
            }
        }
        if (!tampered.isEmpty()) {
            log.error("[SplitAuditService] 감사 로그 변조 감지: configurationId={}, tamperedIds={}",
                    configurationId, tampered);
        }
        return AuditTrailVerification.builder()
                .configurationId(configurationId)
                .totalEntries(entries.size())
                .intact(tampered.isEmpty())
                .tamperedEntryIds(tampered)
                .build();
    }

    /**
     * 무결성 해시 계산 (외부 검증자도 같은 방식으로 재계산 가능)
     *
     * 각 필드는 "길이:값" 으로 인코딩해 이어 붙인다. null 은 "-1:" 로 구분한다.
     * 값 안의 구분자를 옮겨도 다른 입력이 되므로 필드 경계를 넘는 변조가 해시에 드러난다.
     */
    public static String computeIntegrityHash(SplitAuditLog entry) {
        StringBuilder payload = new StringBuilder();
        appendField(payload, entry.getConfigurationId());
        appendField(payload, entry.getAction());
        appendField(payload, entry.getEntityType());
        appendField(payload, entry.getEntityId());
        appendField(payload, entry.getBeforeState());
        appendField(payload, entry.getAfterState());
        appendField(payload, entry.getPerformedBy());
        appendField(payload, entry.getPerformedAt() == null ? null : entry.getPerformedAt().toEpochMilli());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private String serialize(Object state) {
        if (state == null) {
            return null;
        }
        if (state instanceof String) {
            return (String) state;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit snapshot: " + state.getClass().getSimpleName(), e);
        }
    }

    private static void appendField(StringBuilder payload, Object value) {
        if (value == null) {
            payload.append("-1:");
            return;
        }
        String text = value.toString();
        payload.append(text.length()).append(':').append(text);
    }
}
