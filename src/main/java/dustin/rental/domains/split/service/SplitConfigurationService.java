package dustin.rental.domains.split.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.service.SplitAuditService;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
import dustin.rental.domains.split.model.ScopeKey;
import dustin.rental.domains.split.model.dto.CreateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.CreateSplitReceiverRequest;
import dustin.rental.domains.split.model.dto.CreateSplitRuleRequest;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitResult;
import dustin.rental.domains.split.model.dto.SplitRuleDetail;
import dustin.rental.domains.split.model.dto.UpdateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.UpdateSplitReceiverRequest;
import dustin.rental.domains.split.model.dto.UpdateSplitRuleRequest;
import dustin.rental.domains.split.model.entity.SplitConfiguration;
import dustin.rental.domains.split.model.entity.SplitReceiver;
import dustin.rental.domains.split.model.entity.SplitRule;
import dustin.rental.domains.split.repository.SplitConfigurationRepository;
import dustin.rental.domains.split.repository.SplitReceiverRepository;
import dustin.rental.domains.split.repository.SplitRuleRepository;
import dustin.rental.shared.exception.NotFoundException;
import dustin.rental.shared.exception.ReceiverLockedException;
import dustin.rental.shared.exception.SplitValidationException;
import dustin.rental.shared.exception.StateConflictException;
import dustin.rental.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 분할 설정 서비스 (설정 생명주기 관리)
 * Split Configuration Service (Configuration Lifecycle Manager)
 *
 * 역할:
 * - 설정/수신자/규칙 CRUD
 * - 상태 전이: 검증 → 활성화 → 비활성화 → 보관, 새 버전 생성
 * - 범위별 활성 설정 조회 (PER_CONTRACT → PER_PROPERTY → GLOBAL → 플랫폼 기본)
 * - 모든 변경은 같은 트랜잭션에서 감사 로그 1건 기록
 *
 * 동시성:
 * ======
 * - 변경/전이 대상 설정은 PESSIMISTIC_WRITE 락으로 조회
 * - 활성화 시 같은 범위의 ACTIVE 설정들을 락 후 INACTIVE 로 강등
 * - active_scope_key 유니크 제약이 동시 활성화 경쟁의 최종 방어선
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SplitConfigurationService {

    private final SplitConfigurationRepository splitConfigurationRepository;
    private final SplitReceiverRepository splitReceiverRepository;
    private final SplitRuleRepository splitRuleRepository;
    private final SplitConfigurationValidator splitConfigurationValidator;
    private final SplitCalculator splitCalculator;
    private final SplitAuditService splitAuditService;

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 조회
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Transactional(readOnly = true)
    public PageResponse<SplitConfigurationDetail> findAll(Long agencyId, Long ownerId, ConfigurationScope scope,
                                                          ConfigurationStatus status, Pageable pageable) {
        return PageResponse.of(
                splitConfigurationRepository.search(agencyId, ownerId, scope, status, pageable),
                this::toDetail);
    }

    @Transactional(readOnly = true)
    public SplitConfigurationDetail findOne(Long id) {
        return toDetail(getConfiguration(id));
    }

    @Transactional(readOnly = true)
    public SplitConfigurationDetail findByToken(String token) {
        return splitConfigurationRepository.findByToken(token)
                .map(this::toDetail)
                .orElseThrow(() -> new NotFoundException("Split configuration not found: token=" + token));
    }

    /**
     * 범위에 적용될 활성 설정 조회
     * Resolve the active configuration for a scope
     *
     * 우선순위: PER_CONTRACT (contractId 있을 때) → PER_PROPERTY (propertyId 있을 때)
     *          → GLOBAL(agency/owner) → GLOBAL(플랫폼 기본)
     */
    @Transactional(readOnly = true)
    public Optional<SplitConfigurationDetail> findActiveForScope(Long agencyId, Long ownerId,
                                                                 Long contractId, Long propertyId) {
        List<ScopeKey> candidates = new ArrayList<>();
        if (contractId != null) {
            candidates.add(ScopeKey.of(ConfigurationScope.PER_CONTRACT, agencyId, ownerId, contractId, null));
        }
        if (propertyId != null) {
            candidates.add(ScopeKey.of(ConfigurationScope.PER_PROPERTY, agencyId, ownerId, null, propertyId));
        }
        candidates.add(ScopeKey.global(agencyId, ownerId));
        if (agencyId != null || ownerId != null) {
            candidates.add(ScopeKey.global(null, null));
        }

        for (ScopeKey candidate : candidates) {
            Optional<SplitConfiguration> active =
                    splitConfigurationRepository.findByActiveScopeKey(candidate.asString());
            if (active.isPresent()) {
                return Optional.of(toDetail(active.get()));
            }
        }
        return Optional.empty();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 설정 CRUD
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 설정 생성 (수신자/규칙 중첩 생성 가능), 항상 DRAFT 로 시작
     */
    @Transactional
    public SplitConfigurationDetail create(CreateSplitConfigurationRequest request, String performedBy) {
        ScopeKey scopeKey = ScopeKey.of(request.getScope(), request.getAgencyId(), request.getOwnerId(),
                request.getContractId(), request.getPropertyId());

        SplitConfiguration configuration = SplitConfiguration.builder()
                .token(newToken())
                .name(request.getName())
                .description(request.getDescription())
                .scope(request.getScope())
                .agencyId(scopeKey.getAgencyId())
                .ownerId(scopeKey.getOwnerId())
                .contractId(scopeKey.getContractId())
                .propertyId(scopeKey.getPropertyId())
                .scopeKey(scopeKey.asString())
                .version(nextVersion(scopeKey.asString(), request.getName()))
                .status(ConfigurationStatus.DRAFT)
                .isValidated(false)
                .effectiveDate(request.getEffectiveDate())
                .changeReason(request.getChangeReason())
                .notes(request.getNotes())
                .createdBy(performedBy)
                .build();
        SplitConfiguration saved = splitConfigurationRepository.save(configuration);

        if (request.getReceivers() != null) {
            for (CreateSplitReceiverRequest receiverRequest : request.getReceivers()) {
                saveReceiverWithRules(saved.getId(), receiverRequest);
            }
        }

        SplitConfigurationDetail detail = toDetail(saved);
        splitAuditService.record(saved.getId(), AuditAction.CREATE, AuditEntityType.CONFIGURATION, saved.getId(),
                null, detail, performedBy, request.getChangeReason());

        log.info("[SplitConfigurationService] 설정 생성: id={}, scopeKey={}, version={}, receivers={}",
                saved.getId(), saved.getScopeKey(), saved.getVersion(), detail.getReceivers().size());
        return detail;
    }

    @Transactional
    public SplitConfigurationDetail update(Long id, UpdateSplitConfigurationRequest request, String performedBy) {
        SplitConfiguration configuration = loadMutable(id);
        SplitConfigurationDetail before = toDetail(configuration);

        if (request.getDescription() != null) {
            configuration.setDescription(request.getDescription());
        }
        if (request.getEffectiveDate() != null) {
            configuration.setEffectiveDate(request.getEffectiveDate());
        }
        if (request.getChangeReason() != null) {
            configuration.setChangeReason(request.getChangeReason());
        }
        if (request.getNotes() != null) {
            configuration.setNotes(request.getNotes());
        }
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        SplitConfigurationDetail after = toDetail(configuration);
        splitAuditService.record(id, AuditAction.UPDATE, AuditEntityType.CONFIGURATION, id,
                before, after, performedBy, request.getChangeReason());
        return after;
    }

    /**
     * 설정 삭제 (ACTIVE 불가). 수신자/규칙도 함께 삭제, 감사 로그는 유지
     */
    @Transactional
    public void delete(Long id, String reason, String performedBy) {
        SplitConfiguration configuration = lockConfiguration(id);
        if (configuration.getStatus() == ConfigurationStatus.ACTIVE) {
            throw new StateConflictException("Cannot delete active configuration " + id + ". Deactivate it first.");
        }
        SplitConfigurationDetail before = toDetail(configuration);

        splitRuleRepository.deleteAll(splitRuleRepository.findByConfigurationIdOrderByIdAsc(id));
        splitReceiverRepository.deleteAll(splitReceiverRepository.findByConfigurationIdOrderByIdAsc(id));
        splitConfigurationRepository.delete(configuration);

        splitAuditService.record(id, AuditAction.DELETE, AuditEntityType.CONFIGURATION, id,
                before, null, performedBy, reason);
        log.info("[SplitConfigurationService] 설정 삭제: id={}, performedBy={}", id, performedBy);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 수신자 CRUD
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Transactional
    public SplitReceiverDetail createReceiver(Long configurationId, CreateSplitReceiverRequest request,
                                              String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        SplitReceiverDetail created = saveReceiverWithRules(configurationId, request);
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(configurationId, AuditAction.CREATE, AuditEntityType.RECEIVER, created.getId(),
                null, created, performedBy, null);
        return created;
    }

    @Transactional
    public SplitReceiverDetail updateReceiver(Long configurationId, Long receiverId,
                                              UpdateSplitReceiverRequest request, String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        SplitReceiver receiver = getUnlockedReceiver(configurationId, receiverId);
        SplitReceiverDetail before = toReceiverDetail(receiver);

        if (request.getReceiverType() != null) {
            receiver.setReceiverType(request.getReceiverType());
        }
        if (request.getName() != null) {
            receiver.setName(request.getName());
        }
        if (request.getDocument() != null) {
            receiver.setDocument(request.getDocument());
        }
        if (request.getUserId() != null) {
            receiver.setUserId(request.getUserId());
        }
        if (request.getAgencyId() != null) {
            receiver.setAgencyId(request.getAgencyId());
        }
        if (request.getWalletId() != null) {
            receiver.setWalletId(request.getWalletId());
        }
        splitReceiverRepository.save(receiver);
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        SplitReceiverDetail after = toReceiverDetail(receiver);
        splitAuditService.record(configurationId, AuditAction.UPDATE, AuditEntityType.RECEIVER, receiverId,
                before, after, performedBy, null);
        return after;
    }

    @Transactional
    public void deleteReceiver(Long configurationId, Long receiverId, String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        SplitReceiver receiver = getUnlockedReceiver(configurationId, receiverId);
        SplitReceiverDetail before = toReceiverDetail(receiver);

        splitRuleRepository.deleteAll(splitRuleRepository.findByReceiverIdOrderByIdAsc(receiverId));
        splitReceiverRepository.delete(receiver);
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(configurationId, AuditAction.DELETE, AuditEntityType.RECEIVER, receiverId,
                before, null, performedBy, null);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 규칙 CRUD
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Transactional
    public SplitRuleDetail createRule(Long configurationId, Long receiverId, CreateSplitRuleRequest request,
                                      String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        getUnlockedReceiver(configurationId, receiverId);

        SplitRule rule = splitRuleRepository.save(newRule(configurationId, receiverId, request));
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        SplitRuleDetail created = SplitRuleDetail.from(rule);
        splitAuditService.record(configurationId, AuditAction.CREATE, AuditEntityType.RULE, rule.getId(),
                null, created, performedBy, null);
        return created;
    }

    @Transactional
    public SplitRuleDetail updateRule(Long configurationId, Long ruleId, UpdateSplitRuleRequest request,
                                      String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        SplitRule rule = getRule(configurationId, ruleId);
        getUnlockedReceiver(configurationId, rule.getReceiverId());
        SplitRuleDetail before = SplitRuleDetail.from(rule);

        if (request.getRuleType() != null) {
            rule.setRuleType(request.getRuleType());
        }
        if (request.getValue() != null) {
            rule.setValue(request.getValue());
        }
        if (Boolean.TRUE.equals(request.getClearLimits())) {
            rule.setMinimumAmount(null);
            rule.setMaximumAmount(null);
        }
        if (request.getMinimumAmount() != null) {
            rule.setMinimumAmount(request.getMinimumAmount());
        }
        if (request.getMaximumAmount() != null) {
            rule.setMaximumAmount(request.getMaximumAmount());
        }
        if (Boolean.TRUE.equals(request.getClearChargeType())) {
            rule.setChargeType(null);
        } else if (request.getChargeType() != null) {
            rule.setChargeType(request.getChargeType());
        }
        if (request.getPriority() != null) {
            rule.setPriority(request.getPriority());
        }
        if (request.getIsActive() != null) {
            rule.setIsActive(request.getIsActive());
        }
        splitRuleRepository.save(rule);
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        SplitRuleDetail after = SplitRuleDetail.from(rule);
        splitAuditService.record(configurationId, AuditAction.UPDATE, AuditEntityType.RULE, ruleId,
                before, after, performedBy, null);
        return after;
    }

    @Transactional
    public void deleteRule(Long configurationId, Long ruleId, String performedBy) {
        SplitConfiguration configuration = loadMutable(configurationId);
        SplitRule rule = getRule(configurationId, ruleId);
        getUnlockedReceiver(configurationId, rule.getReceiverId());
        SplitRuleDetail before = SplitRuleDetail.from(rule);

        splitRuleRepository.delete(rule);
        markMutated(configuration);
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(configurationId, AuditAction.DELETE, AuditEntityType.RULE, ruleId,
                before, null, performedBy, null);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 상태 전이
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 검증 (DRAFT/VALIDATED/INACTIVE 에서 허용)
     *
     * 실패 시 모든 위반 사항을 담은 SplitValidationException, 상태 변경 없음
     */
    @Transactional
    public SplitConfigurationDetail validate(Long id, String notes, String performedBy) {
        SplitConfiguration configuration = lockConfiguration(id);
        ConfigurationStatus status = configuration.getStatus();
        if (status == ConfigurationStatus.ACTIVE || status == ConfigurationStatus.ARCHIVED) {
            throw new StateConflictException("Cannot validate configuration " + id + " in status " + status);
        }

        SplitConfigurationDetail before = toDetail(configuration);
        SplitConfigurationValidator.ValidationResult result = splitConfigurationValidator.validate(before);
        if (!result.isValid()) {
            throw new SplitValidationException(result.getErrors());
        }

        configuration.setIsValidated(true);
        configuration.setValidatedAt(LocalDateTime.now());
        configuration.setValidatedBy(performedBy);
        configuration.setValidationNotes(notes);
        if (status == ConfigurationStatus.DRAFT) {
            configuration.setStatus(ConfigurationStatus.VALIDATED);
        }
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(id, AuditAction.VALIDATE, AuditEntityType.CONFIGURATION, id,
                statusSnapshot(before.getStatus(), before.getIsValidated()),
                statusSnapshot(configuration.getStatus(), true), performedBy, notes);

        log.info("[SplitConfigurationService] 설정 검증 완료: id={}, status={}, percentageSum={}",
                id, configuration.getStatus(), result.getPercentageSum());
        return toDetail(configuration);
    }

    /**
     * 활성화 (VALIDATED 또는 검증 유지 중인 INACTIVE 에서 허용)
     *
     * 같은 범위의 기존 ACTIVE 설정은 같은 트랜잭션에서 INACTIVE 로 강등되고 각각 DEACTIVATE 감사 로그가 남는다.
     */
    @Transactional
    public SplitConfigurationDetail activate(Long id, String reason, String performedBy) {
        SplitConfiguration configuration = lockConfiguration(id);
        ConfigurationStatus status = configuration.getStatus();
        if (status == ConfigurationStatus.ACTIVE) {
            throw new StateConflictException("Configuration " + id + " is already active");
        }
        if (status == ConfigurationStatus.ARCHIVED) {
            throw new StateConflictException("Archived configuration " + id + " cannot be reactivated");
        }
        if (status == ConfigurationStatus.DRAFT || !Boolean.TRUE.equals(configuration.getIsValidated())) {
            throw new StateConflictException("Configuration " + id + " must be validated before activation");
        }

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 1. 같은 범위의 ACTIVE 설정 강등
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        LocalDateTime now = LocalDateTime.now();
        List<SplitConfiguration> siblings = splitConfigurationRepository.findSiblingsForUpdate(
                configuration.getScopeKey(), ConfigurationStatus.ACTIVE, id);
        List<Long> demotedIds = new ArrayList<>();
        for (SplitConfiguration sibling : siblings) {
            sibling.setStatus(ConfigurationStatus.INACTIVE);
            sibling.setActiveScopeKey(null);
            sibling.setDeactivatedAt(now);
            sibling.setDeactivatedBy(performedBy);
            splitConfigurationRepository.saveAndFlush(sibling);
            demotedIds.add(sibling.getId());

            splitAuditService.record(sibling.getId(), AuditAction.DEACTIVATE, AuditEntityType.CONFIGURATION,
                    sibling.getId(), statusSnapshot(ConfigurationStatus.ACTIVE, sibling.getIsValidated()),
                    statusSnapshot(ConfigurationStatus.INACTIVE, sibling.getIsValidated()), performedBy,
                    "Superseded by configuration " + id);
            log.info("[SplitConfigurationService] 기존 활성 설정 강등: id={}, supersededBy={}", sibling.getId(), id);
        }

        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        // 2. 대상 활성화 (유니크 제약으로 동시 활성화 차단)
        // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
        configuration.setStatus(ConfigurationStatus.ACTIVE);
        configuration.setActiveScopeKey(configuration.getScopeKey());
        configuration.setActivatedAt(now);
        configuration.setActivatedBy(performedBy);
        if (reason != null) {
            configuration.setChangeReason(reason);
        }
        try {
            splitConfigurationRepository.saveAndFlush(configuration);
        } catch (DataIntegrityViolationException e) {
            log.warn("[SplitConfigurationService] 동시 활성화 충돌: id={}, scopeKey={}", id, configuration.getScopeKey());
            throw new StateConflictException("Another configuration was activated concurrently for scope "
                    + configuration.getScopeKey());
        }

        Map<String, Object> after = statusSnapshot(ConfigurationStatus.ACTIVE, true);
        after.put("demotedConfigurationIds", demotedIds);
        splitAuditService.record(id, AuditAction.ACTIVATE, AuditEntityType.CONFIGURATION, id,
                statusSnapshot(status, true), after, performedBy, reason);

        log.info("[SplitConfigurationService] 설정 활성화: id={}, scopeKey={}, demoted={}",
                id, configuration.getScopeKey(), demotedIds);
        return toDetail(configuration);
    }

    @Transactional
    public SplitConfigurationDetail deactivate(Long id, String reason, String performedBy) {
        SplitConfiguration configuration = lockConfiguration(id);
        if (configuration.getStatus() != ConfigurationStatus.ACTIVE) {
            throw new StateConflictException("Configuration " + id + " is not active (status="
                    + configuration.getStatus() + ")");
        }
        configuration.setStatus(ConfigurationStatus.INACTIVE);
        configuration.setActiveScopeKey(null);
        configuration.setDeactivatedAt(LocalDateTime.now());
        configuration.setDeactivatedBy(performedBy);
        if (reason != null) {
            configuration.setChangeReason(reason);
        }
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(id, AuditAction.DEACTIVATE, AuditEntityType.CONFIGURATION, id,
                statusSnapshot(ConfigurationStatus.ACTIVE, configuration.getIsValidated()),
                statusSnapshot(ConfigurationStatus.INACTIVE, configuration.getIsValidated()), performedBy, reason);
        log.info("[SplitConfigurationService] 설정 비활성화: id={}, performedBy={}", id, performedBy);
        return toDetail(configuration);
    }

    /**
     * 보관 (종료 상태, 재활성화 불가)
     */
    @Transactional
    public SplitConfigurationDetail archive(Long id, String reason, String performedBy) {
        SplitConfiguration configuration = lockConfiguration(id);
        ConfigurationStatus status = configuration.getStatus();
        if (status == ConfigurationStatus.ACTIVE) {
            throw new StateConflictException("Cannot archive active configuration " + id + ". Deactivate it first.");
        }
        if (status == ConfigurationStatus.ARCHIVED) {
            throw new StateConflictException("Configuration " + id + " is already archived");
        }
        configuration.setStatus(ConfigurationStatus.ARCHIVED);
        configuration.setArchivedAt(LocalDateTime.now());
        configuration.setArchivedBy(performedBy);
        splitConfigurationRepository.save(configuration);

        splitAuditService.record(id, AuditAction.ARCHIVE, AuditEntityType.CONFIGURATION, id,
                statusSnapshot(status, configuration.getIsValidated()),
                statusSnapshot(ConfigurationStatus.ARCHIVED, configuration.getIsValidated()), performedBy, reason);
        return toDetail(configuration);
    }

    /**
     * 새 버전 생성: 수신자/규칙을 복사한 DRAFT (version = 계보 최대값 + 1). 원본은 변경하지 않는다.
     */
    @Transactional
    public SplitConfigurationDetail createNewVersion(Long id, String reason, String performedBy) {
        SplitConfiguration source = getConfiguration(id);
        SplitConfigurationDetail sourceDetail = toDetail(source);

        SplitConfiguration copy = splitConfigurationRepository.save(SplitConfiguration.builder()
                .token(newToken())
                .name(source.getName())
                .description(source.getDescription())
                .scope(source.getScope())
                .agencyId(source.getAgencyId())
                .ownerId(source.getOwnerId())
                .contractId(source.getContractId())
                .propertyId(source.getPropertyId())
                .scopeKey(source.getScopeKey())
                .version(nextVersion(source.getScopeKey(), source.getName()))
                .previousVersionId(source.getId())
                .status(ConfigurationStatus.DRAFT)
                .isValidated(false)
                .effectiveDate(source.getEffectiveDate())
                .changeReason(reason)
                .notes(source.getNotes())
                .createdBy(performedBy)
                .build());

        for (SplitReceiverDetail receiver : sourceDetail.getReceivers()) {
            SplitReceiver copiedReceiver = splitReceiverRepository.save(SplitReceiver.builder()
                    .configurationId(copy.getId())
                    .receiverType(receiver.getReceiverType())
                    .name(receiver.getName())
                    .document(receiver.getDocument())
                    .userId(receiver.getUserId())
                    .agencyId(receiver.getAgencyId())
                    .walletId(receiver.getWalletId())
                    .isLocked(receiver.getIsLocked())
                    .build());
            for (SplitRuleDetail rule : receiver.getRules()) {
                splitRuleRepository.save(SplitRule.builder()
                        .configurationId(copy.getId())
                        .receiverId(copiedReceiver.getId())
                        .ruleType(rule.getRuleType())
                        .value(rule.getValue())
                        .minimumAmount(rule.getMinimumAmount())
                        .maximumAmount(rule.getMaximumAmount())
                        .chargeType(rule.getChargeType())
                        .priority(rule.getPriority())
                        .isActive(rule.getIsActive())
                        .build());
            }
        }

        SplitConfigurationDetail detail = toDetail(copy);
        splitAuditService.record(copy.getId(), AuditAction.CREATE_VERSION, AuditEntityType.CONFIGURATION,
                copy.getId(), null, detail, performedBy,
                reason != null ? reason : "New version of configuration " + id);

        log.info("[SplitConfigurationService] 새 버전 생성: sourceId={}, newId={}, version={}",
                id, copy.getId(), copy.getVersion());
        return detail;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 계산
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Transactional(readOnly = true)
    public SplitResult calculate(Long id, BigDecimal grossAmount, ChargeType chargeType) {
        return splitCalculator.calculate(findOne(id), grossAmount, chargeType);
    }

    /**
     * 범위의 활성 설정으로 미리보기. 활성 설정이 없으면 isValid=false 결과
     */
    @Transactional(readOnly = true)
    public SplitResult preview(Long agencyId, Long ownerId, Long contractId, Long propertyId,
                               BigDecimal grossAmount, ChargeType chargeType) {
        if (grossAmount == null || grossAmount.signum() < 0) {
            throw new IllegalArgumentException("Gross amount must be zero or positive: " + grossAmount);
        }
        return findActiveForScope(agencyId, ownerId, contractId, propertyId)
                .map(configuration -> splitCalculator.calculate(configuration, grossAmount, chargeType))
                .orElseGet(() -> SplitResult.invalid(grossAmount, chargeType,
                        "No active split configuration found for this scope"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 내부 헬퍼
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private SplitConfiguration getConfiguration(Long id) {
        return splitConfigurationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Split configuration not found: id=" + id));
    }

    private SplitConfiguration lockConfiguration(Long id) {
        return splitConfigurationRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new NotFoundException("Split configuration not found: id=" + id));
    }

    /**
     * 변경 가능한 설정을 락으로 조회. ACTIVE/ARCHIVED 는 상태 충돌
     */
    private SplitConfiguration loadMutable(Long id) {
        SplitConfiguration configuration = lockConfiguration(id);
        if (!configuration.getStatus().isEditable()) {
            String hint = configuration.getStatus() == ConfigurationStatus.ACTIVE
                    ? " Deactivate it or create a new version first."
                    : "";
            throw new StateConflictException("Configuration " + id + " cannot be modified in status "
                    + configuration.getStatus() + "." + hint);
        }
        return configuration;
    }

    /**
     * 변경 발생 시 검증 플래그 해제, VALIDATED 는 DRAFT 로 복귀
     */
    private void markMutated(SplitConfiguration configuration) {
        configuration.setIsValidated(false);
        if (configuration.getStatus() == ConfigurationStatus.VALIDATED) {
            configuration.setStatus(ConfigurationStatus.DRAFT);
        }
    }

    private SplitReceiver getUnlockedReceiver(Long configurationId, Long receiverId) {
        SplitReceiver receiver = splitReceiverRepository.findByIdAndConfigurationId(receiverId, configurationId)
                .orElseThrow(() -> new NotFoundException("Receiver " + receiverId
                        + " not found in configuration " + configurationId));
        if (Boolean.TRUE.equals(receiver.getIsLocked())) {
            throw new ReceiverLockedException(receiverId);
        }
        return receiver;
    }

    private SplitRule getRule(Long configurationId, Long ruleId) {
        return splitRuleRepository.findByIdAndConfigurationId(ruleId, configurationId)
                .orElseThrow(() -> new NotFoundException("Rule " + ruleId
                        + " not found in configuration " + configurationId));
    }

    private SplitReceiverDetail saveReceiverWithRules(Long configurationId, CreateSplitReceiverRequest request) {
        SplitReceiver receiver = splitReceiverRepository.save(SplitReceiver.builder()
                .configurationId(configurationId)
                .receiverType(request.getReceiverType())
                .name(request.getName())
                .document(request.getDocument())
                .userId(request.getUserId())
                .agencyId(request.getAgencyId())
                .walletId(request.getWalletId())
                .isLocked(Boolean.TRUE.equals(request.getIsLocked()))
                .build());

        List<SplitRuleDetail> rules = new ArrayList<>();
        if (request.getRules() != null) {
            for (CreateSplitRuleRequest ruleRequest : request.getRules()) {
                rules.add(SplitRuleDetail.from(
                        splitRuleRepository.save(newRule(configurationId, receiver.getId(), ruleRequest))));
            }
        }
        return SplitReceiverDetail.from(receiver, rules);
    }

    private SplitRule newRule(Long configurationId, Long receiverId, CreateSplitRuleRequest request) {
        return SplitRule.builder()
                .configurationId(configurationId)
                .receiverId(receiverId)
                .ruleType(request.getRuleType())
                .value(request.getValue())
                .minimumAmount(request.getMinimumAmount())
                .maximumAmount(request.getMaximumAmount())
                .chargeType(request.getChargeType())
                .priority(request.getPriority() == null ? 0 : request.getPriority())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .build();
    }

    private Integer nextVersion(String scopeKey, String name) {
        Integer max = splitConfigurationRepository.findMaxVersion(scopeKey, name);
        return max == null ? 1 : max + 1;
    }

    private SplitReceiverDetail toReceiverDetail(SplitReceiver receiver) {
        List<SplitRuleDetail> rules = splitRuleRepository.findByReceiverIdOrderByIdAsc(receiver.getId()).stream()
                .map(SplitRuleDetail::from)
                .toList();
        return SplitReceiverDetail.from(receiver, rules);
    }

    /**
     * 설정 → 수신자 → 규칙 트리 (id 오름차순)
     */
    private SplitConfigurationDetail toDetail(SplitConfiguration configuration) {
        Map<Long, List<SplitRuleDetail>> rulesByReceiver = new LinkedHashMap<>();
        for (SplitRule rule : splitRuleRepository.findByConfigurationIdOrderByIdAsc(configuration.getId())) {
            rulesByReceiver.computeIfAbsent(rule.getReceiverId(), key -> new ArrayList<>())
                    .add(SplitRuleDetail.from(rule));
        }
        List<SplitReceiverDetail> receivers = new ArrayList<>();
        for (SplitReceiver receiver : splitReceiverRepository.findByConfigurationIdOrderByIdAsc(configuration.getId())) {
            receivers.add(SplitReceiverDetail.from(receiver,
                    rulesByReceiver.getOrDefault(receiver.getId(), List.of())));
        }
        return SplitConfigurationDetail.from(configuration, receivers);
    }

    private Map<String, Object> statusSnapshot(ConfigurationStatus status, Boolean isValidated) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", status);
        snapshot.put("isValidated", isValidated);
        return snapshot;
    }

    private String newToken() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
    }
}
