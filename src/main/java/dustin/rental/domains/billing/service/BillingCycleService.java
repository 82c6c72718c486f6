package dustin.rental.domains.billing.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.rental.domains.audit.model.AuditAction;
import dustin.rental.domains.audit.model.AuditEntityType;
import dustin.rental.domains.audit.service.SplitAuditService;
import dustin.rental.domains.billing.model.BillingCycleStatus;
import dustin.rental.domains.billing.model.BillingScope;
import dustin.rental.domains.billing.model.dto.BillingChargeResponse;
import dustin.rental.domains.billing.model.dto.BillingCycleResponse;
import dustin.rental.domains.billing.model.dto.ChargeCreation;
import dustin.rental.domains.billing.model.dto.ChargeDraft;
import dustin.rental.domains.billing.model.dto.ClosedCycleResult;
import dustin.rental.domains.billing.model.dto.UsageOverage;
import dustin.rental.domains.billing.model.entity.BillingCycle;
import dustin.rental.domains.billing.repository.BillingCycleRepository;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.shared.exception.NotFoundException;
import dustin.rental.shared.exception.StateConflictException;
import dustin.rental.shared.model.dto.PageResponse;
import dustin.rental.shared.security.ActorContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 월별 청구 주기 서비스
 * Billing Cycle Service
 *
 * 역할:
 * - (범위, 월) 당 하나의 청구 주기 생성/조회
 * - 주기 마감: 초과 사용량 청구(OVERUSE)와 보레토 운영 수수료 청구(OPERATIONAL_FEE) 생성
 * - 마감은 주기 행 락으로 직렬화되어 한 번만 청구가 만들어짐
 *
 * 주기 생성은 별도 트랜잭션(REQUIRES_NEW)에서 커밋하고,
 * 동시 생성으로 유니크 제약 위반 시 이미 만들어진 주기를 다시 읽는다.
 */
@Slf4j
@Service
public class BillingCycleService {

    private final BillingCycleRepository billingCycleRepository;
    private final BillingChargeService billingChargeService;
    private final OverageCalculator overageCalculator;
    private final PlanResolver planResolver;
    private final SplitAuditService splitAuditService;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNewTemplate;

    public BillingCycleService(BillingCycleRepository billingCycleRepository,
                               BillingChargeService billingChargeService,
                               OverageCalculator overageCalculator,
                               PlanResolver planResolver,
                               SplitAuditService splitAuditService,
                               ObjectMapper objectMapper,
                               PlatformTransactionManager transactionManager) {
        this.billingCycleRepository = billingCycleRepository;
        this.billingChargeService = billingChargeService;
        this.overageCalculator = overageCalculator;
        this.planResolver = planResolver;
        this.splitAuditService = splitAuditService;
        this.objectMapper = objectMapper;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public BillingCycle getOrCreateCurrentCycle(BillingScope scope) {
        return getOrCreateCycle(scope, YearMonth.now().toString());
    }

    /**
     * (범위, 월) 주기 조회, 없으면 생성
     * Get or create cycle
     */
    public BillingCycle getOrCreateCycle(BillingScope scope, String billingMonth) {
        return billingCycleRepository.findByScopeKeyAndBillingMonth(scope.getScopeKey(), billingMonth)
                .orElseGet(() -> createCycle(scope, billingMonth));
    }

    /**
     * 이번 달 주기를 비관적 락으로 조회 (없으면 생성 후 락)
     *
     * closeCycle 과 같은 행 락을 잡으므로 사용량 기록과 마감이 직렬화된다.
     * id 만 먼저 조회해 락 조회가 캐시된 엔티티가 아닌 커밋된 상태를 읽도록 한다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BillingCycle lockCurrentCycle(BillingScope scope) {
        String billingMonth = YearMonth.now().toString();
        Long cycleId = billingCycleRepository.findIdByScopeKeyAndBillingMonth(scope.getScopeKey(), billingMonth)
                .orElseGet(() -> createCycle(scope, billingMonth).getId());
        return billingCycleRepository.findByIdForUpdate(cycleId)
                .orElseThrow(() -> new NotFoundException("Billing cycle not found: id=" + cycleId));
    }

    private BillingCycle createCycle(BillingScope scope, String billingMonth) {
        try {
            BillingCycle created = requiresNewTemplate.execute(status -> {
                BillingCycle cycle = billingCycleRepository.saveAndFlush(BillingCycle.builder()
                        .agencyId(scope.getAgencyId())
                        .ownerId(scope.getOwnerId())
                        .scopeKey(scope.getScopeKey())
                        .billingMonth(billingMonth)
                        .status(BillingCycleStatus.OPEN)
                        .planName(planResolver.resolvePlan(scope))
                        .build());
                splitAuditService.record(null, AuditAction.CREATE, AuditEntityType.BILLING_CYCLE, cycle.getId(),
                        null, cycleSnapshot(cycle), ActorContext.SYSTEM_ACTOR, "Billing cycle opened");
                return cycle;
            });
            log.info("[BillingCycleService] 청구 주기 생성: scope={}, month={}, plan={}",
                    scope, billingMonth, created.getPlanName());
            return created;
        } catch (DataIntegrityViolationException e) {
            log.info("[BillingCycleService] 동시 생성된 청구 주기 재조회: scope={}, month={}", scope, billingMonth);
            return billingCycleRepository.findByScopeKeyAndBillingMonth(scope.getScopeKey(), billingMonth)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public PageResponse<BillingCycleResponse> findAll(BillingScope scope, Pageable pageable) {
        return PageResponse.of(
                billingCycleRepository.findByScopeKeyOrderByBillingMonthDesc(scope.getScopeKey(), pageable),
                this::toResponse);
    }

    @Transactional(readOnly = true)
    public BillingCycleResponse findOne(Long cycleId) {
        return toResponse(getCycle(cycleId));
    }

    public BillingCycleResponse getCurrent(BillingScope scope) {
        return toResponse(getOrCreateCurrentCycle(scope));
    }

    /**
     * 마감 전 주기의 현재 초과 사용량 (마감된 주기는 스냅샷)
     */
    @Transactional(readOnly = true)
    public List<UsageOverage> getOverages(Long cycleId) {
        BillingCycle cycle = getCycle(cycleId);
        if (cycle.getStatus() == BillingCycleStatus.CLOSED) {
            return readUsageSnapshot(cycle);
        }
        return overageCalculator.calculateOverages(cycle.toScope(), cycle.getBillingMonth(), cycle.getPlanName());
    }

    @Transactional(readOnly = true)
    public List<Long> findOpenCycleIdsBefore(String billingMonth) {
        return billingCycleRepository.findIdsByStatusAndBillingMonthBefore(BillingCycleStatus.OPEN, billingMonth);
    }

    /**
     * 청구 주기 마감
     * Close billing cycle
     *
     * 처리 순서:
     * 1. 주기 행 비관적 락, OPEN 이 아니면 StateConflictException
     * 2. 요금제 한도 기준 초과 사용량 합계 → OVERUSE 청구
     * 3. 보레토 건수 × 마크업 → OPERATIONAL_FEE 청구
     * 4. 주기 CLOSED 기록 + CLOSE_CYCLE 감사 로그
     *
     * 청구 생성이 실패하면 전체 롤백되어 주기는 OPEN 으로 남는다.
     */
    @Transactional
    public ClosedCycleResult closeCycle(Long cycleId, String closedBy) {
        BillingCycle cycle = billingCycleRepository.findByIdForUpdate(cycleId)
                .orElseThrow(() -> new NotFoundException("Billing cycle not found: id=" + cycleId));
        if (cycle.getStatus() != BillingCycleStatus.OPEN) {
            throw new StateConflictException("Billing cycle " + cycleId + " is already closed");
        }
        Map<String, Object> before = cycleSnapshot(cycle);

        BillingScope scope = cycle.toScope();
        String planName = planResolver.resolvePlan(scope);
        List<UsageOverage> overages =
                overageCalculator.calculateOverages(scope, cycle.getBillingMonth(), planName);
        BigDecimal overuseTotal = overageCalculator.totalOverageCharge(overages);
        int boletoCount = overageCalculator.countBoletos(scope, cycle.getBillingMonth());
        BigDecimal operationalFee = overageCalculator.operationalFee(boletoCount);

        List<ChargeCreation> creations = new ArrayList<>();
        if (overuseTotal.signum() > 0) {
            creations.add(billingChargeService.createCharge(draft(cycle, ChargeType.OVERUSE,
                    overuseDescription(overages), overuseTotal)));
        }
        if (operationalFee.signum() > 0) {
            creations.add(billingChargeService.createCharge(draft(cycle, ChargeType.OPERATIONAL_FEE,
                    "Operational fee - " + boletoCount + " boletos x R$" + overageCalculator.operationalFee(1),
                    operationalFee)));
        }

        BigDecimal totalPlatformFee = creations.stream()
                .map(creation -> creation.getCharge().getPlatformFee())
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
        List<Long> chargeIds = creations.stream().map(creation -> creation.getCharge().getId()).toList();

        cycle.setStatus(BillingCycleStatus.CLOSED);
        cycle.setPlanName(planName);
        cycle.setClosedAt(LocalDateTime.now());
        cycle.setClosedBy(closedBy);
        cycle.setOveruseChargeValue(overuseTotal);
        cycle.setBoletoCount(boletoCount);
        cycle.setOperationalCharges(operationalFee);
        cycle.setTotalPlatformFee(totalPlatformFee);
        cycle.setUsageSnapshotJson(writeJson(overages));
        cycle.setChargeIdsJson(writeJson(chargeIds));
        billingCycleRepository.save(cycle);

        splitAuditService.record(null, AuditAction.CLOSE_CYCLE, AuditEntityType.BILLING_CYCLE, cycle.getId(),
                before, cycleSnapshot(cycle), closedBy, null);

        List<String> warnings = creations.stream()
                .map(ChargeCreation::getWarning)
                .filter(warning -> warning != null)
                .collect(Collectors.toList());
        log.info("[BillingCycleService] 청구 주기 마감: cycleId={}, scope={}, month={}, overuse={}, operational={}, charges={}",
                cycleId, scope, cycle.getBillingMonth(), overuseTotal, operationalFee, chargeIds);

        List<BillingChargeResponse> charges = creations.stream()
                .map(creation -> billingChargeService.toResponse(creation.getCharge()))
                .toList();
        return ClosedCycleResult.builder()
                .cycle(toResponse(cycle))
                .charges(charges)
                .warnings(warnings)
                .build();
    }

    public BillingCycleResponse toResponse(BillingCycle cycle) {
        List<UsageOverage> usage = cycle.getStatus() == BillingCycleStatus.CLOSED
                ? readUsageSnapshot(cycle)
                : Collections.emptyList();
        return BillingCycleResponse.builder()
                .id(cycle.getId())
                .agencyId(cycle.getAgencyId())
                .ownerId(cycle.getOwnerId())
                .billingMonth(cycle.getBillingMonth())
                .status(cycle.getStatus())
                .planName(cycle.getPlanName())
                .usage(usage)
                .overuseChargeValue(cycle.getOveruseChargeValue())
                .boletoCount(cycle.getBoletoCount())
                .operationalCharges(cycle.getOperationalCharges())
                .totalPlatformFee(cycle.getTotalPlatformFee())
                .chargeIds(readChargeIds(cycle))
                .closedAt(cycle.getClosedAt())
                .closedBy(cycle.getClosedBy())
                .createdAt(cycle.getCreatedAt())
                .build();
    }

    private BillingCycle getCycle(Long cycleId) {
        return billingCycleRepository.findById(cycleId)
                .orElseThrow(() -> new NotFoundException("Billing cycle not found: id=" + cycleId));
    }

    private ChargeDraft draft(BillingCycle cycle, ChargeType chargeType, String description, BigDecimal amount) {
        return ChargeDraft.builder()
                .agencyId(cycle.getAgencyId())
                .ownerId(cycle.getOwnerId())
                .billingCycleId(cycle.getId())
                .chargeType(chargeType)
                .description(description)
                .billingMonth(cycle.getBillingMonth())
                .grossValue(amount)
                .build();
    }

    private String overuseDescription(List<UsageOverage> overages) {
        return "Extra usage - " + overages.stream()
                .filter(overage -> overage.getOverage() > 0)
                .map(overage -> overage.getFeature().getLabel() + ": " + overage.getOverage()
                        + " units x R$" + overage.getUnitPrice().setScale(2))
                .collect(Collectors.joining(", "));
    }

    private Map<String, Object> cycleSnapshot(BillingCycle cycle) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("scopeKey", cycle.getScopeKey());
        snapshot.put("billingMonth", cycle.getBillingMonth());
        snapshot.put("status", cycle.getStatus());
        snapshot.put("planName", cycle.getPlanName());
        snapshot.put("overuseChargeValue", cycle.getOveruseChargeValue());
        snapshot.put("operationalCharges", cycle.getOperationalCharges());
        snapshot.put("totalPlatformFee", cycle.getTotalPlatformFee());
        snapshot.put("chargeIds", cycle.getChargeIdsJson());
        return snapshot;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize billing cycle data", e);
        }
    }

    private List<UsageOverage> readUsageSnapshot(BillingCycle cycle) {
        if (cycle.getUsageSnapshotJson() == null) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(cycle.getUsageSnapshotJson(), new TypeReference<List<UsageOverage>>() {});
        } catch (JsonProcessingException e) {
            log.warn("[BillingCycleService] 사용량 스냅샷 파싱 실패: cycleId={}", cycle.getId(), e);
            return Collections.emptyList();
        }
    }

    private List<Long> readChargeIds(BillingCycle cycle) {
        if (cycle.getChargeIdsJson() == null) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(cycle.getChargeIdsJson(), new TypeReference<List<Long>>() {});
        } catch (JsonProcessingException e) {
            log.warn("[BillingCycleService] 청구 ID 목록 파싱 실패: cycleId={}", cycle.getId(), e);
            return Collections.emptyList();
        }
    }
}
