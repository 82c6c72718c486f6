package dustin.rental.domains.billing.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.rental.domains.billing.config.BillingPlanProperties;
import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.billing.model.dto.BillingChargeResponse;
import dustin.rental.domains.billing.model.dto.ChargeCreation;
import dustin.rental.domains.billing.model.dto.ChargeDraft;
import dustin.rental.domains.billing.model.dto.GatewayReferenceRequest;
import dustin.rental.domains.billing.model.dto.PaymentGatewayRequest;
import dustin.rental.domains.billing.model.dto.PaymentWebhookRequest;
import dustin.rental.domains.billing.model.entity.BillingCharge;
import dustin.rental.domains.billing.model.event.ChargeCreatedEvent;
import dustin.rental.domains.billing.model.event.ChargeStatusChangedEvent;
import dustin.rental.domains.billing.repository.BillingChargeRepository;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.ReceiverType;
import dustin.rental.domains.split.model.dto.ReceiverSplit;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitResult;
import dustin.rental.domains.split.service.SplitCalculator;
import dustin.rental.domains.split.service.SplitConfigurationService;
import dustin.rental.shared.exception.CalculationInconsistencyException;
import dustin.rental.shared.exception.NotFoundException;
import dustin.rental.shared.exception.StateConflictException;
import dustin.rental.shared.model.dto.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 청구 서비스
 * Billing Charge Service
 *
 * 역할:
 * - 청구 생성: 범위의 활성 분할 설정으로 플랫폼 수수료 계산 후 저장
 * - 게이트웨이 결제 참조 등록, 웹훅 상태 반영, 환불
 * - 커밋 후 게이트웨이/알림 이벤트 발행 (ChargeEventListener)
 *
 * 처리 흐름:
 * 요청 → 활성 설정 조회 → SplitCalculator → (불일치 시 차단) → 저장 → ChargeCreatedEvent
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingChargeService {

    private final BillingChargeRepository billingChargeRepository;
    private final SplitConfigurationService splitConfigurationService;
    private final SplitCalculator splitCalculator;
    private final BillingPlanProperties billingPlanProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    /**
     * 청구 생성
     * Create charge
     *
     * - 활성 설정 있음: 분할 계산, 합계 불일치면 CalculationInconsistencyException (청구 생성 차단)
     * - 활성 설정 없음: 플랫폼 수수료 0 으로 저장하고 경고 반환
     */
    @Transactional
    public ChargeCreation createCharge(ChargeDraft draft) {
        BigDecimal grossValue = draft.getGrossValue();
        if (grossValue == null || grossValue.signum() <= 0) {
            throw new IllegalArgumentException("Charge gross value must be positive: " + grossValue);
        }
        if (draft.getChargeType() == null) {
            throw new IllegalArgumentException("Charge type is required");
        }

        Optional<SplitConfigurationDetail> configuration = splitConfigurationService.findActiveForScope(
                draft.getAgencyId(), draft.getOwnerId(), draft.getContractId(), draft.getPropertyId());

        BigDecimal platformFee = BigDecimal.ZERO.setScale(SplitCalculator.MONEY_SCALE);
        SplitResult splitResult = null;
        String warning = null;

        if (configuration.isPresent()) {
            splitResult = splitCalculator.calculate(configuration.get(), grossValue, draft.getChargeType());
            if (!Boolean.TRUE.equals(splitResult.getIsValid())) {
                log.error("[BillingChargeService] 분할 합계 불일치로 청구 차단: configurationId={}, gross={}, total={}, errors={}",
                        configuration.get().getId(), grossValue, splitResult.getTotalDistributed(), splitResult.getErrors());
                throw new CalculationInconsistencyException(configuration.get().getId(),
                        splitResult.getTotalDistributed(), grossValue, splitResult.getErrors());
            }
            platformFee = splitResult.getReceivers().stream()
                    .filter(receiver -> receiver.getReceiverType() == ReceiverType.PLATFORM)
                    .map(ReceiverSplit::getAmount)
                    .reduce(platformFee, BigDecimal::add);
        } else {
            warning = "No active split configuration for charge " + draft.getChargeType()
                    + " (agencyId=" + draft.getAgencyId() + ", ownerId=" + draft.getOwnerId()
                    + ", contractId=" + draft.getContractId() + "); recorded with platformFee=0";
            log.warn("[BillingChargeService] {}", warning);
        }

        String billingMonth = draft.getBillingMonth() != null ? draft.getBillingMonth() : YearMonth.now().toString();
        BillingCharge charge = BillingCharge.builder()
                .token(UUID.randomUUID().toString().substring(0, 8).toUpperCase())
                .agencyId(draft.getAgencyId())
                .ownerId(draft.getOwnerId())
                .contractId(draft.getContractId())
                .propertyId(draft.getPropertyId())
                .tenantId(draft.getTenantId())
                .billingCycleId(draft.getBillingCycleId())
                .chargeType(draft.getChargeType())
                .description(draft.getDescription())
                .billingMonth(billingMonth)
                .grossValue(grossValue.setScale(SplitCalculator.MONEY_SCALE, SplitCalculator.ROUNDING))
                .platformFee(platformFee)
                .netValue(grossValue.subtract(platformFee).setScale(SplitCalculator.MONEY_SCALE, SplitCalculator.ROUNDING))
                .splitConfigurationId(configuration.map(SplitConfigurationDetail::getId).orElse(null))
                .splitBreakdown(splitResult == null ? null : writeJson(splitResult))
                .status(ChargeStatus.PENDING)
                .dueDate(draft.getDueDate() != null ? draft.getDueDate() : defaultDueDate(billingMonth))
                .build();
        BillingCharge saved = billingChargeRepository.save(charge);

        eventPublisher.publishEvent(new ChargeCreatedEvent(PaymentGatewayRequest.builder()
                .chargeId(saved.getId())
                .chargeToken(saved.getToken())
                .customerId(customerId(saved))
                .amount(saved.getGrossValue())
                .dueDate(saved.getDueDate())
                .description(saved.getDescription())
                .splitBreakdown(splitResult)
                .build()));

        log.info("[BillingChargeService] 청구 생성: chargeId={}, type={}, gross={}, platformFee={}, configurationId={}",
                saved.getId(), saved.getChargeType(), saved.getGrossValue(), platformFee, saved.getSplitConfigurationId());
        return new ChargeCreation(saved, warning);
    }

    @Transactional(readOnly = true)
    public PageResponse<BillingChargeResponse> findAll(Long agencyId, Long ownerId, Long contractId, Long tenantId,
                                                       ChargeType chargeType, ChargeStatus status,
                                                       String billingMonth, Pageable pageable) {
        return PageResponse.of(
                billingChargeRepository.search(agencyId, ownerId, contractId, tenantId, chargeType, status,
                        billingMonth, pageable),
                this::toResponse);
    }

    /**
     * token 우선 조회, 없고 숫자면 id 로 조회
     */
    @Transactional(readOnly = true)
    public BillingChargeResponse findOne(String idOrToken) {
        Optional<BillingCharge> charge = billingChargeRepository.findByToken(idOrToken);
        if (charge.isEmpty() && idOrToken.chars().allMatch(Character::isDigit)) {
            charge = billingChargeRepository.findById(Long.valueOf(idOrToken));
        }
        return charge.map(this::toResponse)
                .orElseThrow(() -> new NotFoundException("Charge not found: " + idOrToken));
    }

    /**
     * 게이트웨이 결제 참조 등록 (PENDING → PROCESSING)
     */
    @Transactional
    public BillingChargeResponse attachGatewayReference(Long chargeId, GatewayReferenceRequest request) {
        BillingCharge charge = lockCharge(chargeId);
        if (charge.isSubmittedToGateway()) {
            throw new StateConflictException("Charge " + chargeId + " already has gateway payment "
                    + charge.getGatewayPaymentId());
        }
        if (charge.getStatus() != ChargeStatus.PENDING) {
            throw new StateConflictException("Charge " + chargeId + " is not pending (status=" + charge.getStatus() + ")");
        }
        charge.setGatewayPaymentId(request.getGatewayPaymentId());
        charge.setPaymentLink(request.getPaymentLink());
        charge.setStatus(ChargeStatus.PROCESSING);
        billingChargeRepository.save(charge);

        log.info("[BillingChargeService] 게이트웨이 결제 등록: chargeId={}, gatewayPaymentId={}",
                chargeId, request.getGatewayPaymentId());
        return toResponse(charge);
    }

    /**
     * 게이트웨이 웹훅 반영. 알 수 없는 결제 ID 는 경고 로그 후 무시
     */
    @Transactional
    public void handleGatewayEvent(PaymentWebhookRequest request) {
        Optional<BillingCharge> found = billingChargeRepository.findByGatewayPaymentId(request.getGatewayPaymentId());
        if (found.isEmpty()) {
            log.warn("[BillingChargeService] 알 수 없는 게이트웨이 결제 웹훅: gatewayPaymentId={}, event={}",
                    request.getGatewayPaymentId(), request.getEvent());
            return;
        }
        BillingCharge charge = found.get();
        ChargeStatus previous = charge.getStatus();
        LocalDateTime now = LocalDateTime.now();

        switch (request.getEvent()) {
            case "PAYMENT_RECEIVED":
            case "PAYMENT_CONFIRMED":
                charge.setStatus(ChargeStatus.PAID);
                charge.setPaidAt(now);
                charge.setPaidValue(request.getValue() != null ? request.getValue() : charge.getGrossValue());
                charge.setPaymentMethod(request.getBillingType());
                break;
            case "PAYMENT_OVERDUE":
                charge.setStatus(ChargeStatus.OVERDUE);
                break;
            case "PAYMENT_REFUNDED":
                charge.setStatus(ChargeStatus.REFUNDED);
                charge.setRefundedAt(now);
                charge.setRefundedValue(charge.getPaidValue() != null ? charge.getPaidValue() : request.getValue());
                break;
            default:
                log.info("[BillingChargeService] 처리하지 않는 웹훅 이벤트: event={}, chargeId={}",
                        request.getEvent(), charge.getId());
        }
        charge.setLastGatewayEvent(request.getEvent());
        charge.setLastGatewayEventAt(now);
        billingChargeRepository.save(charge);

        if (previous != charge.getStatus()) {
            publishStatusChange(charge, previous, request.getEvent());
        }
    }

    /**
     * 환불 요청 (PAID 만 가능)
     */
    @Transactional
    public BillingChargeResponse refund(Long chargeId, String reason) {
        BillingCharge charge = lockCharge(chargeId);
        if (charge.getStatus() != ChargeStatus.PAID) {
            throw new StateConflictException("Only paid charges can be refunded (charge " + chargeId
                    + " is " + charge.getStatus() + ")");
        }
        ChargeStatus previous = charge.getStatus();
        charge.setStatus(ChargeStatus.REFUNDED);
        charge.setRefundedAt(LocalDateTime.now());
        charge.setRefundedValue(charge.getPaidValue() != null ? charge.getPaidValue() : charge.getGrossValue());
        charge.setRefundReason(reason);
        billingChargeRepository.save(charge);

        publishStatusChange(charge, previous, reason);
        log.info("[BillingChargeService] 환불 처리: chargeId={}, refundedValue={}", chargeId, charge.getRefundedValue());
        return toResponse(charge);
    }

    public BillingChargeResponse toResponse(BillingCharge charge) {
        return BillingChargeResponse.builder()
                .id(charge.getId())
                .token(charge.getToken())
                .agencyId(charge.getAgencyId())
                .ownerId(charge.getOwnerId())
                .contractId(charge.getContractId())
                .propertyId(charge.getPropertyId())
                .tenantId(charge.getTenantId())
                .billingCycleId(charge.getBillingCycleId())
                .chargeType(charge.getChargeType())
                .description(charge.getDescription())
                .billingMonth(charge.getBillingMonth())
                .grossValue(charge.getGrossValue())
                .platformFee(charge.getPlatformFee())
                .netValue(charge.getNetValue())
                .splitConfigurationId(charge.getSplitConfigurationId())
                .splitBreakdown(parseSplitBreakdown(charge))
                .status(charge.getStatus())
                .dueDate(charge.getDueDate())
                .gatewayPaymentId(charge.getGatewayPaymentId())
                .paymentLink(charge.getPaymentLink())
                .paymentMethod(charge.getPaymentMethod())
                .paidValue(charge.getPaidValue())
                .paidAt(charge.getPaidAt())
                .refundedValue(charge.getRefundedValue())
                .refundedAt(charge.getRefundedAt())
                .refundReason(charge.getRefundReason())
                .lastGatewayEvent(charge.getLastGatewayEvent())
                .createdAt(charge.getCreatedAt())
                .build();
    }

    private BillingCharge lockCharge(Long chargeId) {
        return billingChargeRepository.findByIdForUpdate(chargeId)
                .orElseThrow(() -> new NotFoundException("Charge not found: id=" + chargeId));
    }

    private void publishStatusChange(BillingCharge charge, ChargeStatus previous, String reason) {
        eventPublisher.publishEvent(ChargeStatusChangedEvent.builder()
                .chargeId(charge.getId())
                .chargeToken(charge.getToken())
                .previousStatus(previous)
                .newStatus(charge.getStatus())
                .amount(charge.getGrossValue())
                .reason(reason)
                .build());
    }

    private LocalDate defaultDueDate(String billingMonth) {
        YearMonth next = YearMonth.parse(billingMonth).plusMonths(1);
        return next.atDay(Math.min(billingPlanProperties.getDueDayOfMonth(), next.lengthOfMonth()));
    }

    private String customerId(BillingCharge charge) {
        if (charge.getTenantId() != null) {
            return "tenant:" + charge.getTenantId();
        }
        if (charge.getAgencyId() != null) {
            return "agency:" + charge.getAgencyId();
        }
        return charge.getOwnerId() != null ? "owner:" + charge.getOwnerId() : null;
    }

    private String writeJson(SplitResult splitResult) {
        try {
            return objectMapper.writeValueAsString(splitResult);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize split breakdown", e);
        }
    }

    private SplitResult parseSplitBreakdown(BillingCharge charge) {
        if (charge.getSplitBreakdown() == null || charge.getSplitBreakdown().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(charge.getSplitBreakdown(), SplitResult.class);
        } catch (JsonProcessingException e) {
            log.warn("[BillingChargeService] splitBreakdown JSON 파싱 실패: chargeId={}", charge.getId(), e);
            return null;
        }
    }
}
