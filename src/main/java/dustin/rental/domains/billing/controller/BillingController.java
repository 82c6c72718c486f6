package dustin.rental.domains.billing.controller;

import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.rental.domains.billing.model.BillingScope;
import dustin.rental.domains.billing.model.ChargeStatus;
import dustin.rental.domains.billing.model.dto.BillingChargeResponse;
import dustin.rental.domains.billing.model.dto.BillingCycleResponse;
import dustin.rental.domains.billing.model.dto.ChargeCreation;
import dustin.rental.domains.billing.model.dto.ClosedCycleResult;
import dustin.rental.domains.billing.model.dto.CreateChargeRequest;
import dustin.rental.domains.billing.model.dto.GatewayReferenceRequest;
import dustin.rental.domains.billing.model.dto.PaymentWebhookRequest;
import dustin.rental.domains.billing.model.dto.RefundRequest;
import dustin.rental.domains.billing.model.dto.TrackUsageRequest;
import dustin.rental.domains.billing.model.dto.UsageOverage;
import dustin.rental.domains.billing.model.dto.UsageRecordResponse;
import dustin.rental.domains.billing.service.BillingChargeService;
import dustin.rental.domains.billing.service.BillingCycleService;
import dustin.rental.domains.billing.service.UsageTrackingService;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.shared.model.dto.PageResponse;
import dustin.rental.shared.security.ActorContext;
import dustin.rental.shared.security.Capability;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 청구 컨트롤러
 * Billing Controller
 *
 * 역할:
 * - 월별 청구 주기 조회/마감
 * - 청구 생성/조회, 게이트웨이 참조 등록, 환불
 * - 사용량 기록, 초과 사용량 조회
 * - 결제 게이트웨이 웹훅 수신
 */
@RestController
@RequestMapping("/api/billing")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "청구 API (월별 주기, 청구, 사용량, 결제 웹훅)")
public class BillingController {

    private final BillingCycleService billingCycleService;
    private final BillingChargeService billingChargeService;
    private final UsageTrackingService usageTrackingService;

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 청구 주기
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @GetMapping("/cycles")
    @Operation(summary = "청구 주기 목록", description = "agencyId 또는 ownerId 중 하나로 조회 (최신 월 순)")
    public ResponseEntity<PageResponse<BillingCycleResponse>> listCycles(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "12") int size) {
        return ResponseEntity.ok(billingCycleService.findAll(BillingScope.of(agencyId, ownerId),
                PageRequest.of(page, size)));
    }

    @GetMapping("/cycles/current")
    @Operation(summary = "현재 월 청구 주기", description = "없으면 OPEN 상태로 생성")
    public ResponseEntity<BillingCycleResponse> currentCycle(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId) {
        return ResponseEntity.ok(billingCycleService.getCurrent(BillingScope.of(agencyId, ownerId)));
    }

    @GetMapping("/cycles/{id}")
    @Operation(summary = "청구 주기 상세")
    public ResponseEntity<BillingCycleResponse> getCycle(@PathVariable Long id) {
        return ResponseEntity.ok(billingCycleService.findOne(id));
    }

    @GetMapping("/cycles/{id}/overages")
    @Operation(summary = "청구 주기 초과 사용량", description = "마감된 주기는 마감 시점 스냅샷")
    public ResponseEntity<List<UsageOverage>> cycleOverages(@PathVariable Long id) {
        return ResponseEntity.ok(billingCycleService.getOverages(id));
    }

    @PostMapping("/cycles/{id}/close")
    @Operation(summary = "청구 주기 마감", description = "초과 사용량/운영 수수료 청구 생성. 이미 마감된 주기는 409")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "마감 성공"),
            @ApiResponse(responseCode = "409", description = "이미 마감됨"),
            @ApiResponse(responseCode = "422", description = "분할 합계 불일치로 청구 생성 불가")
    })
    public ResponseEntity<ClosedCycleResult> closeCycle(
            @PathVariable Long id,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.BILLING_CLOSE);
        return ResponseEntity.ok(billingCycleService.closeCycle(id, actor.getActorId()));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 청구
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @GetMapping("/charges")
    @Operation(summary = "청구 목록")
    public ResponseEntity<PageResponse<BillingChargeResponse>> listCharges(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(required = false) Long contractId,
            @RequestParam(required = false) Long tenantId,
            @RequestParam(required = false) ChargeType chargeType,
            @RequestParam(required = false) ChargeStatus status,
            @RequestParam(required = false) String billingMonth,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(billingChargeService.findAll(agencyId, ownerId, contractId, tenantId, chargeType,
                status, billingMonth, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt", "id"))));
    }

    @GetMapping("/charges/{idOrToken}")
    @Operation(summary = "청구 상세 (id 또는 token)")
    public ResponseEntity<BillingChargeResponse> getCharge(@PathVariable String idOrToken) {
        return ResponseEntity.ok(billingChargeService.findOne(idOrToken));
    }

    @PostMapping("/charges")
    @Operation(summary = "청구 생성", description = "범위의 활성 분할 설정으로 플랫폼 수수료 계산. 설정이 없으면 수수료 0 + 경고")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "생성 성공"),
            @ApiResponse(responseCode = "422", description = "분할 합계 불일치")
    })
    public ResponseEntity<BillingChargeResponse> createCharge(
            @Valid @RequestBody CreateChargeRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.BILLING_MANAGE);
        ChargeCreation creation = billingChargeService.createCharge(request.toDraft());
        BillingChargeResponse response = billingChargeService.toResponse(creation.getCharge());
        response.setWarning(creation.getWarning());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/charges/{id}/gateway-reference")
    @Operation(summary = "게이트웨이 결제 참조 등록", description = "등록 후 총액/분할 내역 변경 불가")
    public ResponseEntity<BillingChargeResponse> attachGatewayReference(
            @PathVariable Long id,
            @Valid @RequestBody GatewayReferenceRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.BILLING_MANAGE);
        return ResponseEntity.ok(billingChargeService.attachGatewayReference(id, request));
    }

    @PostMapping("/charges/{id}/refund")
    @Operation(summary = "환불", description = "PAID 청구만 가능 (그 외 409)")
    public ResponseEntity<BillingChargeResponse> refund(
            @PathVariable Long id,
            @RequestBody(required = false) RefundRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.BILLING_MANAGE);
        return ResponseEntity.ok(billingChargeService.refund(id, request != null ? request.getReason() : null));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 사용량
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @PostMapping("/usage/track")
    @Operation(summary = "사용량 기록", description = "현재 월 주기에 기록. 마감된 주기면 409")
    public ResponseEntity<UsageRecordResponse> trackUsage(
            @Valid @RequestBody TrackUsageRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.BILLING_MANAGE);
        return ResponseEntity.status(HttpStatus.CREATED).body(usageTrackingService.trackUsage(request));
    }

    @GetMapping("/usage/overages")
    @Operation(summary = "월 초과 사용량", description = "month 비우면 이번 달")
    public ResponseEntity<List<UsageOverage>> usageOverages(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(required = false) String month) {
        return ResponseEntity.ok(usageTrackingService.getOverages(BillingScope.of(agencyId, ownerId), month));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 결제 웹훅
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @PostMapping("/webhooks/payment")
    @Operation(summary = "결제 게이트웨이 웹훅")
    public ResponseEntity<Void> paymentWebhook(@Valid @RequestBody PaymentWebhookRequest request) {
        billingChargeService.handleGatewayEvent(request);
        return ResponseEntity.ok().build();
    }
}
