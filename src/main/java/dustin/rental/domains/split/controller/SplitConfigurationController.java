package dustin.rental.domains.split.controller;

import java.math.BigDecimal;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.rental.domains.audit.model.dto.AuditLogResponse;
import dustin.rental.domains.audit.model.dto.AuditTrailVerification;
import dustin.rental.domains.audit.service.SplitAuditService;
import dustin.rental.domains.split.model.ChargeType;
import dustin.rental.domains.split.model.ConfigurationScope;
import dustin.rental.domains.split.model.ConfigurationStatus;
import dustin.rental.domains.split.model.dto.CreateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.CreateSplitReceiverRequest;
import dustin.rental.domains.split.model.dto.CreateSplitRuleRequest;
import dustin.rental.domains.split.model.dto.LifecycleActionRequest;
import dustin.rental.domains.split.model.dto.SplitConfigurationDetail;
import dustin.rental.domains.split.model.dto.SplitReceiverDetail;
import dustin.rental.domains.split.model.dto.SplitResult;
import dustin.rental.domains.split.model.dto.SplitRuleDetail;
import dustin.rental.domains.split.model.dto.UpdateSplitConfigurationRequest;
import dustin.rental.domains.split.model.dto.UpdateSplitReceiverRequest;
import dustin.rental.domains.split.model.dto.UpdateSplitRuleRequest;
import dustin.rental.domains.split.service.SplitConfigurationService;
import dustin.rental.shared.exception.NotFoundException;
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
 * 분할 설정 컨트롤러
 * Split Configuration Controller
 *
 * 역할:
 * - 분할 설정/수신자/규칙 관리 API
 * - 상태 전이 (검증, 활성화, 비활성화, 보관, 새 버전)
 * - 분할 계산/미리보기, 감사 로그 조회
 *
 * 권한:
 * - 변경 API 는 X-Actor-Id 헤더 필수, X-Actor-Capabilities 로 권한 확인
 * - CRUD: SPLIT_CONFIGURE, 상태 전이: SPLIT_APPROVE, 잠긴 수신자 생성: RECEIVER_LOCK
 */
@RestController
@RequestMapping("/api/split-configurations")
@RequiredArgsConstructor
@Tag(name = "Split Configurations", description = "분할 설정 API (설정/수신자/규칙 관리, 상태 전이, 분할 계산)")
public class SplitConfigurationController {

    private final SplitConfigurationService splitConfigurationService;
    private final SplitAuditService splitAuditService;

    @GetMapping
    @Operation(summary = "설정 목록 조회", description = "기관/소유자/범위/상태로 필터링한 설정 목록 (최신순)")
    public ResponseEntity<PageResponse<SplitConfigurationDetail>> list(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(required = false) ConfigurationScope scope,
            @RequestParam(required = false) ConfigurationStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(splitConfigurationService.findAll(agencyId, ownerId, scope, status,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt", "id"))));
    }

    @GetMapping("/{id}")
    @Operation(summary = "설정 상세 조회")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "설정 없음")
    })
    public ResponseEntity<SplitConfigurationDetail> get(@PathVariable Long id) {
        return ResponseEntity.ok(splitConfigurationService.findOne(id));
    }

    @GetMapping("/by-token/{token}")
    @Operation(summary = "토큰으로 설정 조회")
    public ResponseEntity<SplitConfigurationDetail> getByToken(@PathVariable String token) {
        return ResponseEntity.ok(splitConfigurationService.findByToken(token));
    }

    @GetMapping("/active")
    @Operation(summary = "범위의 활성 설정 조회",
               description = "PER_CONTRACT → PER_PROPERTY → GLOBAL → 플랫폼 기본 순으로 첫 번째 활성 설정")
    public ResponseEntity<SplitConfigurationDetail> getActive(
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(required = false) Long contractId,
            @RequestParam(required = false) Long propertyId) {
        return ResponseEntity.ok(splitConfigurationService
                .findActiveForScope(agencyId, ownerId, contractId, propertyId)
                .orElseThrow(() -> new NotFoundException("No active split configuration found for this scope")));
    }

    @PostMapping
    @Operation(summary = "설정 생성", description = "수신자와 규칙을 함께 생성할 수 있다. 항상 DRAFT 로 생성")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "생성 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "403", description = "권한 없음")
    })
    public ResponseEntity<SplitConfigurationDetail> create(
            @Valid @RequestBody CreateSplitConfigurationRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        if (request.getReceivers() != null
                && request.getReceivers().stream().anyMatch(r -> Boolean.TRUE.equals(r.getIsLocked()))) {
            actor.require(Capability.RECEIVER_LOCK);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(splitConfigurationService.create(request, actor.getActorId()));
    }

    @PutMapping("/{id}")
    @Operation(summary = "설정 수정", description = "ACTIVE/ARCHIVED 설정은 수정 불가 (409)")
    public ResponseEntity<SplitConfigurationDetail> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdateSplitConfigurationRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        return ResponseEntity.ok(splitConfigurationService.update(id, request, actor.getActorId()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "설정 삭제", description = "ACTIVE 설정은 삭제 불가 (409)")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @RequestParam(required = false) String reason,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        splitConfigurationService.delete(id, reason, actor.getActorId());
        return ResponseEntity.noContent().build();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 상태 전이
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @PatchMapping("/{id}/validate")
    @Operation(summary = "설정 검증", description = "실패 시 모든 위반 사항 목록과 함께 400")
    public ResponseEntity<SplitConfigurationDetail> validate(
            @PathVariable Long id,
            @RequestBody(required = false) LifecycleActionRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_APPROVE);
        return ResponseEntity.ok(splitConfigurationService.validate(id, notes(request), actor.getActorId()));
    }

    @PatchMapping("/{id}/activate")
    @Operation(summary = "설정 활성화", description = "같은 범위의 기존 활성 설정은 INACTIVE 로 강등")
    public ResponseEntity<SplitConfigurationDetail> activate(
            @PathVariable Long id,
            @RequestBody(required = false) LifecycleActionRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_APPROVE);
        return ResponseEntity.ok(splitConfigurationService.activate(id, reason(request), actor.getActorId()));
    }

    @PatchMapping("/{id}/deactivate")
    @Operation(summary = "설정 비활성화")
    public ResponseEntity<SplitConfigurationDetail> deactivate(
            @PathVariable Long id,
            @RequestBody(required = false) LifecycleActionRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_APPROVE);
        return ResponseEntity.ok(splitConfigurationService.deactivate(id, reason(request), actor.getActorId()));
    }

    @PatchMapping("/{id}/archive")
    @Operation(summary = "설정 보관", description = "종료 상태. 다시 활성화할 수 없다")
    public ResponseEntity<SplitConfigurationDetail> archive(
            @PathVariable Long id,
            @RequestBody(required = false) LifecycleActionRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_APPROVE);
        return ResponseEntity.ok(splitConfigurationService.archive(id, reason(request), actor.getActorId()));
    }

    @PostMapping("/{id}/new-version")
    @Operation(summary = "새 버전 생성", description = "수신자/규칙을 복사한 DRAFT 생성. 원본은 그대로 유지")
    public ResponseEntity<SplitConfigurationDetail> createNewVersion(
            @PathVariable Long id,
            @RequestBody(required = false) LifecycleActionRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(splitConfigurationService.createNewVersion(id, reason(request), actor.getActorId()));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 수신자 / 규칙
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @PostMapping("/{id}/receivers")
    @Operation(summary = "수신자 추가")
    public ResponseEntity<SplitReceiverDetail> createReceiver(
            @PathVariable Long id,
            @Valid @RequestBody CreateSplitReceiverRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        if (Boolean.TRUE.equals(request.getIsLocked())) {
            actor.require(Capability.RECEIVER_LOCK);
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(splitConfigurationService.createReceiver(id, request, actor.getActorId()));
    }

    @PutMapping("/{id}/receivers/{receiverId}")
    @Operation(summary = "수신자 수정", description = "잠긴 수신자는 상태와 무관하게 수정 불가 (409)")
    public ResponseEntity<SplitReceiverDetail> updateReceiver(
            @PathVariable Long id,
            @PathVariable Long receiverId,
            @Valid @RequestBody UpdateSplitReceiverRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        return ResponseEntity.ok(splitConfigurationService.updateReceiver(id, receiverId, request, actor.getActorId()));
    }

    @DeleteMapping("/{id}/receivers/{receiverId}")
    @Operation(summary = "수신자 삭제", description = "수신자의 규칙도 함께 삭제")
    public ResponseEntity<Void> deleteReceiver(
            @PathVariable Long id,
            @PathVariable Long receiverId,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        splitConfigurationService.deleteReceiver(id, receiverId, actor.getActorId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/receivers/{receiverId}/rules")
    @Operation(summary = "규칙 추가")
    public ResponseEntity<SplitRuleDetail> createRule(
            @PathVariable Long id,
            @PathVariable Long receiverId,
            @Valid @RequestBody CreateSplitRuleRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(splitConfigurationService.createRule(id, receiverId, request, actor.getActorId()));
    }

    @PutMapping("/{id}/rules/{ruleId}")
    @Operation(summary = "규칙 수정")
    public ResponseEntity<SplitRuleDetail> updateRule(
            @PathVariable Long id,
            @PathVariable Long ruleId,
            @Valid @RequestBody UpdateSplitRuleRequest request,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        return ResponseEntity.ok(splitConfigurationService.updateRule(id, ruleId, request, actor.getActorId()));
    }

    @DeleteMapping("/{id}/rules/{ruleId}")
    @Operation(summary = "규칙 삭제")
    public ResponseEntity<Void> deleteRule(
            @PathVariable Long id,
            @PathVariable Long ruleId,
            @Parameter(hidden = true) ActorContext actor) {
        actor.require(Capability.SPLIT_CONFIGURE);
        splitConfigurationService.deleteRule(id, ruleId, actor.getActorId());
        return ResponseEntity.noContent().build();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // 계산 / 감사 로그
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @GetMapping("/{id}/calculate")
    @Operation(summary = "분할 계산", description = "지정한 설정으로 총액을 분배. 합계 불일치는 isValid=false 로 반환")
    public ResponseEntity<SplitResult> calculate(
            @PathVariable Long id,
            @RequestParam BigDecimal amount,
            @RequestParam(required = false) ChargeType chargeType) {
        return ResponseEntity.ok(splitConfigurationService.calculate(id, amount, chargeType));
    }

    @GetMapping("/preview")
    @Operation(summary = "분할 미리보기", description = "범위의 활성 설정으로 계산. 활성 설정이 없으면 isValid=false")
    public ResponseEntity<SplitResult> preview(
            @RequestParam BigDecimal amount,
            @RequestParam(required = false) ChargeType chargeType,
            @RequestParam(required = false) Long agencyId,
            @RequestParam(required = false) Long ownerId,
            @RequestParam(required = false) Long contractId,
            @RequestParam(required = false) Long propertyId) {
        return ResponseEntity.ok(splitConfigurationService.preview(agencyId, ownerId, contractId, propertyId,
                amount, chargeType));
    }

    @GetMapping("/{id}/audit-logs")
    @Operation(summary = "감사 로그 조회", description = "최신순, 항목별 무결성 검증 결과 포함")
    public ResponseEntity<PageResponse<AuditLogResponse>> auditLogs(
            @PathVariable Long id,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(splitAuditService.findByConfiguration(id, PageRequest.of(page, size)));
    }

    @GetMapping("/{id}/audit-logs/verify")
    @Operation(summary = "감사 이력 무결성 검증")
    public ResponseEntity<AuditTrailVerification> verifyAuditTrail(@PathVariable Long id) {
        return ResponseEntity.ok(splitAuditService.verifyTrail(id));
    }

    private String reason(LifecycleActionRequest request) {
        return request == null ? null : request.getReason();
    }

    private String notes(LifecycleActionRequest request) {
        return request == null ? null : request.getNotes();
    }
}
