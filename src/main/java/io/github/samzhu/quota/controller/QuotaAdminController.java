package io.github.samzhu.quota.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.dto.api.AssignmentRequest;
import io.github.samzhu.quota.dto.api.OverrideRequest;
import io.github.samzhu.quota.dto.api.TierRequest;
import io.github.samzhu.quota.model.AssignmentType;
import io.github.samzhu.quota.service.QuotaAssignmentService;
import io.github.samzhu.quota.service.QuotaOverrideService;
import io.github.samzhu.quota.service.QuotaTierService;

/**
 * 配額設定管理 API 控制器。
 *
 * <p>提供方案、方案指派、個人例外的 CRUD。操作者由 {@code X-Admin-User} header 提供。
 */
@RestController
@RequestMapping("/api/v1/admin/quota")
public class QuotaAdminController {

    private static final Logger log = LoggerFactory.getLogger(QuotaAdminController.class);

    private final QuotaTierService tierService;
    private final QuotaAssignmentService assignmentService;
    private final QuotaOverrideService overrideService;

    public QuotaAdminController(
            QuotaTierService tierService,
            QuotaAssignmentService assignmentService,
            QuotaOverrideService overrideService) {
        this.tierService = tierService;
        this.assignmentService = assignmentService;
        this.overrideService = overrideService;
    }

    // ========== 方案 ==========

    @GetMapping("/tiers")
    public ResponseEntity<List<QuotaTier>> listTiers(
            @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(tierService.list(enabledOnly));
    }

    @GetMapping("/tiers/{tierId}")
    public ResponseEntity<QuotaTier> getTier(@PathVariable String tierId) {
        return ResponseEntity.ok(tierService.get(tierId));
    }

    @PostMapping("/tiers")
    public ResponseEntity<QuotaTier> createTier(
            @RequestBody @Validated TierRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String adminUser) {
        log.info("Creating tier: tierId={}, action={}, admin={}", request.tierId(), request.actionOnLimit(), adminUser);
        return ResponseEntity.status(HttpStatus.CREATED).body(tierService.create(request.toTier(), adminUser));
    }

    @PutMapping("/tiers/{tierId}")
    public ResponseEntity<QuotaTier> updateTier(
            @PathVariable String tierId,
            @RequestBody @Validated TierRequest request) {
        return ResponseEntity.ok(tierService.update(tierId, request.toTier()));
    }

    @DeleteMapping("/tiers/{tierId}")
    public ResponseEntity<Void> deleteTier(@PathVariable String tierId) {
        tierService.delete(tierId);
        return ResponseEntity.noContent().build();
    }

    // ========== 方案指派 ==========

    @GetMapping("/assignments")
    public ResponseEntity<List<QuotaAssignment>> listAssignments(
            @RequestParam(required = false) String tierId,
            @RequestParam(required = false) AssignmentType type,
            @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(assignmentService.list(tierId, type, enabledOnly));
    }

    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<QuotaAssignment> getAssignment(@PathVariable String assignmentId) {
        return ResponseEntity.ok(assignmentService.get(assignmentId));
    }

    @PostMapping("/assignments")
    public ResponseEntity<QuotaAssignment> createAssignment(
            @RequestBody @Validated AssignmentRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String adminUser) {
        log.info("Creating assignment: type={}, tierId={}, admin={}",
            request.assignmentType(), request.tierId(), adminUser);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(assignmentService.create(request.toAssignment(), adminUser));
    }

    @PutMapping("/assignments/{assignmentId}")
    public ResponseEntity<QuotaAssignment> updateAssignment(
            @PathVariable String assignmentId,
            @RequestBody @Validated AssignmentRequest request) {
        return ResponseEntity.ok(assignmentService.update(assignmentId, request.toAssignment()));
    }

    @DeleteMapping("/assignments/{assignmentId}")
    public ResponseEntity<Void> deleteAssignment(@PathVariable String assignmentId) {
        assignmentService.delete(assignmentId);
        return ResponseEntity.noContent().build();
    }

    // ========== 個人例外 ==========

    @GetMapping("/overrides")
    public ResponseEntity<List<QuotaOverride>> listOverrides(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(overrideService.list(userId, activeOnly));
    }

    @GetMapping("/overrides/{overrideId}")
    public ResponseEntity<QuotaOverride> getOverride(@PathVariable String overrideId) {
        return ResponseEntity.ok(overrideService.get(overrideId));
    }

    @PostMapping("/overrides")
    public ResponseEntity<QuotaOverride> createOverride(
            @RequestBody @Validated OverrideRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String adminUser) {
        log.info("Creating override: userId={}, type={}, admin={}",
            request.userId(), request.overrideType(), adminUser);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(overrideService.create(request.toOverride(), adminUser));
    }

    @PutMapping("/overrides/{overrideId}")
    public ResponseEntity<QuotaOverride> updateOverride(
            @PathVariable String overrideId,
            @RequestBody @Validated OverrideRequest request) {
        return ResponseEntity.ok(overrideService.update(overrideId, request.toOverride()));
    }

    @DeleteMapping("/overrides/{overrideId}")
    public ResponseEntity<Void> deleteOverride(@PathVariable String overrideId) {
        overrideService.delete(overrideId);
        return ResponseEntity.noContent().build();
    }
}
