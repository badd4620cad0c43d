package io.github.samzhu.quota.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.exception.QuotaConfigurationException;
import io.github.samzhu.quota.exception.QuotaConflictException;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.model.AssignmentType;
import io.github.samzhu.quota.repository.QuotaAssignmentRepository;
import io.github.samzhu.quota.repository.QuotaTierRepository;

/**
 * 方案指派管理服務。
 *
 * <p>寫入規則：
 * <ul>
 *   <li>參照的方案必須存在</li>
 *   <li>依類型必須提供對應的比對欄位，Email 網域樣式須能解析</li>
 *   <li>priority 介於 0 到 999</li>
 *   <li>同一用戶最多一筆已啟用的 {@code DIRECT_USER} 指派</li>
 *   <li>更新或刪除後仍須有可用的預設方案</li>
 * </ul>
 */
@Service
public class QuotaAssignmentService {

    private static final Logger log = LoggerFactory.getLogger(QuotaAssignmentService.class);

    private final QuotaAssignmentRepository assignmentRepository;
    private final QuotaTierRepository tierRepository;
    private final AssignmentResolver assignmentResolver;
    private final Clock clock;

    public QuotaAssignmentService(
            QuotaAssignmentRepository assignmentRepository,
            QuotaTierRepository tierRepository,
            AssignmentResolver assignmentResolver,
            Clock clock) {
        this.assignmentRepository = assignmentRepository;
        this.tierRepository = tierRepository;
        this.assignmentResolver = assignmentResolver;
        this.clock = clock;
    }

    /**
     * 查詢指派，條件皆可為 null。
     *
     * @param tierId 方案
     * @param type 類型
     * @param enabledOnly 只回傳已啟用的指派
     * @return 依類型優先順序與 priority 降序排列
     */
    public List<QuotaAssignment> list(String tierId, AssignmentType type, boolean enabledOnly) {
        List<QuotaAssignment> source;
        if (tierId != null) {
            source = assignmentRepository.findByTierId(tierId);
        } else if (type != null) {
            source = assignmentRepository.findByAssignmentType(type);
        } else {
            source = assignmentRepository.findAll();
        }

        List<QuotaAssignment> result = new ArrayList<>();
        for (QuotaAssignment assignment : source) {
            if (type != null && assignment.assignmentType() != type) {
                continue;
            }
            if (enabledOnly && !assignment.enabled()) {
                continue;
            }
            result.add(assignment);
        }
        result.sort(Comparator
            .comparingInt((QuotaAssignment a) -> AssignmentType.PRECEDENCE.indexOf(a.assignmentType()))
            .thenComparing(Comparator.comparingInt(QuotaAssignment::priority).reversed()));
        return result;
    }

    public QuotaAssignment get(String assignmentId) {
        return assignmentRepository.findById(assignmentId)
            .orElseThrow(() -> new QuotaNotFoundException("Assignment", assignmentId));
    }

    /**
     * 建立指派。
     *
     * @throws QuotaConfigurationException 欄位不合法
     * @throws QuotaNotFoundException 方案不存在
     * @throws QuotaConflictException 用戶已有已啟用的直接指派
     */
    public QuotaAssignment create(QuotaAssignment assignment, String createdBy) {
        QuotaAssignment toSave = QuotaAssignment.create(
            assignment.assignmentType(), assignment.tierId(), assignment.userId(),
            assignment.jwtRole(), assignment.emailDomain(),
            assignment.priority(), assignment.enabled(), createdBy, clock.instant());
        validate(toSave);
        requireTier(toSave.tierId());
        requireNoDuplicateDirectUser(toSave);

        QuotaAssignment saved = assignmentRepository.save(toSave);
        log.info("Created assignment: id={}, type={}, tierId={}, priority={}",
            saved.assignmentId(), saved.assignmentType(), saved.tierId(), saved.priority());
        return saved;
    }

    /**
     * 更新指派。
     *
     * @throws QuotaNotFoundException 指派或方案不存在
     * @throws QuotaConflictException 變更後系統將沒有可用的預設方案
     */
    public QuotaAssignment update(String assignmentId, QuotaAssignment changes) {
        QuotaAssignment existing = get(assignmentId);
        QuotaAssignment updated = existing.withChanges(changes, clock.instant());
        validate(updated);
        requireTier(updated.tierId());
        requireNoDuplicateDirectUser(updated);
        if (existing.assignmentType() == AssignmentType.DEFAULT_TIER) {
            requireDefaultRemains(assignmentId, updated);
        }

        QuotaAssignment saved = assignmentRepository.save(updated);
        log.info("Updated assignment: id={}, type={}, tierId={}, enabled={}",
            saved.assignmentId(), saved.assignmentType(), saved.tierId(), saved.enabled());
        return saved;
    }

    /**
     * 刪除指派。
     *
     * @throws QuotaNotFoundException 指派不存在
     * @throws QuotaConflictException 刪除後系統將沒有可用的預設方案
     */
    public void delete(String assignmentId) {
        QuotaAssignment existing = get(assignmentId);
        if (existing.assignmentType() == AssignmentType.DEFAULT_TIER) {
            requireDefaultRemains(assignmentId, null);
        }
        assignmentRepository.deleteById(assignmentId);
        log.info("Deleted assignment: id={}", assignmentId);
    }

    private void validate(QuotaAssignment assignment) {
        List<String> errors = new ArrayList<>();
        if (assignment.assignmentType() == null) {
            errors.add("assignmentType is required");
        } else {
            switch (assignment.assignmentType()) {
                case DIRECT_USER -> {
                    if (isBlank(assignment.userId())) {
                        errors.add("userId is required for DIRECT_USER assignments");
                    }
                }
                case JWT_ROLE -> {
                    if (isBlank(assignment.jwtRole())) {
                        errors.add("jwtRole is required for JWT_ROLE assignments");
                    }
                }
                case EMAIL_DOMAIN -> errors.addAll(EmailDomainMatcher.validate(assignment.emailDomain()));
                case DEFAULT_TIER -> {
                    // 不需要比對欄位
                }
            }
        }
        if (isBlank(assignment.tierId())) {
            errors.add("tierId is required");
        }
        if (assignment.priority() < QuotaAssignment.MIN_PRIORITY
                || assignment.priority() > QuotaAssignment.MAX_PRIORITY) {
            errors.add("priority must be between 0 and 999");
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected invalid assignment: type={}, errors={}", assignment.assignmentType(), errors);
            throw new QuotaConfigurationException("Invalid assignment configuration", errors);
        }
    }

    private void requireDefaultRemains(String assignmentId, QuotaAssignment replacement) {
        if (assignmentResolver.resolveDefault().isPresent()
                && assignmentResolver.resolveDefaultReplacing(assignmentId, replacement).isEmpty()) {
            log.warn("Rejected change that removes the default tier: assignmentId={}", assignmentId);
            throw new QuotaConflictException(
                "Assignment " + assignmentId + " provides the only usable default tier");
        }
    }

    private void requireTier(String tierId) {
        if (!tierRepository.existsById(tierId)) {
            throw new QuotaNotFoundException("Tier", tierId);
        }
    }

    private void requireNoDuplicateDirectUser(QuotaAssignment assignment) {
        if (assignment.assignmentType() != AssignmentType.DIRECT_USER || !assignment.enabled()) {
            return;
        }
        boolean duplicate = assignmentRepository
            .findByAssignmentTypeAndUserIdAndEnabledTrue(AssignmentType.DIRECT_USER, assignment.userId())
            .stream()
            .anyMatch(other -> !Objects.equals(other.assignmentId(), assignment.assignmentId()));
        if (duplicate) {
            throw new QuotaConflictException(
                "User already has an enabled DIRECT_USER assignment: " + assignment.userId());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
