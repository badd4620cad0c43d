package io.github.samzhu.quota.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.exception.QuotaConfigurationException;
import io.github.samzhu.quota.exception.QuotaConflictException;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.repository.QuotaAssignmentRepository;
import io.github.samzhu.quota.repository.QuotaTierRepository;

/**
 * 配額方案管理服務。
 *
 * <p>所有寫入都先經過 {@link QuotaTierValidator}，不合法的方案不會進入資料庫，
 * 配額檢查因此不必處理 DOWNGRADE 缺少降級模型之類的情況。
 */
@Service
public class QuotaTierService {

    private static final Logger log = LoggerFactory.getLogger(QuotaTierService.class);

    private final QuotaTierRepository tierRepository;
    private final QuotaAssignmentRepository assignmentRepository;
    private final QuotaTierValidator validator;
    private final AssignmentResolver assignmentResolver;
    private final Clock clock;

    public QuotaTierService(
            QuotaTierRepository tierRepository,
            QuotaAssignmentRepository assignmentRepository,
            QuotaTierValidator validator,
            AssignmentResolver assignmentResolver,
            Clock clock) {
        this.tierRepository = tierRepository;
        this.assignmentRepository = assignmentRepository;
        this.validator = validator;
        this.assignmentResolver = assignmentResolver;
        this.clock = clock;
    }

    public List<QuotaTier> list(boolean enabledOnly) {
        return enabledOnly
            ? tierRepository.findByEnabledTrueOrderByTierIdAsc()
            : tierRepository.findAllByOrderByTierIdAsc();
    }

    public QuotaTier get(String tierId) {
        return tierRepository.findById(tierId)
            .orElseThrow(() -> new QuotaNotFoundException("Tier", tierId));
    }

    /**
     * 建立方案。
     *
     * @param tier 方案內容，建立時間由此服務填入
     * @param createdBy 操作者
     * @return 已儲存的方案
     * @throws QuotaConfigurationException 驗證失敗
     * @throws QuotaConflictException tierId 已存在
     */
    public QuotaTier create(QuotaTier tier, String createdBy) {
        requireValid(tier);
        if (tierRepository.existsById(tier.tierId())) {
            throw new QuotaConflictException("Tier already exists: " + tier.tierId());
        }

        Instant now = clock.instant();
        QuotaTier toSave = tier.toBuilder()
            .createdAt(now)
            .updatedAt(now)
            .createdBy(createdBy)
            .build();
        QuotaTier saved = tierRepository.save(toSave);
        log.info("Created tier: tierId={}, action={}, monthlyLimit={}, createdBy={}",
            saved.tierId(), saved.actionOnLimit(), saved.monthlyCostLimit(), createdBy);
        return saved;
    }

    /**
     * 更新方案，tierId 與建立資訊不可變更。
     *
     * @throws QuotaNotFoundException 方案不存在
     * @throws QuotaConfigurationException 驗證失敗
     * @throws QuotaConflictException 停用後系統將沒有可用的預設方案
     */
    public QuotaTier update(String tierId, QuotaTier changes) {
        QuotaTier existing = get(tierId);
        QuotaTier updated = changes.toBuilder()
            .tierId(existing.tierId())
            .createdAt(existing.createdAt())
            .createdBy(existing.createdBy())
            .updatedAt(clock.instant())
            .build();
        requireValid(updated);
        if (!updated.enabled()
                && assignmentResolver.resolveDefault().isPresent()
                && assignmentResolver.resolveDefaultWithTier(updated).isEmpty()) {
            log.warn("Rejected tier update that removes the default tier: tierId={}", tierId);
            throw new QuotaConflictException("Disabling tier " + tierId + " would leave no usable default tier");
        }

        QuotaTier saved = tierRepository.save(updated);
        log.info("Updated tier: tierId={}, action={}, enabled={}",
            saved.tierId(), saved.actionOnLimit(), saved.enabled());
        return saved;
    }

    /**
     * 刪除方案。
     *
     * @throws QuotaNotFoundException 方案不存在
     * @throws QuotaConflictException 仍有指派參照此方案
     */
    public void delete(String tierId) {
        get(tierId);
        long references = assignmentRepository.countByTierId(tierId);
        if (references > 0) {
            throw new QuotaConflictException(String.format(
                "Tier %s is referenced by %d assignment(s)", tierId, references));
        }
        tierRepository.deleteById(tierId);
        log.info("Deleted tier: tierId={}", tierId);
    }

    private void requireValid(QuotaTier tier) {
        ValidationResult result = validator.validate(tier);
        if (!result.valid()) {
            log.warn("Rejected invalid tier: tierId={}, errors={}", tier.tierId(), result.errors());
            throw new QuotaConfigurationException("Invalid tier configuration", result.errors());
        }
    }
}
