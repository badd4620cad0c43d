package io.github.samzhu.quota.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.exception.QuotaConfigurationException;
import io.github.samzhu.quota.exception.QuotaConflictException;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.model.OverrideType;
import io.github.samzhu.quota.repository.QuotaOverrideRepository;

/**
 * 個人例外管理服務。
 *
 * <p>寫入規則：
 * <ul>
 *   <li>{@code CUSTOM_LIMIT} 至少要有一個大於 0 的上限</li>
 *   <li>{@code validFrom <= validUntil}</li>
 *   <li>同一用戶已啟用的 override 有效期間不可重疊，違反時拋出 {@link QuotaConflictException}</li>
 * </ul>
 */
@Service
public class QuotaOverrideService {

    private static final Logger log = LoggerFactory.getLogger(QuotaOverrideService.class);

    private final QuotaOverrideRepository overrideRepository;
    private final Clock clock;

    public QuotaOverrideService(QuotaOverrideRepository overrideRepository, Clock clock) {
        this.overrideRepository = overrideRepository;
        this.clock = clock;
    }

    /**
     * 查詢 override。
     *
     * @param userId 用戶，null 表示全部
     * @param activeOnly 只回傳目前生效中的 override
     * @return 依 validFrom 降序
     */
    public List<QuotaOverride> list(String userId, boolean activeOnly) {
        List<QuotaOverride> source = userId == null
            ? overrideRepository.findAllByOrderByValidFromDesc()
            : overrideRepository.findByUserIdOrderByValidFromDesc(userId);
        if (!activeOnly) {
            return source;
        }
        return source.stream()
            .filter(o -> o.isActiveAt(clock.instant()))
            .toList();
    }

    public QuotaOverride get(String overrideId) {
        return overrideRepository.findById(overrideId)
            .orElseThrow(() -> new QuotaNotFoundException("Override", overrideId));
    }

    /**
     * 建立 override。
     *
     * @throws QuotaConfigurationException 欄位不合法
     * @throws QuotaConflictException 與同一用戶既有的 override 期間重疊
     */
    public QuotaOverride create(QuotaOverride override, String createdBy) {
        QuotaOverride toSave = QuotaOverride.create(
            override.userId(), override.overrideType(),
            override.monthlyCostLimit(), override.dailyCostLimit(),
            override.validFrom(), override.validUntil(),
            override.reason(), override.enabled(), createdBy, clock.instant());
        validate(toSave);
        requireNoOverlap(toSave);

        QuotaOverride saved = overrideRepository.save(toSave);
        log.info("Created override: id={}, userId={}, type={}, validFrom={}, validUntil={}",
            saved.overrideId(), saved.userId(), saved.overrideType(), saved.validFrom(), saved.validUntil());
        return saved;
    }

    /**
     * 更新 override，userId 不可變更。
     */
    public QuotaOverride update(String overrideId, QuotaOverride changes) {
        QuotaOverride existing = get(overrideId);
        QuotaOverride updated = existing.withChanges(changes);
        validate(updated);
        requireNoOverlap(updated);

        QuotaOverride saved = overrideRepository.save(updated);
        log.info("Updated override: id={}, userId={}, type={}, enabled={}",
            saved.overrideId(), saved.userId(), saved.overrideType(), saved.enabled());
        return saved;
    }

    public void delete(String overrideId) {
        get(overrideId);
        overrideRepository.deleteById(overrideId);
        log.info("Deleted override: id={}", overrideId);
    }

    private void validate(QuotaOverride override) {
        List<String> errors = new ArrayList<>();
        if (override.userId() == null || override.userId().isBlank()) {
            errors.add("userId is required");
        }
        if (override.overrideType() == null) {
            errors.add("overrideType is required");
        } else if (override.overrideType() == OverrideType.CUSTOM_LIMIT) {
            if (override.monthlyCostLimit() == null && override.dailyCostLimit() == null) {
                errors.add("CUSTOM_LIMIT requires monthlyCostLimit or dailyCostLimit");
            }
            if (override.monthlyCostLimit() != null && override.monthlyCostLimit().signum() <= 0) {
                errors.add("monthlyCostLimit must be greater than 0");
            }
            if (override.dailyCostLimit() != null && override.dailyCostLimit().signum() <= 0) {
                errors.add("dailyCostLimit must be greater than 0");
            }
        }
        if (override.validFrom() == null || override.validUntil() == null) {
            errors.add("validFrom and validUntil are required");
        } else if (override.validFrom().isAfter(override.validUntil())) {
            errors.add("validFrom must not be after validUntil");
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected invalid override: userId={}, errors={}", override.userId(), errors);
            throw new QuotaConfigurationException("Invalid override configuration", errors);
        }
    }

    private void requireNoOverlap(QuotaOverride override) {
        if (!override.enabled()) {
            return;
        }
        for (QuotaOverride other : overrideRepository.findByUserIdAndEnabledTrue(override.userId())) {
            if (Objects.equals(other.overrideId(), override.overrideId())) {
                continue;
            }
            if (override.overlaps(other)) {
                throw new QuotaConflictException(String.format(
                    "Override overlaps existing override %s for user %s (%s - %s)",
                    other.overrideId(), override.userId(), other.validFrom(), other.validUntil()));
            }
        }
    }
}
