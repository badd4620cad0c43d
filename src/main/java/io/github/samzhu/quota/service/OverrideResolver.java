package io.github.samzhu.quota.service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.repository.QuotaOverrideRepository;

/**
 * 生效中 override 解析器。
 *
 * <p>寫入時已拒絕有效期間重疊的 override，正常情況最多一筆生效。
 * 若仍查到多筆（例如直接修改資料庫），取 validFrom 最新者並記錄警告，不拋出例外。
 */
@Service
public class OverrideResolver {

    private static final Logger log = LoggerFactory.getLogger(OverrideResolver.class);

    private final QuotaOverrideRepository overrideRepository;

    public OverrideResolver(QuotaOverrideRepository overrideRepository) {
        this.overrideRepository = overrideRepository;
    }

    /**
     * 查詢指定時間點生效中的 override。
     *
     * @param userId 用戶 ID
     * @param now 時間點，起訖時間皆包含
     * @return 生效中的 override
     */
    public Optional<QuotaOverride> resolve(String userId, Instant now) {
        List<QuotaOverride> active = overrideRepository.findActive(userId, now).stream()
            .filter(o -> o.isActiveAt(now))
            .toList();

        if (active.isEmpty()) {
            return Optional.empty();
        }
        if (active.size() > 1) {
            log.warn("Multiple active overrides found, using latest validFrom: userId={}, count={}, overrideIds={}",
                userId, active.size(), active.stream().map(QuotaOverride::overrideId).toList());
        }
        return active.stream().max(Comparator.comparing(QuotaOverride::validFrom));
    }
}
