package io.github.samzhu.quota.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.quota.document.QuotaOverride;

/**
 * 個人例外資料存取介面。
 *
 * <p>提供對 {@code quota_overrides} 集合的查詢操作。
 *
 * @see io.github.samzhu.quota.document.QuotaOverride
 */
public interface QuotaOverrideRepository extends MongoRepository<QuotaOverride, String> {

    /**
     * 查詢指定時間點生效中的 override（含起訖時間點）。
     *
     * <p>正常情況最多一筆；超過一筆代表資料不一致，由
     * {@link io.github.samzhu.quota.service.OverrideResolver} 記錄警告並取最新。
     *
     * @param userId 用戶 ID
     * @param now 查詢時間點
     * @return 生效中的 override，依 validFrom 降序
     */
    @Query(value = "{ 'userId': ?0, 'enabled': true, 'validFrom': { $lte: ?1 }, 'validUntil': { $gte: ?1 } }",
           sort = "{ 'validFrom': -1 }")
    List<QuotaOverride> findActive(String userId, Instant now);

    List<QuotaOverride> findByUserIdAndEnabledTrue(String userId);

    List<QuotaOverride> findByUserIdOrderByValidFromDesc(String userId);

    List<QuotaOverride> findAllByOrderByValidFromDesc();
}
