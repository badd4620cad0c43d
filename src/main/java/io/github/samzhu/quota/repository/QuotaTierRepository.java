package io.github.samzhu.quota.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quota.document.QuotaTier;

/**
 * 配額方案資料存取介面。
 *
 * <p>提供對 {@code quota_tiers} 集合的 CRUD 操作，寫入前的驗證由
 * {@link io.github.samzhu.quota.service.QuotaTierService} 負責。
 *
 * @see io.github.samzhu.quota.document.QuotaTier
 */
public interface QuotaTierRepository extends MongoRepository<QuotaTier, String> {

    /**
     * 查詢已啟用的方案，依 tierId 排序。
     *
     * @return 已啟用方案清單
     */
    List<QuotaTier> findByEnabledTrueOrderByTierIdAsc();

    List<QuotaTier> findAllByOrderByTierIdAsc();
}
