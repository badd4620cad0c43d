package io.github.samzhu.quota.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quota.document.UsageRecord;

/**
 * 週期用量資料存取介面。
 *
 * <p>此介面只用於查詢，累加與對帳覆寫透過
 * {@link io.github.samzhu.quota.service.MongoUsageLedger} 使用 MongoTemplate 原子操作完成。
 *
 * @see io.github.samzhu.quota.document.UsageRecord
 */
public interface UsageRecordRepository extends MongoRepository<UsageRecord, String> {

    /**
     * 查詢某週期所有有用量記錄的用戶，供對帳比對。
     *
     * @param periodKey 週期鍵
     * @return 該週期的用量記錄
     */
    List<UsageRecord> findByPeriodKey(String periodKey);
}
