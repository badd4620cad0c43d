package io.github.samzhu.quota.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quota.document.RequestCostRecord;

/**
 * 請求成本資料存取介面。
 *
 * <p>寫入使用 {@code insert}，重複的 requestId 會觸發
 * {@link org.springframework.dao.DuplicateKeyException}，由
 * {@link io.github.samzhu.quota.service.UsageRecordingService} 視為已計入。
 *
 * @see io.github.samzhu.quota.document.RequestCostRecord
 */
public interface RequestCostRecordRepository extends MongoRepository<RequestCostRecord, String> {
}
