package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.UsageRecord;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 以 MongoDB 實作的用量計數器。
 *
 * <p>累加使用單一 {@code findAndModify}：
 * <ul>
 *   <li>{@code $inc currentUsage} - 伺服器端原子累加，並行請求不會互相覆蓋</li>
 *   <li>{@code $setOnInsert} - 首次累加時建立文件（upsert）</li>
 *   <li>{@code returnNew} - 回傳累加後的值</li>
 * </ul>
 *
 * <p>兩個實例同時對不存在的文件 upsert 時，其中一個會收到 duplicate key，
 * 此時文件已存在，重試一次即成為一般的 {@code $inc}。
 *
 * @see <a href="https://www.mongodb.com/docs/manual/reference/method/db.collection.findAndModify/#upsert-and-unique-index">findAndModify upsert and unique index</a>
 */
@Service
public class MongoUsageLedger implements UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(MongoUsageLedger.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoUsageLedger(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public BigDecimal read(String userId, String periodKey) {
        try {
            UsageRecord record = mongoTemplate.findById(UsageRecord.createId(periodKey, userId), UsageRecord.class);
            return record == null ? BigDecimal.ZERO : BigDecimal.valueOf(record.currentUsage());
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to read usage: userId=" + userId + ", period=" + periodKey, e);
        }
    }

    @Override
    public BigDecimal increment(String userId, String periodKey, BigDecimal delta) {
        if (delta == null || delta.signum() < 0) {
            throw new IllegalArgumentException("delta must be non-negative: " + delta);
        }
        try {
            return BigDecimal.valueOf(incrementOnce(userId, periodKey, delta));
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent upsert detected, retrying increment: userId={}, period={}", userId, periodKey);
            try {
                return BigDecimal.valueOf(incrementOnce(userId, periodKey, delta));
            } catch (DataAccessException retryError) {
                throw new TransientStoreException(
                    "Failed to increment usage after retry: userId=" + userId + ", period=" + periodKey, retryError);
            }
        } catch (DataAccessException e) {
            throw new TransientStoreException(
                "Failed to increment usage: userId=" + userId + ", period=" + periodKey, e);
        }
    }

    @Override
    public void reconcileSet(String userId, String periodKey, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative: " + amount);
        }
        Instant now = clock.instant();
        Update update = new Update()
            .set("currentUsage", amount.doubleValue())
            .set("lastUpdatedAt", now)
            .set("lastReconciledAt", now)
            .setOnInsert("userId", userId)
            .setOnInsert("periodKey", periodKey)
            .setOnInsert("periodType", PeriodUtils.typeOf(periodKey))
            .setOnInsert("createdAt", now);
        try {
            mongoTemplate.upsert(byId(userId, periodKey), update, UsageRecord.class);
            log.debug("Usage reconciled: userId={}, period={}, amount={}", userId, periodKey, amount);
        } catch (DataAccessException e) {
            throw new TransientStoreException(
                "Failed to reconcile usage: userId=" + userId + ", period=" + periodKey, e);
        }
    }

    private double incrementOnce(String userId, String periodKey, BigDecimal delta) {
        Instant now = clock.instant();
        Update update = new Update()
            .inc("currentUsage", delta.doubleValue())
            .set("lastUpdatedAt", now)
            .setOnInsert("userId", userId)
            .setOnInsert("periodKey", periodKey)
            .setOnInsert("periodType", PeriodUtils.typeOf(periodKey))
            .setOnInsert("createdAt", now);

        UsageRecord updated = mongoTemplate.findAndModify(
            byId(userId, periodKey),
            update,
            FindAndModifyOptions.options().upsert(true).returnNew(true),
            UsageRecord.class);

        double total = updated == null ? delta.doubleValue() : updated.currentUsage();
        log.debug("Usage incremented: userId={}, period={}, delta={}, total={}", userId, periodKey, delta, total);
        return total;
    }

    private static Query byId(String userId, String periodKey) {
        return Query.query(Criteria.where("_id").is(UsageRecord.createId(periodKey, userId)));
    }
}
