package io.github.samzhu.quota.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quota.model.QuotaEventType;

/**
 * 配額決策稽核事件文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只寫一次：事件建立後不會修改</li>
 *   <li>可排序 ID：使用 ObjectId 十六進位字串，時間先後即字典順序</li>
 *   <li>自動過期：保存期限由 TTL index 控制，見 {@link io.github.samzhu.quota.config.MongoConfig}</li>
 * </ul>
 *
 * <p>{@code metadata} 常見鍵值：{@code sessionId}、{@code budgetModelId}、
 * {@code originalModelId}、{@code threshold}、{@code period}、{@code overrideId}。
 */
@Document(collection = "quota_events")
@CompoundIndexes({
    @CompoundIndex(name = "user_time_idx", def = "{'userId': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "tier_time_idx", def = "{'tierId': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "type_time_idx", def = "{'eventType': 1, 'timestamp': -1}")
})
public record QuotaEvent(
    @Id String eventId,
    String userId,
    String tierId,
    QuotaEventType eventType,
    BigDecimal currentUsage,
    BigDecimal quotaLimit,
    double percentageUsed,
    Instant timestamp,
    Map<String, String> metadata
) {

    public QuotaEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * 建立新事件並產生可排序的事件 ID。
     */
    public static QuotaEvent create(
            String userId,
            String tierId,
            QuotaEventType eventType,
            BigDecimal currentUsage,
            BigDecimal quotaLimit,
            double percentageUsed,
            Instant timestamp,
            Map<String, String> metadata) {

        return new QuotaEvent(
            new ObjectId().toHexString(),
            userId, tierId, eventType,
            currentUsage, quotaLimit, percentageUsed,
            timestamp, metadata
        );
    }
}
