package io.github.samzhu.quota.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 單次請求的最終成本文件。
 *
 * <p>兩個用途：
 * <ul>
 *   <li>冪等保護 - 以 {@code requestId} 作為文件 ID，重複投遞的成本事件插入失敗即略過</li>
 *   <li>權威成本來源 - 對帳時依週期鍵聚合，覆寫用量計數器的漂移</li>
 * </ul>
 *
 * <p>只增不改，寫入時一併算好月/日週期鍵，聚合時不必再處理時區。
 */
@Document(collection = "request_costs")
@CompoundIndexes({
    @CompoundIndex(name = "monthly_user_idx", def = "{'monthlyPeriodKey': 1, 'userId': 1}"),
    @CompoundIndex(name = "daily_user_idx", def = "{'dailyPeriodKey': 1, 'userId': 1}")
})
public record RequestCostRecord(
    @Id String requestId,
    String userId,
    String sessionId,
    String modelId,
    /** 最終成本 (USD) */
    double costUsd,
    Instant completedAt,
    /** 例如 {@code 2026-01} */
    String monthlyPeriodKey,
    /** 例如 {@code 2026-01-15} */
    String dailyPeriodKey,
    Instant recordedAt
) {
}
