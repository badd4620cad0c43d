package io.github.samzhu.quota.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quota.model.PeriodType;

/**
 * 用戶週期用量文件。
 *
 * <p>每個用戶在每個週期（月或日）一筆，由
 * {@link io.github.samzhu.quota.service.MongoUsageLedger} 以 {@code $inc} upsert 延遲建立。
 * 新週期就是新的文件 ID，舊週期的文件不會被歸零。
 *
 * <p>文件 ID 格式：{@code {periodKey}_{userId}}，例如 {@code 2026-01_user-123}、
 * {@code 2026-01-15_user-123}
 *
 * <p>{@code currentUsage} 以 double 儲存，讓 MongoDB {@code $inc} 可以直接累加；
 * 讀取端一律轉成 {@link java.math.BigDecimal} 計算。
 */
@Document(collection = "usage_records")
public record UsageRecord(
    @Id String id,
    @Indexed String userId,
    PeriodType periodType,
    String periodKey,
    /** 當期累計成本 (USD)，不為負 */
    double currentUsage,
    Instant createdAt,
    Instant lastUpdatedAt,
    /** 最後一次對帳覆寫時間，未對帳過為 null */
    Instant lastReconciledAt
) {

    /**
     * 產生文件 ID。
     *
     * @param periodKey 週期鍵，如 {@code 2026-01} 或 {@code 2026-01-15}
     * @param userId 用戶 ID
     * @return 文件 ID
     */
    public static String createId(String periodKey, String userId) {
        return periodKey + "_" + userId;
    }
}
