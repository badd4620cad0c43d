package io.github.samzhu.quota.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quota.model.OverrideType;

/**
 * 個人限時例外文件。
 *
 * <p>有效期間內取代方案推導出的上限：
 * <ul>
 *   <li>{@code UNLIMITED} - 不限額度</li>
 *   <li>{@code CUSTOM_LIMIT} - 以 {@code monthlyCostLimit} / {@code dailyCostLimit} 取代方案上限</li>
 * </ul>
 *
 * <p>同一用戶已啟用的 override 有效期間不可重疊，寫入時由
 * {@link io.github.samzhu.quota.service.QuotaOverrideService} 拒絕。
 */
@Document(collection = "quota_overrides")
@CompoundIndex(name = "user_validity_idx", def = "{'userId': 1, 'validFrom': -1, 'validUntil': -1}")
public record QuotaOverride(
    @Id String overrideId,
    String userId,
    OverrideType overrideType,
    /** 月度上限 (USD)，僅 CUSTOM_LIMIT 使用 */
    BigDecimal monthlyCostLimit,
    /** 日上限 (USD)，僅 CUSTOM_LIMIT 使用 */
    BigDecimal dailyCostLimit,
    Instant validFrom,
    Instant validUntil,
    String reason,
    boolean enabled,
    Instant createdAt,
    String createdBy
) {

    /**
     * 建立新 override，ID 由 MongoDB 自動產生。
     */
    public static QuotaOverride create(
            String userId,
            OverrideType overrideType,
            BigDecimal monthlyCostLimit,
            BigDecimal dailyCostLimit,
            Instant validFrom,
            Instant validUntil,
            String reason,
            boolean enabled,
            String createdBy,
            Instant now) {

        return new QuotaOverride(
            null, // ID 自動產生
            userId, overrideType, monthlyCostLimit, dailyCostLimit,
            validFrom, validUntil, reason, enabled, now, createdBy
        );
    }

    /**
     * 以新內容取代，保留 ID、用戶與建立資訊。
     */
    public QuotaOverride withChanges(QuotaOverride changes) {
        return new QuotaOverride(
            overrideId, userId,
            changes.overrideType(), changes.monthlyCostLimit(), changes.dailyCostLimit(),
            changes.validFrom(), changes.validUntil(), changes.reason(), changes.enabled(),
            createdAt, createdBy
        );
    }

    /**
     * 判斷在指定時間是否生效（含起訖時間點）。
     */
    public boolean isActiveAt(Instant now) {
        return enabled
            && !now.isBefore(validFrom)
            && !now.isAfter(validUntil);
    }

    /**
     * 判斷兩個 override 的有效期間是否重疊（閉區間）。
     */
    public boolean overlaps(QuotaOverride other) {
        return !validFrom.isAfter(other.validUntil()) && !other.validFrom().isAfter(validUntil);
    }

    public boolean isUnlimited() {
        return overrideType == OverrideType.UNLIMITED;
    }
}
