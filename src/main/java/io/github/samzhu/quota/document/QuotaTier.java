package io.github.samzhu.quota.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quota.model.ActionOnLimit;
import io.github.samzhu.quota.model.PeriodType;

/**
 * 配額方案文件。
 *
 * <p>一個方案定義月/日成本上限與達到上限時的處置方式。
 * 寫入前一律經過 {@link io.github.samzhu.quota.service.QuotaTierValidator} 驗證，
 * 因此配額檢查時可以假設以下條件成立：
 * <ul>
 *   <li>{@code monthlyCostLimit > 0}，{@code dailyCostLimit} 若存在也必須大於 0</li>
 *   <li>{@code DOWNGRADE} 方案一定有 {@code budgetModelId} 且 {@code 0 <= downgradeThreshold < 100}</li>
 *   <li>{@code DAILY} 週期的方案一定有 {@code dailyCostLimit}</li>
 * </ul>
 *
 * <p>ID 由管理員指定（{@code ^[a-z0-9_-]+$}），而非 MongoDB 自動產生，
 * 讓方案指派可以用可讀的 tierId 參照。
 */
@Document(collection = "quota_tiers")
public record QuotaTier(
    @Id String tierId,

    // ========== 基本資訊 ==========
    /** 顯示名稱 */
    String tierName,
    /** 說明 */
    String description,

    // ========== 上限設定 ==========
    /** 月度成本上限 (USD) */
    BigDecimal monthlyCostLimit,
    /** 日成本上限 (USD)，null 表示不限 */
    BigDecimal dailyCostLimit,
    /** 主要計算週期 */
    PeriodType periodType,
    /** 軟上限百分比 (0-100)，達到時發出警告 */
    double softLimitPercentage,

    // ========== 處置方式 ==========
    /** 達到上限時的處置 */
    ActionOnLimit actionOnLimit,
    /** 降級使用的低成本模型，僅 DOWNGRADE 使用 */
    String budgetModelId,
    /** 降級門檻百分比 (0 <= x < 100)，僅 DOWNGRADE 使用 */
    Double downgradeThreshold,

    // ========== 狀態與稽核 ==========
    boolean enabled,
    Instant createdAt,
    Instant updatedAt,
    String createdBy
) {

    /** 軟上限預設值 */
    public static final double DEFAULT_SOFT_LIMIT_PERCENTAGE = 80.0;

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以目前內容建立 Builder，用於更新。
     */
    public Builder toBuilder() {
        return new Builder()
            .tierId(tierId)
            .tierName(tierName)
            .description(description)
            .monthlyCostLimit(monthlyCostLimit)
            .dailyCostLimit(dailyCostLimit)
            .periodType(periodType)
            .softLimitPercentage(softLimitPercentage)
            .actionOnLimit(actionOnLimit)
            .budgetModelId(budgetModelId)
            .downgradeThreshold(downgradeThreshold)
            .enabled(enabled)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .createdBy(createdBy);
    }

    /**
     * QuotaTier Builder。
     *
     * <p>{@link #build()} 只負責組裝，不做驗證；驗證由
     * {@link io.github.samzhu.quota.service.QuotaTierValidator} 在寫入路徑執行。
     */
    public static class Builder {
        private String tierId;
        private String tierName;
        private String description;
        private BigDecimal monthlyCostLimit;
        private BigDecimal dailyCostLimit;
        private PeriodType periodType = PeriodType.MONTHLY;
        private double softLimitPercentage = DEFAULT_SOFT_LIMIT_PERCENTAGE;
        private ActionOnLimit actionOnLimit = ActionOnLimit.BLOCK;
        private String budgetModelId;
        private Double downgradeThreshold;
        private boolean enabled = true;
        private Instant createdAt;
        private Instant updatedAt;
        private String createdBy;

        public Builder tierId(String tierId) { this.tierId = tierId; return this; }
        public Builder tierName(String tierName) { this.tierName = tierName; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder monthlyCostLimit(BigDecimal monthlyCostLimit) { this.monthlyCostLimit = monthlyCostLimit; return this; }
        public Builder dailyCostLimit(BigDecimal dailyCostLimit) { this.dailyCostLimit = dailyCostLimit; return this; }
        public Builder periodType(PeriodType periodType) { this.periodType = periodType; return this; }
        public Builder softLimitPercentage(double softLimitPercentage) { this.softLimitPercentage = softLimitPercentage; return this; }
        public Builder actionOnLimit(ActionOnLimit actionOnLimit) { this.actionOnLimit = actionOnLimit; return this; }
        public Builder budgetModelId(String budgetModelId) { this.budgetModelId = budgetModelId; return this; }
        public Builder downgradeThreshold(Double downgradeThreshold) { this.downgradeThreshold = downgradeThreshold; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder createdBy(String createdBy) { this.createdBy = createdBy; return this; }

        public QuotaTier build() {
            return new QuotaTier(
                tierId, tierName, description,
                monthlyCostLimit, dailyCostLimit, periodType, softLimitPercentage,
                actionOnLimit, budgetModelId, downgradeThreshold,
                enabled, createdAt, updatedAt, createdBy
            );
        }
    }
}
