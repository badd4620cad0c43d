package io.github.samzhu.quota.service;

import java.math.BigDecimal;

import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.NotificationType;
import io.github.samzhu.quota.model.PeriodType;
import io.github.samzhu.quota.model.QuotaEventType;

/**
 * 單次配額檢查的結果，不會被儲存。
 *
 * <p>同時評估月與日上限時，{@code quotaLimit}、{@code currentUsage}、{@code percentageUsed}、
 * {@code remaining} 皆來自較接近上限的那個週期（{@code governingPeriod}）。
 *
 * @param allowed 是否放行
 * @param message 給聊天管線顯示的訊息
 * @param tier 解析到的方案，UNLIMITED override 或停用檢查時為 null
 * @param override 生效中的 override
 * @param matchedBy 決定有效配額的來源
 * @param monthlyLimit 月上限
 * @param dailyLimit 日上限
 * @param monthlyUsage 當月用量
 * @param dailyUsage 當日用量
 * @param governingPeriod 主導決策的週期
 * @param periodKey 主導決策的週期鍵
 * @param quotaLimit 主導決策的上限
 * @param currentUsage 主導決策的用量
 * @param percentageUsed 使用百分比
 * @param remaining 剩餘金額，阻擋時為 0
 * @param warningLevel 達到軟上限時的警告等級，例如 {@code "80%"}
 * @param downgraded 是否改用低成本模型
 * @param downgradeModelId 改用的模型
 * @param originalModelId 原本要使用的模型
 * @param degraded 儲存層故障時由放行/阻擋策略產生的結果
 * @param eventType 此決策要記錄的稽核事件，無則為 null
 */
public record QuotaCheckResult(
    boolean allowed,
    String message,
    QuotaTier tier,
    QuotaOverride override,
    MatchedBy matchedBy,
    BigDecimal monthlyLimit,
    BigDecimal dailyLimit,
    BigDecimal monthlyUsage,
    BigDecimal dailyUsage,
    PeriodType governingPeriod,
    String periodKey,
    BigDecimal quotaLimit,
    BigDecimal currentUsage,
    double percentageUsed,
    BigDecimal remaining,
    String warningLevel,
    boolean downgraded,
    String downgradeModelId,
    String originalModelId,
    boolean degraded,
    QuotaEventType eventType
) {

    /**
     * 聊天管線要顯示的通知類型。
     */
    public NotificationType notificationType() {
        if (!allowed) {
            return degraded ? NotificationType.UNAVAILABLE : NotificationType.EXCEEDED;
        }
        if (downgraded) {
            return NotificationType.DOWNGRADE;
        }
        if (warningLevel != null) {
            return NotificationType.WARNING;
        }
        return NotificationType.NONE;
    }

    public String tierId() {
        return tier == null ? null : tier.tierId();
    }

    /**
     * 停用配額檢查時的結果。
     */
    public static QuotaCheckResult enforcementDisabled() {
        return builder()
            .allowed(true)
            .message("Quota enforcement disabled")
            .build();
    }

    /**
     * 儲存層故障時的結果。
     *
     * @param allowed 依 fail-open 設定決定
     * @param message 訊息
     */
    public static QuotaCheckResult degraded(boolean allowed, String message) {
        return builder()
            .allowed(allowed)
            .message(message)
            .degraded(true)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * QuotaCheckResult Builder。
     */
    public static class Builder {
        private boolean allowed;
        private String message;
        private QuotaTier tier;
        private QuotaOverride override;
        private MatchedBy matchedBy;
        private BigDecimal monthlyLimit;
        private BigDecimal dailyLimit;
        private BigDecimal monthlyUsage;
        private BigDecimal dailyUsage;
        private PeriodType governingPeriod;
        private String periodKey;
        private BigDecimal quotaLimit;
        private BigDecimal currentUsage;
        private double percentageUsed;
        private BigDecimal remaining;
        private String warningLevel;
        private boolean downgraded;
        private String downgradeModelId;
        private String originalModelId;
        private boolean degraded;
        private QuotaEventType eventType;

        public Builder allowed(boolean allowed) { this.allowed = allowed; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder tier(QuotaTier tier) { this.tier = tier; return this; }
        public Builder override(QuotaOverride override) { this.override = override; return this; }
        public Builder matchedBy(MatchedBy matchedBy) { this.matchedBy = matchedBy; return this; }
        public Builder monthlyLimit(BigDecimal monthlyLimit) { this.monthlyLimit = monthlyLimit; return this; }
        public Builder dailyLimit(BigDecimal dailyLimit) { this.dailyLimit = dailyLimit; return this; }
        public Builder monthlyUsage(BigDecimal monthlyUsage) { this.monthlyUsage = monthlyUsage; return this; }
        public Builder dailyUsage(BigDecimal dailyUsage) { this.dailyUsage = dailyUsage; return this; }
        public Builder governingPeriod(PeriodType governingPeriod) { this.governingPeriod = governingPeriod; return this; }
        public Builder periodKey(String periodKey) { this.periodKey = periodKey; return this; }
        public Builder quotaLimit(BigDecimal quotaLimit) { this.quotaLimit = quotaLimit; return this; }
        public Builder currentUsage(BigDecimal currentUsage) { this.currentUsage = currentUsage; return this; }
        public Builder percentageUsed(double percentageUsed) { this.percentageUsed = percentageUsed; return this; }
        public Builder remaining(BigDecimal remaining) { this.remaining = remaining; return this; }
        public Builder warningLevel(String warningLevel) { this.warningLevel = warningLevel; return this; }
        public Builder downgraded(boolean downgraded) { this.downgraded = downgraded; return this; }
        public Builder downgradeModelId(String downgradeModelId) { this.downgradeModelId = downgradeModelId; return this; }
        public Builder originalModelId(String originalModelId) { this.originalModelId = originalModelId; return this; }
        public Builder degraded(boolean degraded) { this.degraded = degraded; return this; }
        public Builder eventType(QuotaEventType eventType) { this.eventType = eventType; return this; }

        public QuotaCheckResult build() {
            return new QuotaCheckResult(
                allowed, message, tier, override, matchedBy,
                monthlyLimit, dailyLimit, monthlyUsage, dailyUsage,
                governingPeriod, periodKey, quotaLimit, currentUsage, percentageUsed, remaining,
                warningLevel, downgraded, downgradeModelId, originalModelId,
                degraded, eventType
            );
        }
    }
}
