package io.github.samzhu.quota.dto.api;

import java.math.BigDecimal;

import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.model.ActionOnLimit;
import io.github.samzhu.quota.model.PeriodType;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * 方案建立/更新請求。
 *
 * <p>用於 POST /api/v1/admin/quota/tiers 與 PUT /api/v1/admin/quota/tiers/{tierId}。
 * 欄位之間的條件（DOWNGRADE 需要降級模型等）由
 * {@link io.github.samzhu.quota.service.QuotaTierValidator} 檢查。
 */
public record TierRequest(
    @NotBlank(message = "tierId is required")
    @Pattern(regexp = "^[a-z0-9_-]+$", message = "tierId must match ^[a-z0-9_-]+$")
    String tierId,

    @NotBlank(message = "tierName is required")
    String tierName,

    String description,

    @NotNull(message = "monthlyCostLimit is required")
    @Positive(message = "monthlyCostLimit must be positive")
    BigDecimal monthlyCostLimit,

    @Positive(message = "dailyCostLimit must be positive")
    BigDecimal dailyCostLimit,

    PeriodType periodType,

    @DecimalMin(value = "0", message = "softLimitPercentage must be between 0 and 100")
    @DecimalMax(value = "100", message = "softLimitPercentage must be between 0 and 100")
    Double softLimitPercentage,

    @NotNull(message = "actionOnLimit is required")
    ActionOnLimit actionOnLimit,

    String budgetModelId,
    Double downgradeThreshold,
    Boolean enabled
) {

    public QuotaTier toTier() {
        QuotaTier.Builder builder = QuotaTier.builder()
            .tierId(tierId)
            .tierName(tierName)
            .description(description)
            .monthlyCostLimit(monthlyCostLimit)
            .dailyCostLimit(dailyCostLimit)
            .actionOnLimit(actionOnLimit)
            .budgetModelId(budgetModelId)
            .downgradeThreshold(downgradeThreshold);
        if (periodType != null) {
            builder.periodType(periodType);
        }
        if (softLimitPercentage != null) {
            builder.softLimitPercentage(softLimitPercentage);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        return builder.build();
    }
}
