package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.model.ActionOnLimit;
import io.github.samzhu.quota.model.PeriodType;

/**
 * 配額方案驗證器。
 *
 * <p>檢查方案寫入前必須成立的條件，收集全部錯誤後一次回傳：
 * <ul>
 *   <li>tierId 符合 {@code ^[a-z0-9_-]+$}，tierName 不可空白</li>
 *   <li>{@code monthlyCostLimit > 0}，{@code dailyCostLimit} 若有則 {@code > 0}</li>
 *   <li>{@code DAILY} 週期必須設定 {@code dailyCostLimit}</li>
 *   <li>{@code softLimitPercentage} 介於 0 到 100</li>
 *   <li>{@code DOWNGRADE} 必須有 {@code budgetModelId} 且 {@code 0 <= downgradeThreshold < 100}</li>
 * </ul>
 */
@Component
public class QuotaTierValidator {

    static final Pattern TIER_ID_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

    public ValidationResult validate(QuotaTier tier) {
        List<String> errors = new ArrayList<>();

        if (tier.tierId() == null || !TIER_ID_PATTERN.matcher(tier.tierId()).matches()) {
            errors.add("tierId must match ^[a-z0-9_-]+$");
        }
        if (tier.tierName() == null || tier.tierName().isBlank()) {
            errors.add("tierName is required");
        }

        if (!isPositive(tier.monthlyCostLimit())) {
            errors.add("monthlyCostLimit must be greater than 0");
        }
        if (tier.dailyCostLimit() != null && !isPositive(tier.dailyCostLimit())) {
            errors.add("dailyCostLimit must be greater than 0 when set");
        }
        if (tier.periodType() == null) {
            errors.add("periodType is required");
        } else if (tier.periodType() == PeriodType.DAILY && tier.dailyCostLimit() == null) {
            errors.add("dailyCostLimit is required for DAILY period tiers");
        }

        if (tier.softLimitPercentage() < 0 || tier.softLimitPercentage() > 100) {
            errors.add("softLimitPercentage must be between 0 and 100");
        }

        if (tier.actionOnLimit() == null) {
            errors.add("actionOnLimit is required");
        } else if (tier.actionOnLimit() == ActionOnLimit.DOWNGRADE) {
            if (tier.budgetModelId() == null || tier.budgetModelId().isBlank()) {
                errors.add("budgetModelId is required when actionOnLimit is DOWNGRADE");
            }
            Double threshold = tier.downgradeThreshold();
            if (threshold == null) {
                errors.add("downgradeThreshold is required when actionOnLimit is DOWNGRADE");
            } else if (threshold < 0 || threshold >= 100) {
                errors.add("downgradeThreshold must be >= 0 and < 100");
            }
        }

        return ValidationResult.of(errors);
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
