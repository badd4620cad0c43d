package io.github.samzhu.quota.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.model.OverrideType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 個人例外建立/更新請求。
 *
 * <p>用於 POST /api/v1/admin/quota/overrides 與 PUT /api/v1/admin/quota/overrides/{overrideId}；
 * 更新時忽略 {@code userId}。
 */
public record OverrideRequest(
    @NotBlank(message = "userId is required")
    String userId,

    @NotNull(message = "overrideType is required")
    OverrideType overrideType,

    @Positive(message = "monthlyCostLimit must be positive")
    BigDecimal monthlyCostLimit,

    @Positive(message = "dailyCostLimit must be positive")
    BigDecimal dailyCostLimit,

    @NotNull(message = "validFrom is required")
    Instant validFrom,

    @NotNull(message = "validUntil is required")
    Instant validUntil,

    @NotBlank(message = "reason is required")
    String reason,

    Boolean enabled
) {

    public QuotaOverride toOverride() {
        return new QuotaOverride(
            null, userId, overrideType,
            monthlyCostLimit, dailyCostLimit,
            validFrom, validUntil, reason,
            enabled == null || enabled,
            null, null);
    }
}
