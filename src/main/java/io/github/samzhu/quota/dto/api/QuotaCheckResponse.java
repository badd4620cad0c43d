package io.github.samzhu.quota.dto.api;

import java.math.BigDecimal;

import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.NotificationType;
import io.github.samzhu.quota.model.PeriodType;
import io.github.samzhu.quota.service.QuotaCheckResult;

/**
 * 配額檢查回應。
 *
 * <p>放行時 HTTP 200，阻擋時 HTTP 429 並帶 {@code errorCode=quota_exceeded}，
 * 儲存層故障且 fail-closed 時 HTTP 503 並帶 {@code errorCode=service_unavailable}，
 * 三者的 body 相同。聊天管線依 {@code notification} 在串流回應前顯示提示，
 * 降級時改用 {@code downgradeModelId}。
 */
public record QuotaCheckResponse(
    boolean allowed,
    String message,
    String errorCode,
    String tierId,
    String tierName,
    MatchedBy matchedBy,
    PeriodType governingPeriod,
    BigDecimal quotaLimit,
    BigDecimal currentUsage,
    double percentageUsed,
    BigDecimal remaining,
    String warningLevel,
    boolean downgraded,
    String downgradeModelId,
    String originalModelId,
    boolean degraded,
    Notification notification
) {

    public static final String QUOTA_EXCEEDED = "quota_exceeded";

    /**
     * 顯示給用戶的通知。
     */
    public record Notification(
        NotificationType type,
        String message,
        double percentageUsed,
        String warningLevel,
        String downgradeModelId
    ) {}

    private static String errorCode(QuotaCheckResult result) {
        if (result.allowed()) {
            return null;
        }
        return result.degraded() ? TransientStoreException.CODE : QUOTA_EXCEEDED;
    }

    public static QuotaCheckResponse from(QuotaCheckResult result) {
        NotificationType type = result.notificationType();
        Notification notification = new Notification(
            type,
            type == NotificationType.NONE ? null : result.message(),
            result.percentageUsed(),
            result.warningLevel(),
            result.downgradeModelId());

        return new QuotaCheckResponse(
            result.allowed(),
            result.message(),
            errorCode(result),
            result.tierId(),
            result.tier() == null ? null : result.tier().tierName(),
            result.matchedBy(),
            result.governingPeriod(),
            result.quotaLimit(),
            result.currentUsage(),
            result.percentageUsed(),
            result.remaining(),
            result.warningLevel(),
            result.downgraded(),
            result.downgradeModelId(),
            result.originalModelId(),
            result.degraded(),
            notification);
    }
}
