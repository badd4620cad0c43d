package io.github.samzhu.quota.dto.api;

import java.math.BigDecimal;
import java.util.List;

import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.service.QuotaInspection;

/**
 * 配額診斷回應。
 *
 * <p>用於 GET /api/v1/admin/quota/inspector/users/{userId} 端點。
 */
public record InspectionResponse(
    String userId,
    String emailDomain,
    List<String> roles,
    QuotaTier tier,
    MatchedBy matchedBy,
    String assignmentId,
    QuotaOverride activeOverride,
    UsageInfo usage,
    QuotaCheckResponse decision
) {

    /**
     * 當期用量。
     */
    public record UsageInfo(
        String monthlyKey,
        BigDecimal monthlyUsage,
        BigDecimal monthlyLimit,
        String dailyKey,
        BigDecimal dailyUsage,
        BigDecimal dailyLimit,
        double percentageUsed,
        BigDecimal remaining
    ) {}

    public static InspectionResponse from(QuotaInspection inspection) {
        QuotaTier tier = inspection.decision().tier() != null
            ? inspection.decision().tier()
            : inspection.assignment() == null ? null : inspection.assignment().tier();

        UsageInfo usage = new UsageInfo(
            inspection.monthlyKey(),
            inspection.monthlyUsage(),
            inspection.decision().monthlyLimit(),
            inspection.dailyKey(),
            inspection.dailyUsage(),
            inspection.decision().dailyLimit(),
            inspection.decision().percentageUsed(),
            inspection.decision().remaining());

        return new InspectionResponse(
            inspection.user().userId(),
            inspection.user().emailDomain(),
            inspection.user().roles(),
            tier,
            inspection.decision().matchedBy(),
            inspection.assignment() == null || inspection.assignment().assignment() == null
                ? null : inspection.assignment().assignment().assignmentId(),
            inspection.decision().override(),
            usage,
            QuotaCheckResponse.from(inspection.decision()));
    }
}
