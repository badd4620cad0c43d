package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.document.QuotaEvent;
import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.model.ActionOnLimit;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.PeriodType;
import io.github.samzhu.quota.model.QuotaEventType;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 配額檢查服務，聊天請求進入模型前的決策點。
 *
 * <p>每次呼叫都重新評估，不保存「目前已降級」之類的狀態：
 * <ol>
 *   <li>決定有效政策：UNLIMITED override 直接放行；CUSTOM_LIMIT override 以其上限取代方案上限，
 *       沿用方案的處置方式；沒有 override 則使用 {@link AssignmentResolver} 解析的方案</li>
 *   <li>讀取有上限的週期（月、日）用量，各自計算百分比，較接近上限者主導決策</li>
 *   <li>依 {@link ActionOnLimit} 決定放行、警告、降級或阻擋</li>
 *   <li>以非阻塞方式記錄稽核事件</li>
 * </ol>
 *
 * <p>決策規則：
 * <ul>
 *   <li>{@code BLOCK} - 達 100% 阻擋；達軟上限放行並警告</li>
 *   <li>{@code WARN} - 只警告不阻擋；但 CUSTOM_LIMIT override 的上限一律是硬上限</li>
 *   <li>{@code DOWNGRADE} - 達 100% 阻擋（不降級）；達降級門檻改用 budgetModelId</li>
 *   <li>上限小於等於 0 視為設定錯誤，一律阻擋</li>
 * </ul>
 *
 * <p>儲存層故障（{@link TransientStoreException}、{@link DataAccessException}）時依
 * {@code quota.enforcement.fail-open} 放行或阻擋，結果帶有 {@code degraded=true}。
 * 找不到預設方案屬於設定錯誤，{@link QuotaNotFoundException} 直接往上拋。
 *
 * <p>檢查與實際扣款之間沒有鎖：同一用戶的並行請求可能都通過檢查，
 * 超支上限為進行中請求的成本。用量只在請求完成、成本確定後累加，見 {@link UsageRecordingService}。
 */
@Service
public class QuotaChecker {

    private static final Logger log = LoggerFactory.getLogger(QuotaChecker.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** 無法解析方案時，CUSTOM_LIMIT override 使用的軟上限 */
    static final double FALLBACK_SOFT_LIMIT = QuotaTier.DEFAULT_SOFT_LIMIT_PERCENTAGE;

    static final String UNAVAILABLE_MESSAGE = "Quota service unavailable";

    private final OverrideResolver overrideResolver;
    private final AssignmentResolver assignmentResolver;
    private final UsageLedger usageLedger;
    private final QuotaEventRecorder eventRecorder;
    private final QuotaProperties.EnforcementConfig enforcement;
    private final Clock clock;

    /** monthlyKey → 當月已記錄過 OVERRIDE_APPLIED 的 overrideId，僅保留當月，僅限本實例 */
    private final Map<String, Set<String>> appliedOverrides = new ConcurrentHashMap<>();

    public QuotaChecker(
            OverrideResolver overrideResolver,
            AssignmentResolver assignmentResolver,
            UsageLedger usageLedger,
            QuotaEventRecorder eventRecorder,
            QuotaProperties properties,
            Clock clock) {
        this.overrideResolver = overrideResolver;
        this.assignmentResolver = assignmentResolver;
        this.usageLedger = usageLedger;
        this.eventRecorder = eventRecorder;
        this.enforcement = properties.enforcement();
        this.clock = clock;
    }

    /**
     * 以目前時間檢查配額。
     */
    public QuotaCheckResult checkQuota(QuotaUser user, String sessionId) {
        return checkQuota(user, sessionId, null, clock.instant());
    }

    /**
     * 檢查配額並記錄稽核事件。
     *
     * @param user 用戶身分
     * @param sessionId 對話 ID，寫入事件 metadata
     * @param requestedModelId 原本要使用的模型，降級時回報為 originalModelId
     * @param now 評估時間點
     * @return 檢查結果
     * @throws QuotaNotFoundException 沒有預設方案
     */
    public QuotaCheckResult checkQuota(QuotaUser user, String sessionId, String requestedModelId, Instant now) {
        if (!enforcement.enabled()) {
            log.debug("Quota enforcement disabled, allowing request: userId={}", user.userId());
            return QuotaCheckResult.enforcementDisabled();
        }

        QuotaCheckResult result;
        try {
            result = evaluate(user, requestedModelId, now);
        } catch (TransientStoreException | DataAccessException e) {
            return degraded(user, e);
        }

        recordEvents(user, sessionId, result, now);

        log.debug("Quota checked: userId={}, allowed={}, matchedBy={}, tierId={}, percentageUsed={}, event={}",
            user.userId(), result.allowed(), result.matchedBy(), result.tierId(),
            result.percentageUsed(), result.eventType());
        return result;
    }

    /**
     * 評估配額決策，不記錄任何事件。
     *
     * <p>供 {@link #checkQuota} 與 {@link QuotaInspectorService} 共用。
     *
     * @param user 用戶身分
     * @param requestedModelId 原本要使用的模型，可為 null
     * @param now 評估時間點
     * @return 檢查結果
     * @throws TransientStoreException 儲存層故障
     * @throws QuotaNotFoundException 沒有預設方案
     */
    public QuotaCheckResult evaluate(QuotaUser user, String requestedModelId, Instant now) {
        Optional<QuotaOverride> override = overrideResolver.resolve(user.userId(), now);

        if (override.isPresent() && override.get().isUnlimited()) {
            return QuotaCheckResult.builder()
                .allowed(true)
                .message("Unlimited quota override active")
                .override(override.get())
                .matchedBy(MatchedBy.OVERRIDE)
                .periodKey(PeriodUtils.monthlyKey(now))
                .percentageUsed(0)
                .build();
        }

        EffectivePolicy policy = override.isPresent()
            ? customLimitPolicy(user, override.get())
            : tierPolicy(assignmentResolver.resolve(user));

        return decide(user, policy, requestedModelId, now);
    }

    // ========== 有效政策 ==========

    private EffectivePolicy tierPolicy(ResolvedTier resolved) {
        QuotaTier tier = resolved.tier();
        return new EffectivePolicy(
            tier, null, resolved.matchedBy(),
            tier.monthlyCostLimit(), tier.dailyCostLimit(),
            true,
            tier.actionOnLimit(), tier.softLimitPercentage(),
            tier.downgradeThreshold(), tier.budgetModelId(),
            false);
    }

    private EffectivePolicy customLimitPolicy(QuotaUser user, QuotaOverride override) {
        QuotaTier tier = null;
        try {
            tier = assignmentResolver.resolve(user).tier();
        } catch (QuotaNotFoundException e) {
            log.warn("No tier resolvable for override user, using BLOCK semantics: userId={}, overrideId={}",
                user.userId(), override.overrideId());
        }

        if (tier == null) {
            return new EffectivePolicy(
                null, override, MatchedBy.OVERRIDE,
                override.monthlyCostLimit(), override.dailyCostLimit(),
                false,
                ActionOnLimit.BLOCK, FALLBACK_SOFT_LIMIT, null, null,
                true);
        }
        return new EffectivePolicy(
            tier, override, MatchedBy.OVERRIDE,
            override.monthlyCostLimit(), override.dailyCostLimit(),
            false,
            tier.actionOnLimit(), tier.softLimitPercentage(),
            tier.downgradeThreshold(), tier.budgetModelId(),
            true);
    }

    // ========== 決策 ==========

    private QuotaCheckResult decide(QuotaUser user, EffectivePolicy policy, String requestedModelId, Instant now) {
        PeriodMeasurement monthly = null;
        PeriodMeasurement daily = null;

        if (policy.monthlyLimit() != null || policy.monthlyAlwaysEvaluated()) {
            monthly = measure(user.userId(), PeriodType.MONTHLY, PeriodUtils.monthlyKey(now), policy.monthlyLimit());
        }
        if (policy.dailyLimit() != null) {
            daily = measure(user.userId(), PeriodType.DAILY, PeriodUtils.dailyKey(now), policy.dailyLimit());
        }

        PeriodMeasurement governing = governing(monthly, daily);
        double percentage = governing.percentage();

        QuotaCheckResult.Builder result = QuotaCheckResult.builder()
            .tier(policy.tier())
            .override(policy.override())
            .matchedBy(policy.matchedBy())
            .monthlyLimit(policy.monthlyLimit())
            .dailyLimit(policy.dailyLimit())
            .monthlyUsage(monthly == null ? null : monthly.usage())
            .dailyUsage(daily == null ? null : daily.usage())
            .governingPeriod(governing.periodType())
            .periodKey(governing.periodKey())
            .quotaLimit(governing.limit())
            .currentUsage(governing.usage())
            .percentageUsed(percentage)
            .remaining(governing.remaining());

        if (!governing.limitValid()) {
            log.error("Invalid quota limit, blocking request: userId={}, tierId={}, period={}, limit={}",
                user.userId(), policy.tierId(), governing.periodType(), governing.limit());
            return blocked(result, "Quota limit is not configured correctly. Please contact an administrator.");
        }

        boolean exceeded = percentage >= 100;

        switch (policy.action()) {
            case BLOCK -> {
                if (exceeded) {
                    return blocked(result, exceededMessage(governing));
                }
                if (percentage >= policy.softLimit()) {
                    return warned(result, policy, governing);
                }
            }
            case WARN -> {
                if (exceeded && policy.hardCap()) {
                    return blocked(result, exceededMessage(governing));
                }
                if (percentage >= policy.softLimit()) {
                    return warned(result, policy, governing);
                }
            }
            case DOWNGRADE -> {
                if (exceeded) {
                    return blocked(result, exceededMessage(governing));
                }
                if (policy.downgradeThreshold() != null
                        && policy.budgetModelId() != null
                        && percentage >= policy.downgradeThreshold()) {
                    return result
                        .allowed(true)
                        .downgraded(true)
                        .downgradeModelId(policy.budgetModelId())
                        .originalModelId(requestedModelId)
                        .message(String.format(Locale.ROOT,
                            "You have used %s of your %s quota. Requests now use %s.",
                            formatPercentage(percentage), periodLabel(governing.periodType()),
                            policy.budgetModelId()))
                        .eventType(QuotaEventType.DOWNGRADE)
                        .build();
                }
            }
        }

        return result
            .allowed(true)
            .message("Within quota")
            .build();
    }

    private QuotaCheckResult blocked(QuotaCheckResult.Builder result, String message) {
        return result
            .allowed(false)
            .remaining(BigDecimal.ZERO)
            .message(message)
            .eventType(QuotaEventType.BLOCK)
            .build();
    }

    private QuotaCheckResult warned(QuotaCheckResult.Builder result, EffectivePolicy policy, PeriodMeasurement governing) {
        return result
            .allowed(true)
            .warningLevel(formatPercentage(policy.softLimit()))
            .message(String.format(Locale.ROOT, "You have used %s of your %s quota.",
                formatPercentage(governing.percentage()), periodLabel(governing.periodType())))
            .eventType(QuotaEventType.WARNING)
            .build();
    }

    private PeriodMeasurement measure(String userId, PeriodType periodType, String periodKey, BigDecimal limit) {
        BigDecimal usage = usageLedger.read(userId, periodKey);
        return new PeriodMeasurement(periodType, periodKey, limit, usage, percentage(usage, limit));
    }

    /**
     * 取百分比較高者；相同時以月度為準。
     */
    private static PeriodMeasurement governing(PeriodMeasurement monthly, PeriodMeasurement daily) {
        if (monthly == null) {
            return daily;
        }
        if (daily == null) {
            return monthly;
        }
        return daily.percentage() > monthly.percentage() ? daily : monthly;
    }

    /**
     * 計算使用百分比，上限不合法時回傳 100。
     */
    static double percentage(BigDecimal usage, BigDecimal limit) {
        if (limit == null || limit.signum() <= 0) {
            return 100.0;
        }
        return usage.multiply(HUNDRED).divide(limit, 4, RoundingMode.HALF_UP).doubleValue();
    }

    static String formatPercentage(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString() + "%";
    }

    private static String exceededMessage(PeriodMeasurement governing) {
        return String.format(Locale.ROOT,
            "Quota exceeded: $%s of $%s %s limit used. Please contact an administrator to increase your quota.",
            governing.usage().setScale(2, RoundingMode.HALF_UP).toPlainString(),
            governing.limit().setScale(2, RoundingMode.HALF_UP).toPlainString(),
            periodLabel(governing.periodType()));
    }

    private static String periodLabel(PeriodType periodType) {
        return periodType == PeriodType.DAILY ? "daily" : "monthly";
    }

    // ========== 故障處理 ==========

    private QuotaCheckResult degraded(QuotaUser user, RuntimeException e) {
        if (enforcement.failOpen()) {
            log.warn("Usage store unavailable, failing open: userId={}, error={}", user.userId(), e.getMessage());
            return QuotaCheckResult.degraded(true, "Quota check skipped: usage store unavailable");
        }
        log.warn("Usage store unavailable, failing closed: userId={}, error={}", user.userId(), e.getMessage());
        return QuotaCheckResult.degraded(false, UNAVAILABLE_MESSAGE);
    }

    // ========== 稽核事件 ==========

    /**
     * 標記 override 本月已套用，跨月時捨棄舊月份的紀錄。
     *
     * @return 本月第一次套用時為 true
     */
    boolean markOverrideApplied(String overrideId, String monthlyKey) {
        if (!appliedOverrides.containsKey(monthlyKey)) {
            appliedOverrides.keySet().removeIf(key -> !key.equals(monthlyKey));
        }
        return appliedOverrides
            .computeIfAbsent(monthlyKey, key -> ConcurrentHashMap.newKeySet())
            .add(String.valueOf(overrideId));
    }

    int appliedOverrideMonths() {
        return appliedOverrides.size();
    }

    private void recordEvents(QuotaUser user, String sessionId, QuotaCheckResult result, Instant now) {
        try {
            QuotaOverride override = result.override();
            if (override != null
                    && markOverrideApplied(override.overrideId(), PeriodUtils.monthlyKey(now))) {
                Map<String, String> metadata = baseMetadata(sessionId, result);
                metadata.put("overrideId", String.valueOf(override.overrideId()));
                metadata.put("overrideType", override.overrideType().name());
                eventRecorder.record(QuotaEvent.create(
                    user.userId(), result.tierId(), QuotaEventType.OVERRIDE_APPLIED,
                    result.currentUsage(), result.quotaLimit(), result.percentageUsed(),
                    now, metadata));
            }

            if (result.eventType() != null) {
                Map<String, String> metadata = baseMetadata(sessionId, result);
                if (result.warningLevel() != null) {
                    metadata.put("threshold", result.warningLevel());
                }
                if (result.downgraded()) {
                    metadata.put("budgetModelId", result.downgradeModelId());
                    if (result.originalModelId() != null) {
                        metadata.put("originalModelId", result.originalModelId());
                    }
                    if (result.tier() != null && result.tier().downgradeThreshold() != null) {
                        metadata.put("threshold", formatPercentage(result.tier().downgradeThreshold()));
                    }
                }
                eventRecorder.record(QuotaEvent.create(
                    user.userId(), result.tierId(), result.eventType(),
                    result.currentUsage(), result.quotaLimit(), result.percentageUsed(),
                    now, metadata));
            }
        } catch (RuntimeException e) {
            log.error("Failed to record quota event, ignoring: userId={}, error={}", user.userId(), e.getMessage(), e);
        }
    }

    private static Map<String, String> baseMetadata(String sessionId, QuotaCheckResult result) {
        Map<String, String> metadata = new HashMap<>();
        if (sessionId != null) {
            metadata.put("sessionId", sessionId);
        }
        if (result.periodKey() != null) {
            metadata.put("period", result.periodKey());
        }
        if (result.matchedBy() != null) {
            metadata.put("matchedBy", result.matchedBy().name());
        }
        return metadata;
    }

    /**
     * 合併方案與 override 後的有效政策。
     *
     * @param monthlyAlwaysEvaluated 方案政策一律評估月上限，缺少時視為設定錯誤
     * @param hardCap 上限達 100% 一律阻擋，不論處置方式
     */
    private record EffectivePolicy(
        QuotaTier tier,
        QuotaOverride override,
        MatchedBy matchedBy,
        BigDecimal monthlyLimit,
        BigDecimal dailyLimit,
        boolean monthlyAlwaysEvaluated,
        ActionOnLimit action,
        double softLimit,
        Double downgradeThreshold,
        String budgetModelId,
        boolean hardCap
    ) {
        String tierId() {
            return tier == null ? null : tier.tierId();
        }
    }

    private record PeriodMeasurement(
        PeriodType periodType,
        String periodKey,
        BigDecimal limit,
        BigDecimal usage,
        double percentage
    ) {
        boolean limitValid() {
            return limit != null && limit.signum() > 0;
        }

        BigDecimal remaining() {
            if (!limitValid()) {
                return BigDecimal.ZERO;
            }
            return limit.subtract(usage).max(BigDecimal.ZERO);
        }
    }
}
