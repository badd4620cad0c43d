package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 配額診斷服務，供客服查詢某位用戶為何被放行、警告、降級或阻擋。
 *
 * <p>使用 {@link QuotaChecker#evaluate} 計算決策，不記錄任何稽核事件，
 * 也不受 {@code quota.enforcement.enabled} 影響。
 */
@Service
public class QuotaInspectorService {

    private static final Logger log = LoggerFactory.getLogger(QuotaInspectorService.class);

    private final QuotaChecker quotaChecker;
    private final AssignmentResolver assignmentResolver;
    private final UsageLedger usageLedger;

    public QuotaInspectorService(
            QuotaChecker quotaChecker,
            AssignmentResolver assignmentResolver,
            UsageLedger usageLedger) {
        this.quotaChecker = quotaChecker;
        this.assignmentResolver = assignmentResolver;
        this.usageLedger = usageLedger;
    }

    /**
     * 診斷用戶目前的配額狀態。
     *
     * @param user 用戶身分
     * @param now 評估時間點
     * @return 診斷結果
     * @throws QuotaNotFoundException 沒有預設方案且用戶沒有 override
     */
    public QuotaInspection inspect(QuotaUser user, Instant now) {
        QuotaCheckResult decision = quotaChecker.evaluate(user, null, now);

        ResolvedTier assignment = null;
        try {
            assignment = assignmentResolver.resolve(user);
        } catch (QuotaNotFoundException e) {
            log.debug("No tier assignment for inspected user: userId={}", user.userId());
        }

        String monthlyKey = PeriodUtils.monthlyKey(now);
        String dailyKey = PeriodUtils.dailyKey(now);
        BigDecimal monthlyUsage = decision.monthlyUsage() != null
            ? decision.monthlyUsage()
            : usageLedger.read(user.userId(), monthlyKey);
        BigDecimal dailyUsage = decision.dailyUsage() != null
            ? decision.dailyUsage()
            : usageLedger.read(user.userId(), dailyKey);

        log.info("Quota inspected: userId={}, matchedBy={}, tierId={}, allowed={}, percentageUsed={}",
            user.userId(), decision.matchedBy(), decision.tierId(), decision.allowed(), decision.percentageUsed());

        return new QuotaInspection(user, assignment, monthlyKey, monthlyUsage, dailyKey, dailyUsage, decision);
    }
}
