package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.document.UsageRecord;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.repository.UsageRecordRepository;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 用量對帳服務。
 *
 * <p>定時以 {@link AuthoritativeCostSource} 的實際成本覆寫漂移的用量計數器。
 * 每次對帳的週期：
 * <ul>
 *   <li>當月</li>
 *   <li>當日</li>
 *   <li>前一日（吸收 UTC 午夜前後晚到的成本）</li>
 * </ul>
 *
 * <p>差異超過 {@code quota.reconciliation.drift-tolerance} 才覆寫。
 * 有計數器但沒有任何成本記錄的用戶會被設為 0。
 *
 * <p>對帳期間仍有即時累加：聚合之後、覆寫之前落地的累加可能被覆蓋，
 * 誤差不超過一個對帳間隔內的成本，會在下一次對帳修正。
 */
@Service
public class UsageReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(UsageReconciliationService.class);

    private final AuthoritativeCostSource costSource;
    private final UsageRecordRepository usageRecordRepository;
    private final UsageLedger usageLedger;
    private final QuotaProperties.ReconciliationConfig config;
    private final Clock clock;

    public UsageReconciliationService(
            AuthoritativeCostSource costSource,
            UsageRecordRepository usageRecordRepository,
            UsageLedger usageLedger,
            QuotaProperties properties,
            Clock clock) {
        this.costSource = costSource;
        this.usageRecordRepository = usageRecordRepository;
        this.usageLedger = usageLedger;
        this.config = properties.reconciliation();
        this.clock = clock;
    }

    /**
     * 定時觸發對帳，使用 Cron 表達式（預設每 15 分鐘）。
     */
    @Scheduled(cron = "${quota.reconciliation.cron:0 0/15 * * * *}")
    public void scheduledRun() {
        if (!config.enabled()) {
            log.debug("Scheduled reconciliation skipped: disabled");
            return;
        }
        try {
            run(clock.instant());
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 執行一次對帳。
     *
     * @param now 決定週期鍵的時間點
     * @return 對帳結果
     */
    public ReconciliationReport run(Instant now) {
        Instant startedAt = clock.instant();
        List<String> periodKeys = List.copyOf(new LinkedHashSet<>(List.of(
            PeriodUtils.monthlyKey(now),
            PeriodUtils.dailyKey(now),
            PeriodUtils.previousDailyKey(now))));

        log.info("Reconciliation started: periods={}", periodKeys);

        int usersChecked = 0;
        List<ReconciliationReport.Correction> corrections = new ArrayList<>();
        List<String> failedPeriods = new ArrayList<>();

        for (String periodKey : periodKeys) {
            try {
                usersChecked += reconcilePeriod(periodKey, corrections);
            } catch (TransientStoreException | DataAccessException e) {
                failedPeriods.add(periodKey);
                log.error("Reconciliation failed for period, will retry next run: period={}, error={}",
                    periodKey, e.getMessage(), e);
            }
        }

        ReconciliationReport report = new ReconciliationReport(
            startedAt, clock.instant(), periodKeys, usersChecked, corrections, failedPeriods);
        log.info("Reconciliation completed: periods={}, usersChecked={}, corrected={}, failed={}",
            periodKeys, usersChecked, report.correctedCount(), failedPeriods);
        return report;
    }

    private int reconcilePeriod(String periodKey, List<ReconciliationReport.Correction> corrections) {
        Map<String, BigDecimal> authoritative = costSource.totalsByUser(periodKey);

        Map<String, BigDecimal> ledger = new HashMap<>();
        for (UsageRecord record : usageRecordRepository.findByPeriodKey(periodKey)) {
            ledger.put(record.userId(), BigDecimal.valueOf(record.currentUsage()));
        }

        Set<String> users = new TreeSet<>(authoritative.keySet());
        users.addAll(ledger.keySet());

        for (String userId : users) {
            BigDecimal expected = authoritative.getOrDefault(userId, BigDecimal.ZERO);
            BigDecimal current = ledger.getOrDefault(userId, BigDecimal.ZERO);
            BigDecimal drift = expected.subtract(current).abs();

            if (drift.compareTo(config.driftTolerance()) > 0) {
                usageLedger.reconcileSet(userId, periodKey, expected);
                corrections.add(new ReconciliationReport.Correction(userId, periodKey, current, expected));
                log.info("Usage drift corrected: userId={}, period={}, ledger={}, authoritative={}",
                    userId, periodKey, current, expected);
            }
        }
        return users.size();
    }
}
