package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.RequestCostRecord;
import io.github.samzhu.quota.dto.RequestCostData;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.repository.RequestCostRecordRepository;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 請求成本入帳服務。
 *
 * <p>每個完成的請求只累加一次用量：
 * <ol>
 *   <li>非 {@code completed} 或成本不大於 0 - 不入帳</li>
 *   <li>以 requestId 為 ID 插入 {@link RequestCostRecord}，重複投遞時插入失敗即略過</li>
 *   <li>累加完成時間所屬的月度與每日計數器</li>
 * </ol>
 *
 * <p>第 2 步成功但第 3 步失敗時，成本記錄已存在，計數器的缺口由
 * {@link UsageReconciliationService} 在下次對帳補上。
 * 第 2 步本身失敗時沒有任何記錄可供對帳，必須以 {@link TransientStoreException}
 * 交回訊息層重新投遞。
 */
@Service
public class UsageRecordingService {

    private static final Logger log = LoggerFactory.getLogger(UsageRecordingService.class);

    private final RequestCostRecordRepository costRecordRepository;
    private final UsageLedger usageLedger;
    private final Clock clock;

    public UsageRecordingService(
            RequestCostRecordRepository costRecordRepository,
            UsageLedger usageLedger,
            Clock clock) {
        this.costRecordRepository = costRecordRepository;
        this.usageLedger = usageLedger;
        this.clock = clock;
    }

    /**
     * 記錄請求最終成本。
     *
     * @param data 成本資料
     * @return 是否實際累加了用量
     * @throws TransientStoreException 成本記錄或計數器寫入失敗
     */
    public boolean recordCost(RequestCostData data) {
        if (data.userId() == null || data.requestId() == null) {
            log.warn("Cost event missing userId or requestId, ignoring: requestId={}, userId={}",
                data.requestId(), data.userId());
            return false;
        }
        if (!data.isCompleted()) {
            log.debug("Request not completed, not charging: requestId={}, status={}", data.requestId(), data.status());
            return false;
        }
        if (data.costUsd() == null || data.costUsd().signum() <= 0) {
            log.debug("Non-positive cost, not charging: requestId={}, cost={}", data.requestId(), data.costUsd());
            return false;
        }

        Instant completedAt = data.completedAt() != null ? data.completedAt() : clock.instant();
        String monthlyKey = PeriodUtils.monthlyKey(completedAt);
        String dailyKey = PeriodUtils.dailyKey(completedAt);

        try {
            costRecordRepository.insert(new RequestCostRecord(
                data.requestId(), data.userId(), data.sessionId(), data.modelId(),
                data.costUsd().doubleValue(), completedAt, monthlyKey, dailyKey, clock.instant()));
        } catch (DuplicateKeyException e) {
            log.info("Duplicate cost event, already counted: requestId={}, userId={}", data.requestId(), data.userId());
            return false;
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to store request cost: requestId=" + data.requestId(), e);
        }

        BigDecimal monthlyTotal = usageLedger.increment(data.userId(), monthlyKey, data.costUsd());
        BigDecimal dailyTotal = usageLedger.increment(data.userId(), dailyKey, data.costUsd());

        log.debug("Cost recorded: requestId={}, userId={}, cost={}, monthlyTotal={}, dailyTotal={}",
            data.requestId(), data.userId(), data.costUsd(), monthlyTotal, dailyTotal);
        return true;
    }
}
