package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 一次對帳的結果。
 *
 * @param startedAt 開始時間
 * @param finishedAt 結束時間
 * @param periodKeys 本次對帳的週期鍵
 * @param usersChecked 比對的用戶週期數
 * @param corrections 有覆寫的計數器
 * @param failedPeriods 因儲存層故障而略過的週期鍵
 */
public record ReconciliationReport(
    Instant startedAt,
    Instant finishedAt,
    List<String> periodKeys,
    int usersChecked,
    List<Correction> corrections,
    List<String> failedPeriods
) {

    public ReconciliationReport {
        periodKeys = List.copyOf(periodKeys);
        corrections = List.copyOf(corrections);
        failedPeriods = List.copyOf(failedPeriods);
    }

    public int correctedCount() {
        return corrections.size();
    }

    /**
     * 單一計數器的修正。
     *
     * @param userId 用戶
     * @param periodKey 週期鍵
     * @param previous 修正前
     * @param authoritative 修正後
     */
    public record Correction(
        String userId,
        String periodKey,
        BigDecimal previous,
        BigDecimal authoritative
    ) {
    }
}
