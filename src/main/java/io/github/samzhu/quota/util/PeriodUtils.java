package io.github.samzhu.quota.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;

import io.github.samzhu.quota.model.PeriodType;

/**
 * 週期鍵工具類。
 *
 * <p>用量計數器以週期鍵分桶：月度 {@code yyyy-MM}、每日 {@code yyyy-MM-dd}。
 * 所有時間計算均使用 UTC 時區，跨時區部署的實例會得到相同的週期鍵。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得月度週期鍵。
     *
     * @param instant 時間點
     * @return 格式如 "2026-01"
     */
    public static String monthlyKey(Instant instant) {
        return YearMonth.from(instant.atZone(ZoneOffset.UTC)).toString();
    }

    /**
     * 取得每日週期鍵。
     *
     * @param instant 時間點
     * @return 格式如 "2026-01-15"
     */
    public static String dailyKey(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
    }

    /**
     * 取得前一天的每日週期鍵。
     *
     * @param instant 時間點
     * @return 前一天，格式如 "2026-01-14"
     */
    public static String previousDailyKey(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).minusDays(1).toString();
    }

    /**
     * 由週期鍵判斷週期類型。
     *
     * @param periodKey 週期鍵
     * @return 長度 7 為月度，其餘為每日
     */
    public static PeriodType typeOf(String periodKey) {
        return periodKey.length() == 7 ? PeriodType.MONTHLY : PeriodType.DAILY;
    }
}
