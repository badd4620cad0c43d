package io.github.samzhu.quota.service;

import java.math.BigDecimal;

/**
 * 週期用量計數器。
 *
 * <p>每個 {@code (userId, periodKey)} 一個非負累計金額，週期鍵由
 * {@link io.github.samzhu.quota.util.PeriodUtils} 產生。計數器沒有鎖，
 * 正確性依賴儲存層的原子累加：同時發生的 {@link #increment} 不會遺失任何一筆。
 *
 * <p>儲存層故障一律以 {@link io.github.samzhu.quota.exception.TransientStoreException} 表示。
 */
public interface UsageLedger {

    /**
     * 讀取目前用量。
     *
     * @param userId 用戶 ID
     * @param periodKey 週期鍵
     * @return 累計金額 (USD)，尚無記錄時為 0
     */
    BigDecimal read(String userId, String periodKey);

    /**
     * 原子累加用量，記錄不存在時建立。
     *
     * @param userId 用戶 ID
     * @param periodKey 週期鍵
     * @param delta 增加金額，不可為負
     * @return 累加後的金額
     * @throws IllegalArgumentException delta 為負數
     */
    BigDecimal increment(String userId, String periodKey, BigDecimal delta);

    /**
     * 以權威金額覆寫用量，僅供對帳使用。重複呼叫結果相同。
     *
     * @param userId 用戶 ID
     * @param periodKey 週期鍵
     * @param amount 權威金額，不可為負
     */
    void reconcileSet(String userId, String periodKey, BigDecimal amount);
}
