package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 對帳用的權威成本來源。
 */
public interface AuthoritativeCostSource {

    /**
     * 計算某週期每位用戶的實際總成本。
     *
     * @param periodKey 月度或每日週期鍵
     * @return userId 對應總成本 (USD)，沒有成本的用戶不會出現
     */
    Map<String, BigDecimal> totalsByUser(String periodKey);
}
