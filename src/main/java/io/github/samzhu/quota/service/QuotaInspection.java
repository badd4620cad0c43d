package io.github.samzhu.quota.service;

import java.math.BigDecimal;

import io.github.samzhu.quota.model.QuotaUser;

/**
 * 診斷用的完整配額解析結果。
 *
 * @param user 查詢的用戶身分
 * @param assignment 不考慮 override 時解析到的方案，找不到預設方案時為 null
 * @param monthlyKey 當月週期鍵
 * @param monthlyUsage 當月用量
 * @param dailyKey 當日週期鍵
 * @param dailyUsage 當日用量
 * @param decision 此刻檢查會得到的結果（不記錄事件）
 */
public record QuotaInspection(
    QuotaUser user,
    ResolvedTier assignment,
    String monthlyKey,
    BigDecimal monthlyUsage,
    String dailyKey,
    BigDecimal dailyUsage,
    QuotaCheckResult decision
) {
}
