package io.github.samzhu.quota.service;

import io.github.samzhu.quota.model.QuotaEventType;

/**
 * 稽核事件查詢條件，所有欄位皆可為 null。
 *
 * @param userId 用戶
 * @param tierId 方案
 * @param eventType 事件類型
 * @param before 分頁游標，回傳排在此事件 ID 之後（較舊）的事件
 */
public record QuotaEventFilter(
    String userId,
    String tierId,
    QuotaEventType eventType,
    String before
) {
}
