package io.github.samzhu.quota.model;

/**
 * 配額稽核事件類型。
 */
public enum QuotaEventType {
    WARNING,
    BLOCK,
    RESET,
    OVERRIDE_APPLIED,
    DOWNGRADE
}
