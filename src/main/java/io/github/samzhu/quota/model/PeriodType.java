package io.github.samzhu.quota.model;

/**
 * 用量計算週期。
 */
public enum PeriodType {
    MONTHLY,
    DAILY
}
