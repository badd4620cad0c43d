package io.github.samzhu.quota.model;

/**
 * 個人例外類型。
 */
public enum OverrideType {

    /** 以 override 自身的月/日上限取代方案上限 */
    CUSTOM_LIMIT,

    /** 不限額度 */
    UNLIMITED
}
