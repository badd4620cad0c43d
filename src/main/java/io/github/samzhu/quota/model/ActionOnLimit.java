package io.github.samzhu.quota.model;

/**
 * 用量達到上限時的處置方式。
 */
public enum ActionOnLimit {

    /** 達 100% 阻擋，達軟上限發出警告 */
    BLOCK,

    /** 只發出警告，永不阻擋 */
    WARN,

    /** 達降級門檻改用低成本模型，達 100% 阻擋 */
    DOWNGRADE
}
