package io.github.samzhu.quota.model;

/**
 * 決定用戶有效配額的來源。
 */
public enum MatchedBy {
    OVERRIDE,
    DIRECT_USER,
    JWT_ROLE,
    EMAIL_DOMAIN,
    DEFAULT
}
