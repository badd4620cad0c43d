package io.github.samzhu.quota.model;

import java.util.List;

/**
 * 方案指派類型。
 *
 * <p>{@link #PRECEDENCE} 定義解析順序，{@link io.github.samzhu.quota.service.AssignmentResolver}
 * 依此清單逐層比對，第一個有可用方案的層級勝出。
 */
public enum AssignmentType {

    DIRECT_USER(MatchedBy.DIRECT_USER),
    JWT_ROLE(MatchedBy.JWT_ROLE),
    EMAIL_DOMAIN(MatchedBy.EMAIL_DOMAIN),
    DEFAULT_TIER(MatchedBy.DEFAULT);

    /** 解析順序，越前面優先權越高 */
    public static final List<AssignmentType> PRECEDENCE = List.of(DIRECT_USER, JWT_ROLE, EMAIL_DOMAIN, DEFAULT_TIER);

    private final MatchedBy matchedBy;

    AssignmentType(MatchedBy matchedBy) {
        this.matchedBy = matchedBy;
    }

    public MatchedBy matchedBy() {
        return matchedBy;
    }
}
