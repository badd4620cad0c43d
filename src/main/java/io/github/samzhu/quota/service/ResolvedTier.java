package io.github.samzhu.quota.service;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.model.MatchedBy;

/**
 * 方案解析結果。
 *
 * @param tier 用戶適用的方案
 * @param matchedBy 勝出的層級
 * @param assignment 勝出的指派
 */
public record ResolvedTier(
    QuotaTier tier,
    MatchedBy matchedBy,
    QuotaAssignment assignment
) {
}
