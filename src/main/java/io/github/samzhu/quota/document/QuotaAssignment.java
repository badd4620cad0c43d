package io.github.samzhu.quota.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.quota.model.AssignmentType;

/**
 * 方案指派文件。
 *
 * <p>將用戶、JWT 角色、Email 網域或系統預設綁定到某個方案。
 * 依 {@code assignmentType} 只有對應的比對欄位有值：
 * <ul>
 *   <li>{@code DIRECT_USER} - {@code userId}</li>
 *   <li>{@code JWT_ROLE} - {@code jwtRole}</li>
 *   <li>{@code EMAIL_DOMAIN} - {@code emailDomain}（支援萬用字元、regex、逗號清單）</li>
 *   <li>{@code DEFAULT_TIER} - 無</li>
 * </ul>
 *
 * <p>同一層級有多個指派符合時，{@code priority} (0-999) 較高者勝出。
 */
@Document(collection = "quota_assignments")
@CompoundIndexes({
    @CompoundIndex(name = "type_user_idx", def = "{'assignmentType': 1, 'userId': 1}"),
    @CompoundIndex(name = "type_role_idx", def = "{'assignmentType': 1, 'jwtRole': 1}"),
    @CompoundIndex(name = "tier_idx", def = "{'tierId': 1}")
})
public record QuotaAssignment(
    @Id String assignmentId,
    AssignmentType assignmentType,
    String tierId,
    String userId,
    String jwtRole,
    String emailDomain,
    int priority,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt,
    String createdBy
) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 999;

    /**
     * 建立新指派，ID 由 MongoDB 自動產生。
     */
    public static QuotaAssignment create(
            AssignmentType type,
            String tierId,
            String userId,
            String jwtRole,
            String emailDomain,
            int priority,
            boolean enabled,
            String createdBy,
            Instant now) {

        return new QuotaAssignment(
            null, // ID 自動產生
            type, tierId, userId, jwtRole, emailDomain,
            priority, enabled, now, now, createdBy
        );
    }

    /**
     * 以新內容取代，保留 ID 與建立資訊。
     */
    public QuotaAssignment withChanges(QuotaAssignment changes, Instant now) {
        return new QuotaAssignment(
            assignmentId,
            changes.assignmentType(), changes.tierId(), changes.userId(),
            changes.jwtRole(), changes.emailDomain(),
            changes.priority(), changes.enabled(),
            createdAt, now, createdBy
        );
    }
}
