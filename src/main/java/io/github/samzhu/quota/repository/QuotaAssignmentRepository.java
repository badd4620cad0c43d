package io.github.samzhu.quota.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.model.AssignmentType;

/**
 * 方案指派資料存取介面。
 *
 * <p>提供對 {@code quota_assignments} 集合的查詢操作。
 * 解析配額方案時只讀取已啟用的指派，排序與同層級取捨由
 * {@link io.github.samzhu.quota.service.AssignmentResolver} 處理。
 *
 * @see io.github.samzhu.quota.document.QuotaAssignment
 */
public interface QuotaAssignmentRepository extends MongoRepository<QuotaAssignment, String> {

    // ========== 解析用查詢 ==========

    List<QuotaAssignment> findByAssignmentTypeAndUserIdAndEnabledTrue(AssignmentType type, String userId);

    /**
     * 查詢符合任一 JWT 角色的已啟用指派。
     *
     * @param type 固定為 {@link AssignmentType#JWT_ROLE}
     * @param roles 用戶持有的角色
     * @return 符合的指派
     */
    List<QuotaAssignment> findByAssignmentTypeAndJwtRoleInAndEnabledTrue(AssignmentType type, List<String> roles);

    /**
     * 查詢某類型的所有已啟用指派。
     *
     * <p>Email 網域指派支援萬用字元與 regex，無法在資料庫端比對，
     * 因此取回全部後在記憶體中比對；預設方案指派也用此方法。
     *
     * @param type 指派類型
     * @return 已啟用的指派
     */
    List<QuotaAssignment> findByAssignmentTypeAndEnabledTrue(AssignmentType type);

    // ========== 管理用查詢 ==========

    List<QuotaAssignment> findByTierId(String tierId);

    List<QuotaAssignment> findByAssignmentType(AssignmentType type);

    boolean existsByTierId(String tierId);

    long countByTierId(String tierId);
}
