package io.github.samzhu.quota.dto.api;

import io.github.samzhu.quota.document.QuotaAssignment;
import io.github.samzhu.quota.model.AssignmentType;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 方案指派建立/更新請求。
 *
 * <p>用於 POST /api/v1/admin/quota/assignments 與 PUT /api/v1/admin/quota/assignments/{assignmentId}。
 */
public record AssignmentRequest(
    @NotNull(message = "assignmentType is required")
    AssignmentType assignmentType,

    @NotBlank(message = "tierId is required")
    String tierId,

    String userId,
    String jwtRole,
    String emailDomain,

    @Min(value = 0, message = "priority must be between 0 and 999")
    @Max(value = 999, message = "priority must be between 0 and 999")
    Integer priority,

    Boolean enabled
) {

    public QuotaAssignment toAssignment() {
        return new QuotaAssignment(
            null,
            assignmentType, tierId, userId, jwtRole, emailDomain,
            priority == null ? 100 : priority,
            enabled == null || enabled,
            null, null, null);
    }
}
