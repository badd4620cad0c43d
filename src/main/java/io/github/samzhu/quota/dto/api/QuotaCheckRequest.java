package io.github.samzhu.quota.dto.api;

import java.util.List;

import io.github.samzhu.quota.model.QuotaUser;

import jakarta.validation.constraints.NotBlank;

/**
 * 配額檢查請求。
 *
 * <p>用於 POST /api/v1/quota/check 端點。身分資訊由聊天管線從已驗證的 JWT 取出；
 * {@code emailDomain} 優先於 {@code email}。
 */
public record QuotaCheckRequest(
    @NotBlank(message = "userId is required")
    String userId,

    String email,
    String emailDomain,
    List<String> roles,
    String sessionId,
    String requestedModelId
) {

    public QuotaUser toUser() {
        if (emailDomain != null && !emailDomain.isBlank()) {
            return new QuotaUser(userId, emailDomain, roles);
        }
        return QuotaUser.of(userId, email, roles);
    }
}
