package io.github.samzhu.quota.model;

import java.util.List;
import java.util.Locale;

/**
 * 外部驗證層提供的用戶身分。
 *
 * @param userId 用戶唯一識別碼
 * @param emailDomain Email 網域（小寫），可為 null
 * @param roles JWT 角色清單，null 與空白項目會被略過
 */
public record QuotaUser(
    String userId,
    String emailDomain,
    List<String> roles
) {
    public QuotaUser {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        roles = roles == null
            ? List.of()
            : roles.stream().filter(role -> role != null && !role.isBlank()).toList();
        if (emailDomain != null) {
            emailDomain = emailDomain.isBlank() ? null : emailDomain.trim().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * 由完整 Email 建立身分，網域取 {@code @} 之後的部分。
     *
     * @param userId 用戶 ID
     * @param email Email，可為 null 或不含 {@code @}
     * @param roles JWT 角色
     * @return QuotaUser
     */
    public static QuotaUser of(String userId, String email, List<String> roles) {
        return new QuotaUser(userId, domainOf(email), roles);
    }

    static String domainOf(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            return null;
        }
        return email.substring(at + 1);
    }
}
