package io.github.samzhu.quota.dto.api;

import java.util.List;

/**
 * 統一錯誤回應。
 *
 * @param code 錯誤代碼，例如 {@code configuration_error}、{@code not_found}
 * @param message 簡短說明
 * @param detail 詳細說明，供管理介面直接顯示
 * @param errors 逐項驗證錯誤
 */
public record ErrorResponse(
    String code,
    String message,
    String detail,
    List<String> errors
) {

    public static ErrorResponse of(String code, String message, String detail) {
        return new ErrorResponse(code, message, detail, List.of());
    }
}
