package io.github.samzhu.quota.service;

import java.util.List;

/**
 * 驗證結果。
 *
 * @param valid 是否通過
 * @param errors 所有驗證錯誤，通過時為空
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
