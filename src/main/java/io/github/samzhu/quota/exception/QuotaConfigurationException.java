package io.github.samzhu.quota.exception;

import java.util.List;

/**
 * 配額設定不合法。
 *
 * <p>方案、指派或 override 在寫入前驗證失敗時拋出，
 * {@link #getErrors()} 帶有所有驗證錯誤，一次回給管理介面。
 */
public class QuotaConfigurationException extends QuotaException {

    public static final String CODE = "configuration_error";

    private final List<String> errors;

    public QuotaConfigurationException(String message, List<String> errors) {
        super(CODE, message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public QuotaConfigurationException(String message) {
        this(message, List.of(message));
    }

    public List<String> getErrors() {
        return errors;
    }
}
