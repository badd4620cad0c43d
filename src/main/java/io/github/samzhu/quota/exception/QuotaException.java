package io.github.samzhu.quota.exception;

/**
 * 配額服務例外的共同父類別。
 *
 * <p>每個子類別帶有固定的錯誤代碼，由
 * {@link io.github.samzhu.quota.controller.ApiExceptionHandler} 轉成 HTTP 回應。
 */
public abstract class QuotaException extends RuntimeException {

    private final String code;

    protected QuotaException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected QuotaException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
