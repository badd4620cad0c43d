package io.github.samzhu.quota.exception;

/**
 * 儲存層暫時無法使用（逾時、連線中斷）。
 *
 * <p>配額檢查遇到此例外時依 {@code quota.enforcement.fail-open} 決定放行或阻擋，
 * 不會往上拋給聊天管線。
 */
public class TransientStoreException extends QuotaException {

    public static final String CODE = "service_unavailable";

    public TransientStoreException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
