package io.github.samzhu.quota.exception;

/**
 * 寫入會違反唯一性或一致性條件。
 *
 * <p>例如同一用戶有兩筆已啟用的直接指派、override 有效期間重疊，
 * 或刪除仍被指派參照的方案。
 */
public class QuotaConflictException extends QuotaException {

    public static final String CODE = "conflict";

    public QuotaConflictException(String message) {
        super(CODE, message);
    }
}
