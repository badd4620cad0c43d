package io.github.samzhu.quota.exception;

/**
 * 找不到配額相關資源（方案、指派、override 或預設方案）。
 */
public class QuotaNotFoundException extends QuotaException {

    public static final String CODE = "not_found";

    private final String resourceType;
    private final String resourceId;

    public QuotaNotFoundException(String resourceType, String resourceId) {
        super(CODE, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    /**
     * 沒有任何已啟用的預設方案，用戶無法解析到方案。
     */
    public static QuotaNotFoundException noDefaultTier() {
        return new QuotaNotFoundException("Default tier", "no enabled DEFAULT_TIER assignment");
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
