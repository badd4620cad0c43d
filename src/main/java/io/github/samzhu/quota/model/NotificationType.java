package io.github.samzhu.quota.model;

/**
 * 聊天管線在串流回應前顯示給用戶的通知類型。
 */
public enum NotificationType {
    NONE,
    WARNING,
    DOWNGRADE,
    EXCEEDED,
    /** 儲存層故障且設定為 fail-closed，與用量無關 */
    UNAVAILABLE
}
