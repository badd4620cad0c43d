package io.github.samzhu.quota.dto;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 請求最終成本資料（CloudEvents data payload）。
 *
 * <p>計費服務在聊天請求結束、成本確定後發送。只有 {@code status=completed}
 * 的請求會計入用量；被取消或失敗的請求不扣款。
 *
 * <p>欄位說明：
 * <ul>
 *   <li>{@code userId} - 用戶識別碼（來自 JWT sub claim）</li>
 *   <li>{@code requestId} - 請求唯一識別碼，用於冪等保護</li>
 *   <li>{@code sessionId} - 對話 ID</li>
 *   <li>{@code modelId} - 實際使用的模型（降級後為 budget model）</li>
 *   <li>{@code costUsd} - 最終成本 (USD)</li>
 *   <li>{@code status} - {@code completed} / {@code canceled} / {@code failed}</li>
 *   <li>{@code completedAt} - 完成時間 (UTC)，決定計入哪個週期</li>
 * </ul>
 */
public record RequestCostData(
    @JsonProperty("user_id") String userId,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("model_id") String modelId,
    @JsonProperty("cost_usd") BigDecimal costUsd,
    String status,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static final String STATUS_COMPLETED = "completed";

    /**
     * 判斷此請求是否已完成。
     *
     * @return 若 status 為 "completed"（不分大小寫）則回傳 true
     */
    public boolean isCompleted() {
        return STATUS_COMPLETED.equalsIgnoreCase(status);
    }
}
