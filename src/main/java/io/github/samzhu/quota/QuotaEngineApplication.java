package io.github.samzhu.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Quota Engine - LLM 對話請求的配額與預算控管服務。
 *
 * <p>此服務位於聊天管線之前，負責：
 * <ul>
 *   <li>解析用戶適用的配額方案 (override → 直接指派 → JWT 角色 → Email 網域 → 預設)</li>
 *   <li>比對當期用量，決定放行、警告、降級模型或阻擋</li>
 *   <li>以非阻塞方式記錄配額決策事件供稽核</li>
 *   <li>接收 CloudEvents 格式的請求最終成本並累加用量</li>
 *   <li>定時對帳，修正用量計數器的漂移</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Chat Pipeline → POST /api/v1/quota/check → QuotaChecker → allow / warn / downgrade / block
 *                                                 ↓
 *                                           quota_events (稽核事件)
 *
 * Billing (Publisher) → Pub/Sub → requestCostConsumer → request_costs (權威成本)
 *                                                     → usage_records (月/日用量)
 *
 * UsageReconciliationService (cron) : request_costs → usage_records
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
@SpringBootApplication
@EnableScheduling
public class QuotaEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaEngineApplication.class);

    public static void main(String[] args) {
        log.info("Starting Quota Engine - LLM Budget Enforcement");
        SpringApplication.run(QuotaEngineApplication.class, args);
    }
}
