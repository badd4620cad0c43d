package io.github.samzhu.quota.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Quota Engine 的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link EnforcementConfig} - 配額檢查開關與儲存層故障時的放行策略</li>
 *   <li>{@link EventsConfig} - 稽核事件緩衝佇列與保存期限</li>
 *   <li>{@link ReconciliationConfig} - 用量對帳排程與容許誤差</li>
 *   <li>{@link StartupConfig} - 啟動時的設定檢查</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * quota:
 *   enforcement:
 *     enabled: true
 *     fail-open: true
 *   events:
 *     buffer-capacity: 10000
 *     batch-size: 500
 *     flush-interval: 1s
 *     retention: 365d
 *   reconciliation:
 *     enabled: true
 *     cron: "0 0/15 * * * *"
 *     drift-tolerance: 0.0001
 *   startup:
 *     fail-on-missing-default-tier: false
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "quota")
public record QuotaProperties(
    EnforcementConfig enforcement,
    EventsConfig events,
    ReconciliationConfig reconciliation,
    StartupConfig startup
) {
    public QuotaProperties {
        if (enforcement == null) {
            enforcement = EnforcementConfig.defaults();
        }
        if (events == null) {
            events = EventsConfig.defaults();
        }
        if (reconciliation == null) {
            reconciliation = ReconciliationConfig.defaults();
        }
        if (startup == null) {
            startup = StartupConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的設定。
     */
    public static QuotaProperties defaults() {
        return new QuotaProperties(null, null, null, null);
    }

    /**
     * 配額檢查設定。
     *
     * <p>{@code failOpen} 決定用量儲存層暫時無法使用時的行為：
     * <ul>
     *   <li>{@code true} - 放行請求並記錄警告（預設，短暫超支優於誤擋正常用戶）</li>
     *   <li>{@code false} - 阻擋請求直到儲存層恢復</li>
     * </ul>
     *
     * @param enabled 是否啟用配額檢查，false 時所有請求直接放行
     * @param failOpen 儲存層故障時是否放行
     */
    public record EnforcementConfig(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("true") boolean failOpen
    ) {
        public static EnforcementConfig defaults() {
            return new EnforcementConfig(true, true);
        }
    }

    /**
     * 稽核事件緩衝設定。
     *
     * <p>控制 {@link io.github.samzhu.quota.service.QuotaEventRecorder} 的行為：
     * 事件先進入有界佇列，由排程依 {@code flushInterval} 批次寫入，
     * 佇列滿時直接丟棄並記錄警告，確保聊天請求不會被稽核寫入拖慢。
     *
     * @param bufferCapacity 佇列容量，預設 10000
     * @param batchSize 每批寫入的最大事件數，預設 500
     * @param flushInterval 定時寫入間隔，預設 1 秒
     * @param retention 事件保存期限（TTL index），預設 365 天
     */
    public record EventsConfig(
        int bufferCapacity,
        int batchSize,
        Duration flushInterval,
        Duration retention
    ) {
        public EventsConfig {
            if (bufferCapacity <= 0) {
                bufferCapacity = 10_000;
            }
            if (batchSize <= 0) {
                batchSize = 500;
            }
            if (flushInterval == null || flushInterval.isZero() || flushInterval.isNegative()) {
                flushInterval = Duration.ofSeconds(1);
            }
            if (retention == null || retention.isZero() || retention.isNegative()) {
                retention = Duration.ofDays(365);
            }
        }

        public static EventsConfig defaults() {
            return new EventsConfig(10_000, 500, Duration.ofSeconds(1), Duration.ofDays(365));
        }
    }

    /**
     * 用量對帳設定。
     *
     * @param enabled 是否啟用定時對帳
     * @param cron 對帳排程 Cron 表達式，預設每 15 分鐘
     * @param driftTolerance 容許誤差 (USD)，低於此值不覆寫計數器
     */
    public record ReconciliationConfig(
        @DefaultValue("true") boolean enabled,
        String cron,
        BigDecimal driftTolerance
    ) {
        public ReconciliationConfig {
            if (cron == null || cron.isBlank()) {
                cron = "0 0/15 * * * *";
            }
            if (driftTolerance == null || driftTolerance.signum() < 0) {
                driftTolerance = new BigDecimal("0.0001");
            }
        }

        public static ReconciliationConfig defaults() {
            return new ReconciliationConfig(true, "0 0/15 * * * *", new BigDecimal("0.0001"));
        }
    }

    /**
     * 啟動檢查設定。
     *
     * @param failOnMissingDefaultTier 沒有預設方案時是否中止啟動，false 僅記錄錯誤
     */
    public record StartupConfig(
        boolean failOnMissingDefaultTier
    ) {
        public static StartupConfig defaults() {
            return new StartupConfig(false);
        }
    }
}
