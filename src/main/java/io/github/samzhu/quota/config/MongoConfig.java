package io.github.samzhu.quota.config;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import io.github.samzhu.quota.document.QuotaEvent;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用 Repository 自動掃描，並在啟動完成後建立需要依設定決定參數的索引
 * （稽核事件的 TTL 保存期限）。其餘索引由 {@code @Indexed} / {@code @CompoundIndex}
 * 搭配 {@code spring.data.mongodb.auto-index-creation=true} 建立。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code quota_tiers} - 配額方案</li>
 *   <li>{@code quota_assignments} - 方案指派（用戶 / 角色 / 網域 / 預設）</li>
 *   <li>{@code quota_overrides} - 限時個人例外</li>
 *   <li>{@code usage_records} - 月/日用量計數器</li>
 *   <li>{@code request_costs} - 每個完成請求的最終成本（對帳權威來源）</li>
 *   <li>{@code quota_events} - 配額決策稽核事件</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.quota.repository")
public class MongoConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoConfig.class);

    private final MongoTemplate mongoTemplate;
    private final QuotaProperties properties;

    public MongoConfig(MongoTemplate mongoTemplate, QuotaProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    /**
     * 建立稽核事件的 TTL 索引，保存期限由 {@code quota.events.retention} 決定。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void ensureEventRetentionIndex() {
        Duration retention = properties.events().retention();
        mongoTemplate.indexOps(QuotaEvent.class).ensureIndex(
            new Index().on("timestamp", Sort.Direction.ASC)
                .named("timestamp_ttl_idx")
                .expire(retention));
        log.info("Quota event retention index ensured: retention={}", retention);
    }
}
