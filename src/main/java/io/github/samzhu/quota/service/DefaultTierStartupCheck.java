package io.github.samzhu.quota.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.exception.QuotaNotFoundException;

/**
 * 啟動時確認存在可用的預設方案。
 *
 * <p>沒有預設方案時，沒有任何指派的用戶會在配額檢查時得到 {@link QuotaNotFoundException}。
 * {@code quota.startup.fail-on-missing-default-tier=true} 時中止啟動，否則只記錄錯誤。
 */
@Component
public class DefaultTierStartupCheck {

    private static final Logger log = LoggerFactory.getLogger(DefaultTierStartupCheck.class);

    private final AssignmentResolver assignmentResolver;
    private final QuotaProperties.StartupConfig config;

    public DefaultTierStartupCheck(AssignmentResolver assignmentResolver, QuotaProperties properties) {
        this.assignmentResolver = assignmentResolver;
        this.config = properties.startup();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        try {
            verifyDefaultTier();
        } catch (DataAccessException e) {
            if (config.failOnMissingDefaultTier()) {
                throw e;
            }
            log.error("Default tier check skipped, store unavailable: {}", e.getMessage());
        }
    }

    /**
     * 檢查預設方案。
     *
     * @return 是否存在可用的預設方案
     * @throws QuotaNotFoundException 不存在且設定為中止啟動
     */
    public boolean verifyDefaultTier() {
        Optional<ResolvedTier> defaultTier = assignmentResolver.resolveDefault();
        if (defaultTier.isPresent()) {
            log.info("Default tier verified: tierId={}", defaultTier.get().tier().tierId());
            return true;
        }
        if (config.failOnMissingDefaultTier()) {
            throw QuotaNotFoundException.noDefaultTier();
        }
        log.error("No enabled DEFAULT_TIER assignment found. Users without assignments will fail quota checks.");
        return false;
    }
}
