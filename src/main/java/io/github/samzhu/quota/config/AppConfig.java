package io.github.samzhu.quota.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link QuotaProperties} 的型別安全配置綁定，
 * 使服務可以透過 constructor injection 取得配置值。
 *
 * <p>另外註冊 UTC {@link Clock}，所有「現在時間」都由此取得，
 * 讓週期計算與 override 有效期判斷在測試中可被固定。
 *
 * @see QuotaProperties
 */
@Configuration
@EnableConfigurationProperties(QuotaProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
