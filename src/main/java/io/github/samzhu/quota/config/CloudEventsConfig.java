package io.github.samzhu.quota.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>計費服務 (上游) 以 <b>Structured Mode</b> 發送請求最終成本事件，
 * 訊息格式為 {@code application/cloudevents+json}，整個 CloudEvent
 * (包含 attributes 和 data) 封裝在 JSON body 中。
 *
 * <p>此配置註冊 {@link CloudEventMessageConverter}，使 Spring Cloud Stream
 * 能夠解析 Structured Mode 訊息：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, subject, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload (自動反序列化為 POJO)</li>
 * </ul>
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    /**
     * 註冊 CloudEvents 訊息轉換器。
     *
     * <p>需要 {@code cloudevents-json-jackson} 依賴，
     * 該依賴透過 Java ServiceLoader 機制提供 JSON 序列化支援。
     *
     * @return CloudEventMessageConverter 實例
     */
    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
