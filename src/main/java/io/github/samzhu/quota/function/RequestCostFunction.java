package io.github.samzhu.quota.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quota.dto.RequestCostData;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.service.UsageRecordingService;

/**
 * CloudEvents 請求成本消費者函式配置。
 *
 * <p>使用 Spring Cloud Function 程式設計模型，消費計費服務發送的請求最終成本：
 * <ul>
 *   <li>GCP 部署：Pub/Sub</li>
 *   <li>測試：Spring Cloud Stream test binder</li>
 * </ul>
 *
 * <p>計費服務以 <b>Structured Mode</b> ({@code application/cloudevents+json})
 * 發送事件，Spring Cloud Stream 自動解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（自動轉換為 {@link RequestCostData}）</li>
 * </ul>
 *
 * <p>Binding name: {@code requestCostConsumer-in-0}
 *
 * @see <a href="https://spring.io/blog/2020/12/23/cloud-events-and-spring-part-2/">Cloud Events and Spring - part 2</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class RequestCostFunction {

    private static final Logger log = LoggerFactory.getLogger(RequestCostFunction.class);

    private final UsageRecordingService recordingService;

    public RequestCostFunction(UsageRecordingService recordingService) {
        this.recordingService = recordingService;
    }

    /**
     * CloudEvents 請求成本消費者 Bean。
     *
     * <p>錯誤處理：
     * <ul>
     *   <li>{@link TransientStoreException} - 重新拋出，由 binder 重試或送往 dead-letter；
     *       重新投遞時以 requestId 去重，不會重複累加</li>
     *   <li>其他例外（內容不合法） - 記錄後略過，避免無法處理的訊息反覆投遞</li>
     * </ul>
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<RequestCostData>> requestCostConsumer() {
        return message -> {
            try {
                RequestCostData data = message.getPayload();

                log.debug("CloudEvent received: id={}, type={}, source={}, userId={}, requestId={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    data.userId(), data.requestId());

                recordingService.recordCost(data);
            } catch (TransientStoreException e) {
                log.warn("Store unavailable, cost CloudEvent will be redelivered: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to process cost CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
            }
        };
    }
}
