package io.github.samzhu.quota.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.quota.dto.RequestCostData;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.service.UsageRecordingService;

/**
 * RequestCostFunction 整合測試，使用 Spring Cloud Stream Test Binder。
 *
 * <p>計費服務以 Structured Mode 發送 CloudEvent，Spring Cloud Stream 解析後
 * attributes 在 headers、data 在 payload；此測試直接模擬解析後的訊息格式。
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class RequestCostFunctionTest {

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static UsageRecordingService mockRecordingService;
    private static ObjectMapper objectMapper;

    @BeforeAll
    static void setupContext() {
        mockRecordingService = mock(UsageRecordingService.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=requestCostConsumer",
                "--spring.jmx.enabled=false",
                "--spring.autoconfigure.exclude=com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubAutoConfiguration,com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubReactiveAutoConfiguration,com.google.cloud.spring.autoconfigure.pubsub.stream.GcpPubSubBinderAutoConfiguration,com.google.cloud.spring.autoconfigure.core.GcpContextAutoConfiguration"
            );

        inputDestination = context.getBean(InputDestination.class);
        objectMapper = context.getBean(ObjectMapper.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMock() {
        reset(mockRecordingService);
    }

    private Message<byte[]> cloudEvent(RequestCostData data) throws Exception {
        return MessageBuilder.withPayload(objectMapper.writeValueAsBytes(data))
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("https://billing.example.com/api"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.billing.request-cost.v1")
            .setHeader(CloudEventMessageUtils.SUBJECT, data.userId())
            .setHeader(CloudEventMessageUtils.TIME, OffsetDateTime.now())
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0")
            .build();
    }

    @Test
    void shouldPassCostToRecordingService() throws Exception {
        // Given
        RequestCostData data = new RequestCostData(
            "user-abc-123",                          // userId
            "req-001",                               // requestId
            "session-9",                             // sessionId
            "claude-sonnet",                         // modelId
            new BigDecimal("0.0425"),                // costUsd
            "completed",                             // status
            Instant.parse("2026-01-15T10:00:00Z")    // completedAt
        );

        // When
        inputDestination.send(cloudEvent(data));

        // Then
        ArgumentCaptor<RequestCostData> captor = ArgumentCaptor.forClass(RequestCostData.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecordingService, atLeastOnce()).recordCost(captor.capture());
        });

        RequestCostData captured = captor.getValue();
        assertThat(captured.userId()).isEqualTo("user-abc-123");
        assertThat(captured.requestId()).isEqualTo("req-001");
        assertThat(captured.costUsd()).isEqualByComparingTo("0.0425");
        assertThat(captured.isCompleted()).isTrue();
        assertThat(captured.completedAt()).isEqualTo(Instant.parse("2026-01-15T10:00:00Z"));
    }

    @Test
    void shouldSkipInvalidCostAndContinue() throws Exception {
        // Given: 內容不合法的事件記錄後略過
        when(mockRecordingService.recordCost(any()))
            .thenThrow(new IllegalArgumentException("unparseable cost"))
            .thenReturn(true);
        RequestCostData first = new RequestCostData("user-1", "req-fail", null, "claude-haiku",
            new BigDecimal("0.01"), "completed", null);
        RequestCostData second = new RequestCostData("user-1", "req-next", null, "claude-haiku",
            new BigDecimal("0.02"), "completed", null);

        // When
        inputDestination.send(cloudEvent(first));
        inputDestination.send(cloudEvent(second));

        // Then: 後續訊息仍被處理
        ArgumentCaptor<RequestCostData> captor = ArgumentCaptor.forClass(RequestCostData.class);
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            verify(mockRecordingService, times(2)).recordCost(captor.capture());
        });
        assertThat(captor.getAllValues()).extracting(RequestCostData::requestId)
            .containsExactly("req-fail", "req-next");
    }

    @Test
    void shouldRethrowStoreFailureForRedelivery() {
        // Given: 成本記錄寫入失敗，訊息必須交回 binder 重送
        UsageRecordingService recordingService = mock(UsageRecordingService.class);
        TransientStoreException storeDown = new TransientStoreException("Failed to store request cost",
            new DataAccessResourceFailureException("connection reset"));
        when(recordingService.recordCost(any())).thenThrow(storeDown);
        Consumer<Message<RequestCostData>> consumer =
            new RequestCostFunction(recordingService).requestCostConsumer();
        Message<RequestCostData> message = MessageBuilder.withPayload(new RequestCostData(
                "user-1", "req-retry", null, "claude-haiku", new BigDecimal("0.01"), "completed", null))
            .setHeader(CloudEventMessageUtils.ID, "evt-1")
            .build();

        // When / Then
        assertThatThrownBy(() -> consumer.accept(message)).isSameAs(storeDown);
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class
    }, excludeName = {
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubReactiveAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.stream.GcpPubSubBinderAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.core.GcpContextAutoConfiguration"
    })
    @Import(RequestCostFunction.class)
    static class TestConfig {

        @Bean
        public UsageRecordingService usageRecordingService() {
            return mockRecordingService;
        }
    }
}
