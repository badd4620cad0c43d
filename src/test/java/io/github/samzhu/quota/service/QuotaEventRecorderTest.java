package io.github.samzhu.quota.service;

import static io.github.samzhu.quota.support.QuotaFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.document.QuotaEvent;
import io.github.samzhu.quota.model.QuotaEventType;

class QuotaEventRecorderTest {

    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
    }

    private QuotaEventRecorder recorder(int capacity, int batchSize) {
        QuotaProperties properties = new QuotaProperties(null,
            new QuotaProperties.EventsConfig(capacity, batchSize, Duration.ofSeconds(1), Duration.ofDays(365)),
            null, null);
        return new QuotaEventRecorder(mongoTemplate, properties);
    }

    private static QuotaEvent event(String userId) {
        return QuotaEvent.create(userId, "standard", QuotaEventType.WARNING,
            new BigDecimal("8.50"), new BigDecimal("10.00"), 85.0, NOW, Map.of("period", "2026-01"));
    }

    @Test
    void shouldDropEventsWhenQueueIsFull() {
        QuotaEventRecorder recorder = recorder(2, 10);

        recorder.record(event("user-1"));
        recorder.record(event("user-2"));
        recorder.record(event("user-3"));

        assertThat(recorder.getQueueSize()).isEqualTo(2);
        assertThat(recorder.getDroppedCount()).isEqualTo(1);
    }

    @Test
    void shouldFlushInBatches() {
        QuotaEventRecorder recorder = recorder(10, 2);
        for (int i = 0; i < 5; i++) {
            recorder.record(event("user-" + i));
        }

        recorder.flush();

        verify(mongoTemplate, times(3)).insert(anyList(), eq(QuotaEvent.class));
        assertThat(recorder.getQueueSize()).isZero();
    }

    @Test
    void shouldRequeueBatchWhenInsertFails() {
        // Given
        QuotaEventRecorder recorder = recorder(10, 10);
        recorder.record(event("user-1"));
        recorder.record(event("user-2"));
        doThrow(new DataAccessResourceFailureException("down"))
            .when(mongoTemplate).insert(anyList(), eq(QuotaEvent.class));

        // When
        recorder.flush();

        // Then: 事件保留到下次 flush
        assertThat(recorder.getQueueSize()).isEqualTo(2);
        assertThat(recorder.getDroppedCount()).isZero();
    }

    @Test
    void shouldOnlyFlushOnScheduleWhileRunning() {
        QuotaEventRecorder recorder = recorder(10, 10);
        recorder.record(event("user-1"));

        recorder.scheduledFlush();
        verify(mongoTemplate, never()).insert(anyList(), eq(QuotaEvent.class));

        recorder.start();
        recorder.scheduledFlush();
        verify(mongoTemplate).insert(anyList(), eq(QuotaEvent.class));
    }

    @Test
    void shouldFlushRemainingEventsOnStop() {
        QuotaEventRecorder recorder = recorder(10, 10);
        recorder.start();
        recorder.record(event("user-1"));

        recorder.stop();

        assertThat(recorder.isRunning()).isFalse();
        assertThat(recorder.getQueueSize()).isZero();
        verify(mongoTemplate).insert(anyList(), eq(QuotaEvent.class));
    }

    @Test
    void shouldClampQueryLimit() {
        assertThat(QuotaEventRecorder.clampLimit(null)).isEqualTo(50);
        assertThat(QuotaEventRecorder.clampLimit(0)).isEqualTo(1);
        assertThat(QuotaEventRecorder.clampLimit(5000)).isEqualTo(1000);
        assertThat(QuotaEventRecorder.clampLimit(200)).isEqualTo(200);
    }
}
