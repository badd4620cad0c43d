package io.github.samzhu.quota.service;

import static io.github.samzhu.quota.support.QuotaFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import io.github.samzhu.quota.document.RequestCostRecord;
import io.github.samzhu.quota.dto.RequestCostData;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.repository.RequestCostRecordRepository;
import io.github.samzhu.quota.support.InMemoryUsageLedger;

class UsageRecordingServiceTest {

    private RequestCostRecordRepository costRecordRepository;
    private InMemoryUsageLedger ledger;
    private UsageRecordingService service;

    @BeforeEach
    void setUp() {
        costRecordRepository = mock(RequestCostRecordRepository.class);
        when(costRecordRepository.insert(any(RequestCostRecord.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));
        ledger = new InMemoryUsageLedger();
        service = new UsageRecordingService(costRecordRepository, ledger, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RequestCostData cost(String requestId, String amount, String status, Instant completedAt) {
        return new RequestCostData("user-1", requestId, "session-1", "claude-sonnet",
            amount == null ? null : new BigDecimal(amount), status, completedAt);
    }

    @Test
    void shouldChargeMonthlyAndDailyCounters() {
        // Given: 1/31 23:30 UTC 完成的請求
        Instant completedAt = Instant.parse("2026-01-31T23:30:00Z");

        // When
        boolean charged = service.recordCost(cost("req-1", "0.75", "completed", completedAt));

        // Then
        assertThat(charged).isTrue();
        assertThat(ledger.read("user-1", "2026-01")).isEqualByComparingTo("0.75");
        assertThat(ledger.read("user-1", "2026-01-31")).isEqualByComparingTo("0.75");

        ArgumentCaptor<RequestCostRecord> record = ArgumentCaptor.forClass(RequestCostRecord.class);
        verify(costRecordRepository).insert(record.capture());
        assertThat(record.getValue().requestId()).isEqualTo("req-1");
        assertThat(record.getValue().monthlyPeriodKey()).isEqualTo("2026-01");
        assertThat(record.getValue().dailyPeriodKey()).isEqualTo("2026-01-31");
    }

    @Test
    void shouldChargeOnlyOncePerRequest() {
        service.recordCost(cost("req-1", "1.00", "completed", NOW));
        when(costRecordRepository.insert(any(RequestCostRecord.class)))
            .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        boolean chargedAgain = service.recordCost(cost("req-1", "1.00", "completed", NOW));

        assertThat(chargedAgain).isFalse();
        assertThat(ledger.read("user-1", "2026-01")).isEqualByComparingTo("1.00");
    }

    @Test
    void shouldNotChargeIncompleteOrFreeRequests() {
        assertThat(service.recordCost(cost("req-1", "1.00", "failed", NOW))).isFalse();
        assertThat(service.recordCost(cost("req-2", "0", "completed", NOW))).isFalse();
        assertThat(service.recordCost(cost("req-3", null, "completed", NOW))).isFalse();
        assertThat(service.recordCost(new RequestCostData(null, "req-4", null, null,
            BigDecimal.ONE, "completed", NOW))).isFalse();

        verifyNoInteractions(costRecordRepository);
    }

    @Test
    void shouldUseCurrentTimeWhenCompletionTimeMissing() {
        service.recordCost(cost("req-1", "0.20", "COMPLETED", null));

        assertThat(ledger.read("user-1", "2026-01-15")).isEqualByComparingTo("0.20");
    }

    @Test
    void shouldSurfaceStoreFailureWithoutCharging() {
        // Given: 成本記錄寫入時儲存層中斷
        when(costRecordRepository.insert(any(RequestCostRecord.class)))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        // When / Then: 以暫時性錯誤交回呼叫端，計數器未變動
        assertThatThrownBy(() -> service.recordCost(cost("req-1", "0.50", "completed", NOW)))
            .isInstanceOf(TransientStoreException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThat(ledger.read("user-1", "2026-01")).isEqualByComparingTo("0");
    }
}
