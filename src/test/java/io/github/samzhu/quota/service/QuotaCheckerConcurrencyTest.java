package io.github.samzhu.quota.service;

import static io.github.samzhu.quota.support.QuotaFixtures.MONTHLY_KEY;
import static io.github.samzhu.quota.support.QuotaFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.support.InMemoryUsageLedger;
import io.github.samzhu.quota.support.QuotaFixtures;

/**
 * 並行請求下的用量累加與超支上限。
 */
class QuotaCheckerConcurrencyTest {

    private static final int WORKERS = 16;

    private InMemoryUsageLedger ledger;
    private QuotaChecker checker;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        OverrideResolver overrideResolver = mock(OverrideResolver.class);
        AssignmentResolver assignmentResolver = mock(AssignmentResolver.class);
        when(overrideResolver.resolve(anyString(), any())).thenReturn(Optional.empty());
        when(assignmentResolver.resolve(any()))
            .thenReturn(new ResolvedTier(QuotaFixtures.blockTier("10.00"), MatchedBy.DEFAULT, null));

        ledger = new InMemoryUsageLedger();
        checker = new QuotaChecker(overrideResolver, assignmentResolver, ledger, mock(QuotaEventRecorder.class),
            QuotaProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        executor = Executors.newFixedThreadPool(WORKERS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldNotLoseConcurrentIncrements() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int j = 0; j < 100; j++) {
                    ledger.increment("user-1", MONTHLY_KEY, new BigDecimal("0.01"));
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(ledger.read("user-1", MONTHLY_KEY)).isEqualByComparingTo("16.00");
    }

    @Test
    void shouldBoundOvershootByInFlightRequests() throws Exception {
        // Given: 距離上限只剩 $0.05，每個請求成本 $0.50
        BigDecimal cost = new BigDecimal("0.50");
        ledger.set("user-1", MONTHLY_KEY, "9.95");
        QuotaUser user = QuotaUser.of("user-1", null, null);

        // When: 所有請求先檢查，再一起扣款
        CountDownLatch checked = new CountDownLatch(WORKERS);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < WORKERS; i++) {
            futures.add(executor.submit(() -> {
                boolean allowed = checker.evaluate(user, null, NOW).allowed();
                checked.countDown();
                checked.await();
                if (allowed) {
                    ledger.increment("user-1", MONTHLY_KEY, cost);
                }
                return allowed;
            }));
        }
        int admitted = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                admitted++;
            }
        }

        // Then: 超支不超過進行中請求的成本總和，之後的請求一律阻擋
        BigDecimal usage = ledger.read("user-1", MONTHLY_KEY);
        BigDecimal overshoot = usage.subtract(new BigDecimal("10.00"));
        assertThat(admitted).isEqualTo(WORKERS);
        assertThat(overshoot).isLessThanOrEqualTo(cost.multiply(BigDecimal.valueOf(WORKERS)));
        assertThat(checker.evaluate(user, null, NOW).allowed()).isFalse();
    }
}
