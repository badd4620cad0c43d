package io.github.samzhu.quota.service;

import static io.github.samzhu.quota.support.QuotaFixtures.DAILY_KEY;
import static io.github.samzhu.quota.support.QuotaFixtures.MONTHLY_KEY;
import static io.github.samzhu.quota.support.QuotaFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.document.QuotaEvent;
import io.github.samzhu.quota.document.QuotaOverride;
import io.github.samzhu.quota.document.QuotaTier;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.exception.TransientStoreException;
import io.github.samzhu.quota.model.ActionOnLimit;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.NotificationType;
import io.github.samzhu.quota.model.PeriodType;
import io.github.samzhu.quota.model.QuotaEventType;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.support.InMemoryUsageLedger;
import io.github.samzhu.quota.support.QuotaFixtures;

class QuotaCheckerTest {

    private static final String USER_ID = "user-1";

    private OverrideResolver overrideResolver;
    private AssignmentResolver assignmentResolver;
    private InMemoryUsageLedger ledger;
    private QuotaEventRecorder recorder;
    private QuotaChecker checker;
    private QuotaUser user;

    @BeforeEach
    void setUp() {
        overrideResolver = mock(OverrideResolver.class);
        assignmentResolver = mock(AssignmentResolver.class);
        recorder = mock(QuotaEventRecorder.class);
        ledger = new InMemoryUsageLedger();
        user = QuotaUser.of(USER_ID, "alice@example.com", List.of("employee"));

        when(overrideResolver.resolve(anyString(), any())).thenReturn(Optional.empty());

        checker = newChecker(ledger, new QuotaProperties.EnforcementConfig(true, true));
    }

    private QuotaChecker newChecker(UsageLedger usageLedger, QuotaProperties.EnforcementConfig enforcement) {
        QuotaProperties properties = new QuotaProperties(enforcement, null, null, null);
        return new QuotaChecker(overrideResolver, assignmentResolver, usageLedger, recorder,
            properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenTier(QuotaTier tier) {
        when(assignmentResolver.resolve(any())).thenReturn(new ResolvedTier(tier, MatchedBy.DEFAULT, null));
    }

    private void givenOverride(QuotaOverride override) {
        when(overrideResolver.resolve(USER_ID, NOW)).thenReturn(Optional.of(override));
    }

    private QuotaEvent lastEvent() {
        ArgumentCaptor<QuotaEvent> captor = ArgumentCaptor.forClass(QuotaEvent.class);
        verify(recorder, atLeastOnce()).record(captor.capture());
        return captor.getValue();
    }

    // ========== 方案決策 ==========

    @Test
    void shouldWarnWhenSoftLimitReached() {
        // Given: BLOCK 方案月上限 $10，已用 $8.50
        givenTier(QuotaFixtures.blockTier("10.00"));
        ledger.set(USER_ID, MONTHLY_KEY, "8.50");

        // When
        QuotaCheckResult result = checker.checkQuota(user, "session-1", "claude-sonnet", NOW);

        // Then
        assertThat(result.allowed()).isTrue();
        assertThat(result.percentageUsed()).isEqualTo(85.0);
        assertThat(result.warningLevel()).isEqualTo("80%");
        assertThat(result.eventType()).isEqualTo(QuotaEventType.WARNING);
        assertThat(result.notificationType()).isEqualTo(NotificationType.WARNING);
        assertThat(result.remaining()).isEqualByComparingTo("1.50");

        QuotaEvent event = lastEvent();
        assertThat(event.eventType()).isEqualTo(QuotaEventType.WARNING);
        assertThat(event.metadata())
            .containsEntry("sessionId", "session-1")
            .containsEntry("period", MONTHLY_KEY)
            .containsEntry("threshold", "80%");
    }

    @Test
    void shouldBlockWhenMonthlyLimitExceeded() {
        // Given: 已用 $10.50，超過 $10 上限
        givenTier(QuotaFixtures.blockTier("10.00"));
        ledger.set(USER_ID, MONTHLY_KEY, "10.50");

        // When
        QuotaCheckResult result = checker.checkQuota(user, "session-1", null, NOW);

        // Then
        assertThat(result.allowed()).isFalse();
        assertThat(result.remaining()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.eventType()).isEqualTo(QuotaEventType.BLOCK);
        assertThat(result.notificationType()).isEqualTo(NotificationType.EXCEEDED);
        assertThat(result.message()).startsWith("Quota exceeded: $10.50 of $10.00 monthly limit used.");
        assertThat(lastEvent().eventType()).isEqualTo(QuotaEventType.BLOCK);
    }

    @Test
    void shouldBlockAtExactlyOneHundredPercent() {
        givenTier(QuotaFixtures.blockTier("10.00"));
        ledger.set(USER_ID, MONTHLY_KEY, "10.00");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.percentageUsed()).isEqualTo(100.0);
    }

    @Test
    void shouldAllowWithoutEventBelowSoftLimit() {
        givenTier(QuotaFixtures.blockTier("10.00"));
        ledger.set(USER_ID, MONTHLY_KEY, "2.00");

        QuotaCheckResult result = checker.checkQuota(user, "session-1", null, NOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.message()).isEqualTo("Within quota");
        assertThat(result.eventType()).isNull();
        assertThat(result.notificationType()).isEqualTo(NotificationType.NONE);
        verify(recorder, never()).record(any());
    }

    @Test
    void shouldDowngradeWhenThresholdReached() {
        // Given: DOWNGRADE 方案門檻 90%，已用 92%
        givenTier(QuotaFixtures.downgradeTier("10.00", 90.0, "nova-micro"));
        ledger.set(USER_ID, MONTHLY_KEY, "9.20");

        // When
        QuotaCheckResult result = checker.checkQuota(user, "session-1", "claude-sonnet", NOW);

        // Then
        assertThat(result.allowed()).isTrue();
        assertThat(result.downgraded()).isTrue();
        assertThat(result.downgradeModelId()).isEqualTo("nova-micro");
        assertThat(result.originalModelId()).isEqualTo("claude-sonnet");
        assertThat(result.notificationType()).isEqualTo(NotificationType.DOWNGRADE);

        QuotaEvent event = lastEvent();
        assertThat(event.eventType()).isEqualTo(QuotaEventType.DOWNGRADE);
        assertThat(event.metadata())
            .containsEntry("budgetModelId", "nova-micro")
            .containsEntry("originalModelId", "claude-sonnet")
            .containsEntry("threshold", "90%");
    }

    @Test
    void shouldBlockDowngradeTierAtFullLimit() {
        // Given: 降級方案用量達 100%，不再降級而是阻擋
        givenTier(QuotaFixtures.downgradeTier("10.00", 90.0, "nova-micro"));
        ledger.set(USER_ID, MONTHLY_KEY, "10.00");

        QuotaCheckResult result = checker.checkQuota(user, "session-1", "claude-sonnet", NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.downgraded()).isFalse();
        assertThat(result.eventType()).isEqualTo(QuotaEventType.BLOCK);
    }

    @Test
    void shouldNeverBlockWarnTierWithoutOverride() {
        givenTier(QuotaFixtures.tier("pilot", "10.00").actionOnLimit(ActionOnLimit.WARN).build());
        ledger.set(USER_ID, MONTHLY_KEY, "25.00");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.eventType()).isEqualTo(QuotaEventType.WARNING);
        assertThat(result.percentageUsed()).isEqualTo(250.0);
    }

    @Test
    void shouldLetDailyLimitGovernWhenCloserToLimit() {
        // Given: 月度 10%，日 90%
        givenTier(QuotaFixtures.tier("standard", "100.00").dailyCostLimit(new BigDecimal("5.00")).build());
        ledger.set(USER_ID, MONTHLY_KEY, "10.00");
        ledger.set(USER_ID, DAILY_KEY, "4.50");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.governingPeriod()).isEqualTo(PeriodType.DAILY);
        assertThat(result.periodKey()).isEqualTo(DAILY_KEY);
        assertThat(result.percentageUsed()).isEqualTo(90.0);
        assertThat(result.monthlyUsage()).isEqualByComparingTo("10.00");
        assertThat(result.dailyUsage()).isEqualByComparingTo("4.50");
        assertThat(result.warningLevel()).isEqualTo("80%");
    }

    @Test
    void shouldPreferMonthlyWhenPercentagesTie() {
        givenTier(QuotaFixtures.tier("standard", "100.00").dailyCostLimit(new BigDecimal("10.00")).build());
        ledger.set(USER_ID, MONTHLY_KEY, "50.00");
        ledger.set(USER_ID, DAILY_KEY, "5.00");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.governingPeriod()).isEqualTo(PeriodType.MONTHLY);
    }

    @Test
    void shouldBlockWhenLimitIsNotPositive() {
        givenTier(QuotaFixtures.tier("broken", "0").actionOnLimit(ActionOnLimit.WARN).build());

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.percentageUsed()).isEqualTo(100.0);
        assertThat(result.message()).contains("not configured correctly");
    }

    @Test
    void shouldReturnSameDecisionForSameState() {
        givenTier(QuotaFixtures.downgradeTier("10.00", 90.0, "nova-micro"));
        ledger.set(USER_ID, MONTHLY_KEY, "9.50");

        QuotaCheckResult first = checker.evaluate(user, "claude-sonnet", NOW);
        QuotaCheckResult second = checker.evaluate(user, "claude-sonnet", NOW);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldPropagateMissingDefaultTier() {
        when(assignmentResolver.resolve(any())).thenThrow(QuotaNotFoundException.noDefaultTier());

        assertThatThrownBy(() -> checker.checkQuota(user, "session-1", null, NOW))
            .isInstanceOf(QuotaNotFoundException.class);
    }

    // ========== Override ==========

    @Test
    void shouldEnforceCustomDailyLimitOverride() {
        // Given: WARN 方案月上限 $100，override 日上限 $2，今日已用 $2.50
        givenTier(QuotaFixtures.tier("pilot", "100.00").actionOnLimit(ActionOnLimit.WARN).build());
        givenOverride(QuotaFixtures.customLimit("ovr-1", USER_ID, null, "2.00",
            NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(1))));
        ledger.set(USER_ID, DAILY_KEY, "2.50");

        // When
        QuotaCheckResult result = checker.checkQuota(user, "session-1", null, NOW);

        // Then: override 上限是硬上限，即使方案只警告
        assertThat(result.allowed()).isFalse();
        assertThat(result.matchedBy()).isEqualTo(MatchedBy.OVERRIDE);
        assertThat(result.governingPeriod()).isEqualTo(PeriodType.DAILY);
        assertThat(result.message()).contains("daily limit");
        assertThat(result.monthlyLimit()).isNull();
    }

    @Test
    void shouldUseBlockSemanticsWhenOverrideUserHasNoTier() {
        when(assignmentResolver.resolve(any())).thenThrow(QuotaNotFoundException.noDefaultTier());
        givenOverride(QuotaFixtures.customLimit("ovr-1", USER_ID, "20.00", null,
            NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(1))));
        ledger.set(USER_ID, MONTHLY_KEY, "17.00");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.tier()).isNull();
        assertThat(result.warningLevel()).isEqualTo("80%");
    }

    @Test
    void shouldAllowUnlimitedOverrideRegardlessOfUsage() {
        givenOverride(QuotaFixtures.unlimited("ovr-2", USER_ID,
            NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1))));
        ledger.set(USER_ID, MONTHLY_KEY, "500.00");

        QuotaCheckResult result = checker.evaluate(user, null, NOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.matchedBy()).isEqualTo(MatchedBy.OVERRIDE);
        assertThat(result.percentageUsed()).isZero();
        verifyNoInteractions(assignmentResolver);
    }

    @Test
    void shouldRecordOverrideAppliedOncePerMonth() {
        givenOverride(QuotaFixtures.unlimited("ovr-2", USER_ID,
            NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1))));

        checker.checkQuota(user, "session-1", null, NOW);
        checker.checkQuota(user, "session-2", null, NOW);

        ArgumentCaptor<QuotaEvent> captor = ArgumentCaptor.forClass(QuotaEvent.class);
        verify(recorder, times(1)).record(captor.capture());
        assertThat(captor.getValue().eventType()).isEqualTo(QuotaEventType.OVERRIDE_APPLIED);
        assertThat(captor.getValue().metadata())
            .containsEntry("overrideId", "ovr-2")
            .containsEntry("overrideType", "UNLIMITED");
    }

    @Test
    void shouldForgetPreviousMonthWhenOverrideMemoryRollsOver() {
        // Given: 一月已套用兩筆 override
        assertThat(checker.markOverrideApplied("ovr-1", "2026-01")).isTrue();
        assertThat(checker.markOverrideApplied("ovr-2", "2026-01")).isTrue();
        assertThat(checker.markOverrideApplied("ovr-1", "2026-01")).isFalse();

        // When: 進入二月
        boolean firstInFebruary = checker.markOverrideApplied("ovr-1", "2026-02");

        // Then: 只保留當月紀錄
        assertThat(firstInFebruary).isTrue();
        assertThat(checker.appliedOverrideMonths()).isEqualTo(1);
        assertThat(checker.markOverrideApplied("ovr-2", "2026-02")).isTrue();
    }

    // ========== 故障處理 ==========

    @Test
    void shouldFailOpenWhenLedgerUnavailable() {
        UsageLedger broken = mock(UsageLedger.class);
        when(broken.read(anyString(), anyString()))
            .thenThrow(new TransientStoreException("store down", new RuntimeException("timeout")));
        givenTier(QuotaFixtures.blockTier("10.00"));

        QuotaCheckResult result = newChecker(broken, new QuotaProperties.EnforcementConfig(true, true))
            .checkQuota(user, "session-1", null, NOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.degraded()).isTrue();
        verifyNoInteractions(recorder);
    }

    @Test
    void shouldFailClosedWhenConfigured() {
        UsageLedger broken = mock(UsageLedger.class);
        when(broken.read(anyString(), anyString()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        givenTier(QuotaFixtures.blockTier("10.00"));

        QuotaCheckResult result = newChecker(broken, new QuotaProperties.EnforcementConfig(true, false))
            .checkQuota(user, "session-1", null, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.degraded()).isTrue();
        assertThat(result.message()).isEqualTo(QuotaChecker.UNAVAILABLE_MESSAGE);
        assertThat(result.notificationType()).isEqualTo(NotificationType.UNAVAILABLE);
    }

    @Test
    void shouldSkipEverythingWhenEnforcementDisabled() {
        QuotaCheckResult result = newChecker(ledger, new QuotaProperties.EnforcementConfig(false, true))
            .checkQuota(user, "session-1", null, NOW);

        assertThat(result.allowed()).isTrue();
        verifyNoInteractions(assignmentResolver, recorder);
    }

    @Test
    void shouldReturnDecisionEvenWhenEventRecordingFails() {
        givenTier(QuotaFixtures.blockTier("10.00"));
        ledger.set(USER_ID, MONTHLY_KEY, "11.00");
        doThrow(new IllegalStateException("queue broken")).when(recorder).record(any());

        QuotaCheckResult result = checker.checkQuota(user, "session-1", null, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.eventType()).isEqualTo(QuotaEventType.BLOCK);
    }

    // ========== 工具方法 ==========

    @Test
    void shouldComputePercentage() {
        assertThat(QuotaChecker.percentage(new BigDecimal("1"), new BigDecimal("3"))).isEqualTo(33.3333);
        assertThat(QuotaChecker.percentage(BigDecimal.ONE, BigDecimal.ZERO)).isEqualTo(100.0);
        assertThat(QuotaChecker.percentage(BigDecimal.ONE, null)).isEqualTo(100.0);
    }

    @Test
    void shouldFormatPercentage() {
        assertThat(QuotaChecker.formatPercentage(80.0)).isEqualTo("80%");
        assertThat(QuotaChecker.formatPercentage(92.5)).isEqualTo("92.5%");
        assertThat(QuotaChecker.formatPercentage(33.3333)).isEqualTo("33.33%");
    }
}
