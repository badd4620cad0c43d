package io.github.samzhu.quota.service;

import static io.github.samzhu.quota.support.QuotaFixtures.DAILY_KEY;
import static io.github.samzhu.quota.support.QuotaFixtures.MONTHLY_KEY;
import static io.github.samzhu.quota.support.QuotaFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.quota.config.QuotaProperties;
import io.github.samzhu.quota.model.MatchedBy;
import io.github.samzhu.quota.model.QuotaUser;
import io.github.samzhu.quota.support.InMemoryUsageLedger;
import io.github.samzhu.quota.support.QuotaFixtures;

class QuotaInspectorServiceTest {

    private OverrideResolver overrideResolver;
    private AssignmentResolver assignmentResolver;
    private QuotaEventRecorder recorder;
    private InMemoryUsageLedger ledger;
    private QuotaInspectorService inspector;

    @BeforeEach
    void setUp() {
        overrideResolver = mock(OverrideResolver.class);
        assignmentResolver = mock(AssignmentResolver.class);
        recorder = mock(QuotaEventRecorder.class);
        ledger = new InMemoryUsageLedger();
        when(overrideResolver.resolve(anyString(), any())).thenReturn(Optional.empty());
        when(assignmentResolver.resolve(any()))
            .thenReturn(new ResolvedTier(QuotaFixtures.blockTier("10.00"), MatchedBy.JWT_ROLE,
                QuotaFixtures.role("a-1", "engineer", "standard", 100)));

        QuotaChecker checker = new QuotaChecker(overrideResolver, assignmentResolver, ledger, recorder,
            QuotaProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
        inspector = new QuotaInspectorService(checker, assignmentResolver, ledger);
    }

    @Test
    void shouldExplainDecisionWithoutRecordingEvents() {
        // Given: 月度已超過上限
        ledger.set("user-1", MONTHLY_KEY, "12.00");
        ledger.set("user-1", DAILY_KEY, "3.00");

        // When
        QuotaInspection inspection = inspector.inspect(QuotaUser.of("user-1", null, List.of("engineer")), NOW);

        // Then
        assertThat(inspection.decision().allowed()).isFalse();
        assertThat(inspection.assignment().matchedBy()).isEqualTo(MatchedBy.JWT_ROLE);
        assertThat(inspection.monthlyUsage()).isEqualByComparingTo("12.00");
        assertThat(inspection.dailyUsage()).isEqualByComparingTo("3.00");
        verifyNoInteractions(recorder);
    }

    @Test
    void shouldShowTierAssignmentBehindActiveOverride() {
        when(overrideResolver.resolve("user-1", NOW)).thenReturn(Optional.of(QuotaFixtures.unlimited("ovr-1",
            "user-1", NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(1)))));
        ledger.set("user-1", MONTHLY_KEY, "50.00");

        QuotaInspection inspection = inspector.inspect(QuotaUser.of("user-1", null, null), NOW);

        assertThat(inspection.decision().matchedBy()).isEqualTo(MatchedBy.OVERRIDE);
        assertThat(inspection.assignment().tier().tierId()).isEqualTo("standard");
        assertThat(inspection.monthlyUsage()).isEqualByComparingTo("50.00");
    }
}
