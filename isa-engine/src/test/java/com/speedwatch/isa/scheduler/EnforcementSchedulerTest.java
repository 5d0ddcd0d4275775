package com.speedwatch.isa.scheduler;

import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.enforcement.EnforcementLifecycle;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.output.ClickHouseWriter;
import com.speedwatch.isa.output.OutputRouter;
import com.speedwatch.isa.service.AlertHistoryLoader;
import com.speedwatch.isa.service.DetectionService;
import com.speedwatch.isa.service.ViolationHistoryLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EnforcementSchedulerTest {

    private final PolicyConfiguration policy = PolicyConfiguration.defaults();
    private EnforcementLifecycle lifecycle;
    private ClickHouseWriter clickHouseWriter;
    private OutputRouter outputRouter;
    private ViolationHistoryLoader historyLoader;
    private AlertHistoryLoader alertHistoryLoader;
    private DetectionService detectionService;
    private IsaEngineProperties properties;
    private EnforcementScheduler scheduler;

    @BeforeEach
    void setUp() {
        lifecycle = mock(EnforcementLifecycle.class);
        clickHouseWriter = mock(ClickHouseWriter.class);
        outputRouter = mock(OutputRouter.class);
        historyLoader = mock(ViolationHistoryLoader.class);
        alertHistoryLoader = mock(AlertHistoryLoader.class);
        detectionService = mock(DetectionService.class);
        properties = new IsaEngineProperties();
        scheduler = new EnforcementScheduler(lifecycle, clickHouseWriter, outputRouter, historyLoader,
                alertHistoryLoader, detectionService, properties, policy, Clock.fixed(Instant.parse("2024-07-15T06:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should start without ClickHouse and skip the history load by default")
    void startupWithoutClickHouse() {
        doThrow(new DataAccessResourceFailureException("no server")).when(clickHouseWriter).ensureSchema();

        assertThatCode(scheduler::onStartup).doesNotThrowAnyException();
        verify(historyLoader, never()).restoreIntoStore();
        verify(alertHistoryLoader, never()).restoreIntoRepository();
    }

    @Test
    @DisplayName("should reload alerts whenever archiving to ClickHouse, even without the history flag")
    void startupLoadsAlerts() {
        when(outputRouter.writesToClickHouse()).thenReturn(true);

        scheduler.onStartup();

        verify(alertHistoryLoader).restoreIntoRepository();
        verify(historyLoader, never()).restoreIntoStore();
    }

    @Test
    @DisplayName("should still load violations when the alert reload fails")
    void alertLoadFailure() {
        properties.getScheduling().setLoadHistoryOnStartup(true);
        when(outputRouter.writesToClickHouse()).thenReturn(true);
        when(alertHistoryLoader.restoreIntoRepository()).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(scheduler::onStartup).doesNotThrowAnyException();
        verify(historyLoader).restoreIntoStore();
    }

    @Test
    @DisplayName("should reload history when enabled and archiving to ClickHouse")
    void startupLoadsHistory() {
        properties.getScheduling().setLoadHistoryOnStartup(true);
        when(outputRouter.writesToClickHouse()).thenReturn(true);

        scheduler.onStartup();

        verify(clickHouseWriter).ensureSchema();
        verify(historyLoader).restoreIntoStore();
    }

    @Test
    @DisplayName("should sweep with the clock's current time and survive a failure")
    void sweep() {
        scheduler.sweepOverdueNotices();
        verify(lifecycle).sweepOverdueNotices(policy, LocalDateTime.of(2024, 7, 15, 6, 0));

        when(lifecycle.sweepOverdueNotices(any(), any())).thenThrow(new IllegalStateException("boom"));
        assertThatCode(scheduler::sweepOverdueNotices).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should reconcile both entity kinds after the sweep, even if one fails")
    void reconcileAfterSweep() {
        when(detectionService.reconcile(EntityKind.DRIVER, null)).thenThrow(new IllegalStateException("boom"));

        assertThatCode(scheduler::sweepOverdueNotices).doesNotThrowAnyException();

        verify(detectionService).reconcile(EntityKind.DRIVER, null);
        verify(detectionService).reconcile(EntityKind.VEHICLE, null);
    }
}
