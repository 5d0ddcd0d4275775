package com.speedwatch.isa.scheduler;

import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.enforcement.EnforcementLifecycle;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.output.ClickHouseWriter;
import com.speedwatch.isa.output.OutputRouter;
import com.speedwatch.isa.service.AlertHistoryLoader;
import com.speedwatch.isa.service.DetectionService;
import com.speedwatch.isa.service.ViolationHistoryLoader;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Startup housekeeping and the daily sweep: overdue notices first, then entities
 * that reached REQUIRED without ever having an alert.
 *
 * Default schedule: every day at 06:00 UTC. Override with the
 * isa-engine.scheduling.follow-up-sweep-cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnforcementScheduler {

    private final EnforcementLifecycle lifecycle;
    private final ClickHouseWriter clickHouseWriter;
    private final OutputRouter outputRouter;
    private final ViolationHistoryLoader historyLoader;
    private final AlertHistoryLoader alertHistoryLoader;
    private final DetectionService detectionService;
    private final IsaEngineProperties properties;
    private final PolicyConfiguration policy;
    private final Clock clock;

    /**
     * On application startup:
     *  1. Ensure the ClickHouse schema exists
     *  2. Reload the alert archive, so ids and open alerts carry over
     *  3. Optionally reload the violation archive into the store
     */
    @PostConstruct
    public void onStartup() {
        try {
            clickHouseWriter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise ClickHouse schema (running in CSV-only mode?): {}", e.getMessage());
        }

        if (outputRouter.writesToClickHouse()) {
            try {
                alertHistoryLoader.restoreIntoRepository();
            } catch (Exception e) {
                log.error("Startup alert load failed: {}", e.getMessage(), e);
            }
        }

        if (properties.getScheduling().isLoadHistoryOnStartup() && outputRouter.writesToClickHouse()) {
            try {
                historyLoader.restoreIntoStore();
            } catch (Exception e) {
                log.error("Startup history load failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Engine ready. Overdue sweep schedule: {}", properties.getScheduling().getFollowUpSweepCron());
        }
    }

    /**
     * Move NOTICE_SENT alerts past their due date to FOLLOW_UP_DUE, then open alerts
     * for REQUIRED entities that have none.
     */
    @Scheduled(cron = "${isa-engine.scheduling.follow-up-sweep-cron:0 0 6 * * ?}", zone = "UTC")
    public void sweepOverdueNotices() {
        log.info("Scheduled overdue sweep triggered");
        try {
            List<EnforcementAlert> moved = lifecycle.sweepOverdueNotices(policy, LocalDateTime.now(clock));
            log.info("Overdue sweep done: {} alerts now FOLLOW_UP_DUE", moved.size());
        } catch (Exception e) {
            log.error("Scheduled overdue sweep failed: {}", e.getMessage(), e);
        }

        for (EntityKind kind : EntityKind.values()) {
            try {
                List<EnforcementAlert> opened = detectionService.reconcile(kind, null);
                if (!opened.isEmpty()) {
                    log.info("Reconcile opened {} {} alerts", opened.size(), kind);
                }
            } catch (Exception e) {
                log.error("Scheduled {} reconcile failed: {}", kind, e.getMessage(), e);
            }
        }
    }
}
