package com.speedwatch.isa.enforcement;

import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.exception.AlertNotFoundException;
import com.speedwatch.isa.exception.IllegalAlertTransitionException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drives each entity's notice through
 * NEW -> NOTICE_SENT -> FOLLOW_UP_DUE -> COMPLIANT | ESCALATED.
 *
 * Every transition is a read, a check of the current status, and one conditional
 * replace in the repository. A concurrent change between the read and the replace
 * surfaces as {@link AlertConflictException}; the alert is left as the other writer
 * committed it. Alerts are never deleted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnforcementLifecycle {

    public static final String SYSTEM_ACTOR = "system";

    private static final DateTimeFormatter NOTE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final AlertRepository repository;
    private final AlertAuditSink auditSink;

    // ── Creation ──────────────────────────────────────────────────────────────

    /**
     * Stage a NEW alert for an entity that crossed the threshold.
     *
     * @throws AlertConflictException when the entity already has an open alert
     */
    public EnforcementAlert createAlert(EntityKind kind, String entityKey, double riskScore, int total,
                                        String reason, String actor, LocalDateTime now) {
        EnforcementAlert alert = EnforcementAlert.builder()
                .entityKind(kind)
                .entityKey(entityKey)
                .status(AlertStatus.NEW)
                .riskScoreAtCreation(riskScore)
                .totalAtCreation(total)
                .reason(reason)
                .createdAt(now)
                .updatedAt(now)
                .notes(note(null, now, actor, "created as NEW", reason))
                .build();

        EnforcementAlert saved = repository.insertIfNoneOpen(alert);
        log.info("Alert {} created for {} {} ({})", saved.getAlertId(), kind, entityKey, reason);
        auditSink.record(saved);
        return saved;
    }

    /**
     * NEW -> NOTICE_SENT. The notice is due after the policy notice period.
     */
    public EnforcementAlert sendNotice(long alertId, PolicyConfiguration policy, String actor, LocalDateTime now) {
        return transition(alertId, AlertStatus.NEW, AlertStatus.NOTICE_SENT, actor, null, now,
                a -> a.setDueDate(now.plus(policy.getNoticePeriod())));
    }

    /**
     * Create and send in one step, for entities reported by a detection run.
     * A second call for an entity whose alert is still open fails with a conflict.
     */
    public EnforcementAlert issueNotice(EntityKind kind, String entityKey, double riskScore, int total,
                                       String reason, PolicyConfiguration policy, String actor, LocalDateTime now) {
        EnforcementAlert created = createAlert(kind, entityKey, riskScore, total, reason, actor, now);
        return sendNotice(created.getAlertId(), policy, actor, now);
    }

    // ── Follow-up and resolution ──────────────────────────────────────────────

    /**
     * NOTICE_SENT -> FOLLOW_UP_DUE, by operator action or because the notice period ran out.
     */
    public EnforcementAlert markFollowUpDue(long alertId, PolicyConfiguration policy, String actor,
                                            String notes, LocalDateTime now) {
        return transition(alertId, AlertStatus.NOTICE_SENT, AlertStatus.FOLLOW_UP_DUE, actor, notes, now,
                a -> a.setDueDate(now.plus(policy.getFollowUpPeriod())));
    }

    /**
     * FOLLOW_UP_DUE -> COMPLIANT once installation of the device is confirmed.
     */
    public EnforcementAlert confirmInstallation(long alertId, String actor, String notes, LocalDateTime now) {
        return transition(alertId, AlertStatus.FOLLOW_UP_DUE, AlertStatus.COMPLIANT, actor, notes, now,
                a -> {
                    a.setResolvedAt(now);
                    a.setDueDate(null);
                });
    }

    /**
     * FOLLOW_UP_DUE -> ESCALATED when the follow-up is ignored. Manual review happens downstream.
     */
    public EnforcementAlert escalate(long alertId, String actor, String notes, LocalDateTime now) {
        return transition(alertId, AlertStatus.FOLLOW_UP_DUE, AlertStatus.ESCALATED, actor, notes, now,
                a -> {
                    a.setResolvedAt(now);
                    a.setDueDate(null);
                });
    }

    /**
     * Move every NOTICE_SENT alert whose due date is at or before {@code now} to
     * FOLLOW_UP_DUE. An alert changed concurrently is skipped and left to the next sweep.
     *
     * @return the alerts moved
     */
    public List<EnforcementAlert> sweepOverdueNotices(PolicyConfiguration policy, LocalDateTime now) {
        List<EnforcementAlert> moved = new ArrayList<>();
        for (EnforcementAlert alert : repository.findByStatus(AlertStatus.NOTICE_SENT)) {
            if (alert.getDueDate() == null || alert.getDueDate().isAfter(now)) continue;
            try {
                moved.add(markFollowUpDue(alert.getAlertId(), policy, SYSTEM_ACTOR, "notice period elapsed", now));
            } catch (AlertConflictException | IllegalAlertTransitionException e) {
                log.warn("Skipping overdue alert {}: {}", alert.getAlertId(), e.getMessage());
            }
        }
        if (!moved.isEmpty()) {
            log.info("Overdue sweep moved {} alerts to FOLLOW_UP_DUE", moved.size());
        }
        return moved;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Optional<EnforcementAlert> findOpen(EntityKind kind, String entityKey) {
        return repository.findOpen(kind, entityKey);
    }

    public EnforcementAlert get(long alertId) {
        return repository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    /** Every alert the entity ever had, oldest first. */
    public List<EnforcementAlert> history(EntityKind kind, String entityKey) {
        return repository.findByEntity(kind, entityKey);
    }

    /** Latest alert of the entity, open or not. */
    public Optional<EnforcementAlert> latest(EntityKind kind, String entityKey) {
        List<EnforcementAlert> all = repository.findByEntity(kind, entityKey);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public List<EnforcementAlert> roster() {
        return repository.findAll();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private EnforcementAlert transition(long alertId, AlertStatus from, AlertStatus to, String actor,
                                        String notes, LocalDateTime now, Consumer<EnforcementAlert> apply) {
        EnforcementAlert current = get(alertId);
        if (current.getStatus() != from) {
            throw new IllegalAlertTransitionException(alertId, current.getStatus(), to);
        }

        EnforcementAlert next = current.toBuilder()
                .status(to)
                .updatedAt(now)
                .notes(note(current.getNotes(), now, actor, from + " -> " + to, notes))
                .build();
        apply.accept(next);

        EnforcementAlert saved = repository.replace(next, from);
        log.info("Alert {} for {} {}: {} -> {}", alertId, saved.getEntityKind(), saved.getEntityKey(), from, to);
        auditSink.record(saved);
        return saved;
    }

    private static String note(String existing, LocalDateTime now, String actor, String change, String detail) {
        String who = (actor == null || actor.isBlank()) ? SYSTEM_ACTOR : actor;
        String line = "[" + NOTE_TIME.format(now) + "] " + who + ": " + change + "."
                + (detail == null || detail.isBlank() ? "" : " " + detail);
        return existing == null || existing.isEmpty() ? line : existing + "\n" + line;
    }
}
