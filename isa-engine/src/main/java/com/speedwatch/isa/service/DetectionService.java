package com.speedwatch.isa.service;

import com.speedwatch.isa.enforcement.EnforcementLifecycle;
import com.speedwatch.isa.engine.DeltaDetector;
import com.speedwatch.isa.engine.RiskScorer;
import com.speedwatch.isa.engine.ThresholdClassifier;
import com.speedwatch.isa.engine.ViolationDeduplicator;
import com.speedwatch.isa.engine.ViolationRecordMapper;
import com.speedwatch.isa.engine.ViolationStore;
import com.speedwatch.isa.engine.WindowedAggregator;
import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.Classification;
import com.speedwatch.isa.model.DeduplicationReport;
import com.speedwatch.isa.model.DeltaResult;
import com.speedwatch.isa.model.DetectionReport;
import com.speedwatch.isa.model.DetectionRun;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityAggregate;
import com.speedwatch.isa.model.EntityDetail;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.ImpactMetrics;
import com.speedwatch.isa.model.JurisdictionStats;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.RiskLevel;
import com.speedwatch.isa.model.RosterEntry;
import com.speedwatch.isa.model.SeverityTier;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.Tier;
import com.speedwatch.isa.model.ViolationRecord;
import com.speedwatch.isa.output.CsvWriter;
import com.speedwatch.isa.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates ingestion, incremental detection and the classified roster.
 *
 * A detection run:
 *  1. validates the incoming rows, rejecting rows of the other entity kind
 *  2. under the store's write lock, runs the delta detector on history + batch and
 *     appends the batch, so concurrent runs see each other's rows
 *  3. archives the new records
 *  4. opens a notice for each newly crossed entity, stopping early if interrupted
 *
 * Rows stored by a plain ingest are never examined by a run; {@link #reconcile} opens
 * alerts for the REQUIRED entities among them.
 *
 * The engine components stay pure; this class owns the clock, the policy in force and
 * the side effects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetectionService {

    static final Comparator<RosterEntry> ROSTER_ORDER = Comparator
            .comparing(RosterEntry::getTier, Comparator.reverseOrder())
            .thenComparing(RosterEntry::getTotal, Comparator.reverseOrder())
            .thenComparing(RosterEntry::getEntityKey);

    private final ViolationStore store;
    private final WindowedAggregator aggregator;
    private final ThresholdClassifier classifier;
    private final RiskScorer riskScorer;
    private final DeltaDetector deltaDetector;
    private final EnforcementLifecycle lifecycle;
    private final NoticeDispatchClient noticeClient;
    private final OutputRouter outputRouter;
    private final CsvWriter csvWriter;
    private final PolicyConfiguration policy;
    private final Clock clock;

    // ── Ingestion ─────────────────────────────────────────────────────────────

    /**
     * Validate, deduplicate and store rows without running detection.
     */
    public DeduplicationReport ingest(List<RawViolationRow> rows, SourceType defaultSource) {
        ViolationStore.AppendResult result = store.append(store.prepare(rows, defaultSource));
        outputRouter.writeViolations(result.added(), "ingest_" + timestampLabel());
        return result.report();
    }

    // ── Detection runs ────────────────────────────────────────────────────────

    /**
     * Ingest a batch and open notices for the entities of {@code kind} it pushed over
     * the threshold.
     */
    public DetectionReport detectNewCrossings(EntityKind kind, List<RawViolationRow> incoming,
                                              SourceType defaultSource) {
        DetectionRun run = DetectionRun.builder()
                .runId(UUID.randomUUID().toString())
                .entityKind(kind)
                .startedAt(now())
                .status("RUNNING")
                .build();
        log.info("Detection run {} started: {} {} rows", run.getRunId(), incoming.size(), kind);

        DetectionReport.DetectionReportBuilder report = DetectionReport.builder().run(run);
        try {
            ViolationStore.PreparedBatch batch = store.prepare(incoming, defaultSource, kind);
            ViolationStore.InspectedAppend<DeltaResult> inspected = store.inspectAndAppend(batch,
                    stored -> deltaDetector.findNewCrossings(stored, batch.records(), kind, policy));
            List<ViolationRecord> history = inspected.history();

            DeltaResult delta = inspected.inspection();
            run.setReferenceInstant(delta.getReferenceInstant());
            run.setNewlyCrossed(delta.getNewlyCrossed().size());
            report.delta(delta);

            ViolationStore.AppendResult appended = inspected.appended();
            DeduplicationReport ingest = appended.report();
            run.setRowsReceived(ingest.getReceived());
            run.setRowsAccepted(ingest.getAccepted());
            run.setRowsRejected(ingest.getRejected());
            run.setDuplicates(ingest.getDuplicates());
            report.ingest(ingest);
            outputRouter.writeViolations(appended.added(), run.getRunId());

            if (!delta.getNewlyCrossed().isEmpty()) {
                Map<String, List<ViolationRecord>> windowed = windowedViolations(history, batch.records(), delta);
                if (!issueNotices(delta, windowed, report, run)) {
                    run.setStatus("CANCELLED");
                    log.warn("Detection run {} interrupted after {} notices", run.getRunId(), run.getNoticesIssued());
                    return report.build();
                }
            }

            run.setStatus("SUCCESS");
            log.info("Detection run {} complete: {} newly crossed, {} notices, {} conflicts",
                    run.getRunId(), run.getNewlyCrossed(), run.getNoticesIssued(), run.getConflicts());
            return report.build();

        } catch (Exception e) {
            log.error("Detection run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(now());
            outputRouter.writeDetectionRun(run);
        }
    }

    /**
     * Open a NEW alert for each REQUIRED entity that has never had one. Covers rows that
     * arrived through {@link #ingest} and entities classified for the first time after
     * a restart. The alerts are staged only; sending the notice stays a separate step.
     */
    public List<EnforcementAlert> reconcile(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        List<EnforcementAlert> opened = new ArrayList<>();
        for (RosterEntry entry : buildRoster(kind, ref)) {
            if (entry.getTier() != Tier.REQUIRED) break;
            if (!lifecycle.history(kind, entry.getEntityKey()).isEmpty()) continue;
            try {
                opened.add(lifecycle.createAlert(kind, entry.getEntityKey(), entry.getRiskScore(),
                        entry.getTotal(), entry.getReason(), EnforcementLifecycle.SYSTEM_ACTOR, now()));
            } catch (AlertConflictException e) {
                log.warn("Reconcile skipped {} {}: {}", kind, entry.getEntityKey(), e.getMessage());
            }
        }
        log.info("Reconcile {} at {}: {} alerts opened", kind, ref, opened.size());
        return opened;
    }

    // ── Roster ────────────────────────────────────────────────────────────────

    /**
     * Classified roster of every entity with counted violations in the window ending
     * at {@code referenceInstant} (latest stored violation when null), REQUIRED first.
     */
    public List<RosterEntry> buildRoster(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        int window = policy.windowMonthsFor(kind);
        List<ViolationRecord> snapshot = store.snapshot();
        Map<String, List<ViolationRecord>> grouped = aggregator.countedByEntity(snapshot, kind, window, ref);
        Map<String, EntityAggregate> aggregates = aggregator.aggregate(snapshot, kind, window, ref);

        List<RosterEntry> roster = new ArrayList<>(aggregates.size());
        aggregates.forEach((key, aggregate) ->
                roster.add(toEntry(aggregate, grouped.getOrDefault(key, List.of()))));
        roster.sort(ROSTER_ORDER);

        log.info("Roster {} at {}: {} entities, {} required",
                kind, ref, roster.size(), roster.stream().filter(e -> e.getTier() == Tier.REQUIRED).count());
        return roster;
    }

    /**
     * Counts per tier and the policy in force, for dashboards.
     */
    public Map<String, Object> summarize(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        List<RosterEntry> roster = buildRoster(kind, ref);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("entityKind", kind);
        summary.put("referenceInstant", ref);
        summary.put("windowMonths", policy.windowMonthsFor(kind));
        summary.put("threshold", policy.thresholdFor(kind));
        summary.put("warningBand", policy.warningBandFor(kind).toString());
        summary.put("recordsInStore", store.size());
        summary.put("entities", roster.size());
        for (Tier tier : Tier.values()) {
            summary.put(tier.name().toLowerCase(Locale.ROOT),
                    roster.stream().filter(e -> e.getTier() == tier).count());
        }
        summary.put("superSpeeders", roster.stream().filter(RosterEntry::isSuperSpeeder).count());
        summary.put("openAlerts", lifecycle.roster().stream()
                .filter(a -> a.getEntityKind() == kind && a.getStatus().isOpen())
                .count());

        List<JurisdictionStats> jurisdictions = jurisdictionStats(kind, ref);
        summary.put("severeViolations", jurisdictions.stream().mapToInt(JurisdictionStats::getSevere).sum());
        summary.put("nighttimeViolations", jurisdictions.stream().mapToInt(JurisdictionStats::getNighttime).sum());
        summary.put("crossJurisdictionOffenders", roster.stream().filter(DetectionService::isCrossJurisdiction).count());
        summary.put("isaCompliant", countCompliant(kind));
        return summary;
    }

    /**
     * Severity and nighttime breakdown of counted violations per jurisdiction, busiest first.
     * Violations without a jurisdiction are grouped under {@link JurisdictionStats#UNKNOWN}.
     */
    public List<JurisdictionStats> jurisdictionStats(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        Map<String, List<ViolationRecord>> byJurisdiction = new LinkedHashMap<>();
        aggregator.countedByEntity(store.snapshot(), kind, policy.windowMonthsFor(kind), ref).values().stream()
                .flatMap(List::stream)
                .forEach(r -> byJurisdiction
                        .computeIfAbsent(r.getJurisdiction() == null ? JurisdictionStats.UNKNOWN : r.getJurisdiction(),
                                j -> new ArrayList<>())
                        .add(r));

        List<JurisdictionStats> stats = new ArrayList<>(byJurisdiction.size());
        byJurisdiction.forEach((jurisdiction, violations) -> {
            int total = violations.size();
            int severe = (int) violations.stream().filter(r -> r.getSeverity() == SeverityTier.SEVERE).count();
            int high = (int) violations.stream()
                    .filter(r -> r.getSeverity() != null && r.getSeverity().compareTo(SeverityTier.HIGH) >= 0)
                    .count();
            int night = (int) violations.stream()
                    .filter(r -> r.getOccurredAt() != null && policy.isNighttime(r.getOccurredAt().toLocalTime()))
                    .count();
            stats.add(JurisdictionStats.builder()
                    .jurisdiction(jurisdiction)
                    .totalViolations(total)
                    .severe(severe)
                    .highSeverity(high)
                    .nighttime(night)
                    .severePercent(percent(severe, total))
                    .nighttimePercent(percent(night, total))
                    .build());
        });
        stats.sort(Comparator.comparing(JurisdictionStats::getTotalViolations, Comparator.reverseOrder())
                .thenComparing(JurisdictionStats::getJurisdiction));
        return stats;
    }

    /**
     * Roster entities seen in more than one jurisdiction, most jurisdictions first.
     */
    public List<RosterEntry> crossJurisdictionOffenders(EntityKind kind, LocalDateTime referenceInstant) {
        return buildRoster(kind, referenceInstant).stream()
                .filter(DetectionService::isCrossJurisdiction)
                .sorted(Comparator.comparing((RosterEntry e) -> e.getJurisdictions().size(), Comparator.reverseOrder())
                        .thenComparing(RosterEntry::getTotal, Comparator.reverseOrder())
                        .thenComparing(RosterEntry::getEntityKey))
                .toList();
    }

    public ImpactMetrics impactMetrics(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        List<RosterEntry> roster = buildRoster(kind, ref);
        int severe = jurisdictionStats(kind, ref).stream().mapToInt(JurisdictionStats::getSevere).sum();
        int pending = (int) roster.stream()
                .filter(e -> e.getTier() == Tier.REQUIRED)
                .filter(e -> e.getEnforcementStatus() == null
                        || e.getEnforcementStatus() == AlertStatus.NEW
                        || e.getEnforcementStatus() == AlertStatus.NOTICE_SENT)
                .count();
        int crossJurisdiction = (int) roster.stream().filter(DetectionService::isCrossJurisdiction).count();
        return ImpactMetrics.of(kind, ref, severe, pending, crossJurisdiction, countCompliant(kind));
    }

    /**
     * One entity's classification with the violations behind it and its alert history.
     *
     * @return empty when the entity has no counted violation in the window
     */
    public Optional<EntityDetail> entityDetail(EntityKind kind, String entityKey, LocalDateTime referenceInstant) {
        String key = normaliseKey(kind, entityKey);
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        int window = policy.windowMonthsFor(kind);

        List<ViolationRecord> own = store.snapshot(kind).stream()
                .filter(r -> key.equals(r.getEntityKey()))
                .toList();
        Map<String, List<ViolationRecord>> grouped = aggregator.countedByEntity(own, kind, window, ref);
        EntityAggregate aggregate = aggregator.aggregate(own, kind, window, ref).get(key);
        if (aggregate == null) {
            return Optional.empty();
        }

        return Optional.of(EntityDetail.builder()
                .entry(toEntry(aggregate, grouped.get(key)))
                .violations(grouped.get(key))
                .alerts(lifecycle.history(kind, key))
                .build());
    }

    /**
     * Detail of every roster entity at or above {@code minimumTier}, in roster order.
     */
    public List<EntityDetail> details(EntityKind kind, LocalDateTime referenceInstant, Tier minimumTier) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        List<EntityDetail> details = new ArrayList<>();
        for (RosterEntry entry : buildRoster(kind, ref)) {
            if (entry.getTier().compareTo(minimumTier) < 0) continue;
            entityDetail(kind, entry.getEntityKey(), ref).ifPresent(details::add);
        }
        return details;
    }

    /**
     * Write the roster and the REQUIRED detail export to the configured output directory.
     *
     * @return export name ("roster", "detail") to written file
     */
    public Map<String, Path> exportFiles(EntityKind kind, LocalDateTime referenceInstant) {
        LocalDateTime ref = resolveReference(kind, referenceInstant);
        Map<String, Path> written = new LinkedHashMap<>();
        written.put("roster", csvWriter.writeRoster(buildRoster(kind, ref), kind, ref));
        written.put("detail", csvWriter.writeDetail(details(kind, ref, Tier.REQUIRED), kind, ref));
        return written;
    }

    /**
     * Latest violation time of {@code kind} in the store, or now when it holds none.
     */
    public LocalDateTime resolveReference(EntityKind kind, LocalDateTime referenceInstant) {
        if (referenceInstant != null) {
            return referenceInstant;
        }
        return store.snapshot(kind).stream()
                .map(ViolationRecord::getOccurredAt)
                .filter(Objects::nonNull)
                .max(LocalDateTime::compareTo)
                .orElseGet(this::now);
    }

    public PolicyConfiguration policy() {
        return policy;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * @return false when the thread was interrupted before every entity was handled
     */
    private boolean issueNotices(DeltaResult delta, Map<String, List<ViolationRecord>> windowed,
                                 DetectionReport.DetectionReportBuilder report, DetectionRun run) {
        for (String key : delta.getNewlyCrossed()) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }

            EntityAggregate aggregate = delta.getCurrentAggregates().get(key);
            Classification classification = classifier.assess(aggregate, policy);
            double risk = riskScorer.score(key, windowed.getOrDefault(key, List.of()), policy);

            try {
                EnforcementAlert alert = lifecycle.issueNotice(delta.getEntityKind(), key, risk,
                        aggregate.getTotal(), classification.getReason(), policy,
                        EnforcementLifecycle.SYSTEM_ACTOR, now());
                report.issuedAlert(alert);
                run.setNoticesIssued(run.getNoticesIssued() + 1);
                dispatch(alert);
            } catch (AlertConflictException e) {
                log.warn("Skipping notice for {} {}: {}", delta.getEntityKind(), key, e.getMessage());
                report.conflict(key);
                run.setConflicts(run.getConflicts() + 1);
            }
        }
        return true;
    }

    private void dispatch(EnforcementAlert alert) {
        if (!noticeClient.isEnabled()) return;
        try {
            noticeClient.send(alert);
        } catch (Exception e) {
            log.warn("Alert {} stays {} without delivery: {}", alert.getAlertId(), alert.getStatus(), e.getMessage());
        }
    }

    private Map<String, List<ViolationRecord>> windowedViolations(List<ViolationRecord> history,
                                                                  List<ViolationRecord> incoming,
                                                                  DeltaResult delta) {
        List<ViolationRecord> combined = new ArrayList<>(history);
        combined.addAll(incoming);
        return aggregator.countedByEntity(ViolationDeduplicator.deduplicate(combined),
                delta.getEntityKind(), delta.getWindowMonths(), delta.getReferenceInstant());
    }

    private RosterEntry toEntry(EntityAggregate aggregate, List<ViolationRecord> violations) {
        Classification classification = classifier.assess(aggregate, policy);
        double risk = riskScorer.score(aggregate.getEntityKey(), violations, policy);
        Optional<EnforcementAlert> alert = lifecycle.latest(aggregate.getEntityKind(), aggregate.getEntityKey());

        return RosterEntry.builder()
                .entityKey(aggregate.getEntityKey())
                .entityKind(aggregate.getEntityKind())
                .tier(classification.getTier())
                .superSpeeder(classification.isSuperSpeeder())
                .total(aggregate.getTotal())
                .violationCount(aggregate.getViolationCount())
                .severeCount(aggregate.getSevereCount())
                .remainingToThreshold(classification.getRemainingToThreshold())
                .reason(classification.getReason())
                .riskScore(risk)
                .riskLevel(RiskLevel.fromScore(risk))
                .firstViolation(aggregate.getFirstViolation())
                .lastViolation(aggregate.getLastViolation())
                .jurisdictions(aggregate.getDistinctJurisdictions())
                .enforcementStatus(alert.map(EnforcementAlert::getStatus).orElse(null))
                .enforcementDueDate(alert.map(EnforcementAlert::getDueDate).orElse(null))
                .build();
    }

    private int countCompliant(EntityKind kind) {
        return (int) lifecycle.roster().stream()
                .filter(a -> a.getEntityKind() == kind && a.getStatus() == AlertStatus.COMPLIANT)
                .count();
    }

    private static boolean isCrossJurisdiction(RosterEntry entry) {
        return entry.getJurisdictions() != null && entry.getJurisdictions().size() > 1;
    }

    private static double percent(int part, int total) {
        return total == 0 ? 0.0 : Math.round(part * 1000.0 / total) / 10.0;
    }

    /** Stored keys are upper-cased; vehicle plates also lose their spaces. */
    static String normaliseKey(EntityKind kind, String entityKey) {
        int colon = entityKey.lastIndexOf(':');
        if (kind == EntityKind.VEHICLE && colon > 0) {
            return ViolationRecordMapper.vehicleKey(entityKey.substring(0, colon), entityKey.substring(colon + 1));
        }
        return entityKey.trim().toUpperCase(Locale.ROOT);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private String timestampLabel() {
        return now().toString().replace(":", "").replace("-", "");
    }
}
