package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.EntityAggregate;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-entity totals inside a trailing window.
 *
 * A record counts when it is of the requested kind, its disposition is sustained, and
 * {@code ref - windowMonths <= occurredAt <= ref}. Drivers sum points, vehicles count
 * tickets. The reference instant is always supplied by the caller, never "now", so two
 * aggregations meant to be compared can be pinned to the same window.
 *
 * Aggregation is a pure function of (records, kind, window, reference instant): the
 * same inputs always produce equal results, and concurrent calls share no state.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WindowedAggregator {

    private final ViolationStore store;

    /**
     * Aggregate the current store snapshot.
     */
    public Map<String, EntityAggregate> aggregate(EntityKind kind, int windowMonths, LocalDateTime referenceInstant) {
        return aggregate(store.snapshot(), kind, windowMonths, referenceInstant);
    }

    /**
     * Aggregate an explicit record population.
     *
     * @return entity key to aggregate, sorted by key; entities with no counted record
     *         in the window are absent
     */
    public Map<String, EntityAggregate> aggregate(Collection<ViolationRecord> records, EntityKind kind,
                                                  int windowMonths, LocalDateTime referenceInstant) {
        Map<String, List<ViolationRecord>> grouped = countedByEntity(records, kind, windowMonths, referenceInstant);

        Map<String, EntityAggregate> result = new TreeMap<>();
        grouped.forEach((key, entityRecords) ->
                result.put(key, summarise(key, kind, windowMonths, referenceInstant, entityRecords)));

        log.debug("Aggregated {} {} entities over {} months ending {}",
                result.size(), kind, windowMonths, referenceInstant);
        return Collections.unmodifiableMap(result);
    }

    /**
     * The counted records of each entity, grouped by entity key (sorted) and ordered
     * newest first within an entity.
     */
    public Map<String, List<ViolationRecord>> countedByEntity(Collection<ViolationRecord> records, EntityKind kind,
                                                              int windowMonths, LocalDateTime referenceInstant) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(referenceInstant, "referenceInstant");
        if (windowMonths <= 0) {
            throw new IllegalArgumentException("windowMonths must be > 0, was " + windowMonths);
        }
        LocalDateTime windowStart = windowStart(referenceInstant, windowMonths);

        Map<String, List<ViolationRecord>> grouped = new TreeMap<>();
        for (ViolationRecord r : records) {
            if (counts(r, kind, windowStart, referenceInstant)) {
                grouped.computeIfAbsent(r.getEntityKey(), k -> new ArrayList<>()).add(r);
            }
        }
        Map<String, List<ViolationRecord>> ordered = new LinkedHashMap<>();
        grouped.forEach((key, list) -> {
            list.sort(Comparator.comparing(ViolationRecord::getOccurredAt).reversed()
                    .thenComparing(ViolationRecord::getSequence));
            ordered.put(key, Collections.unmodifiableList(list));
        });
        return ordered;
    }

    /** Inclusive lower bound of the window ending at {@code referenceInstant}. */
    public static LocalDateTime windowStart(LocalDateTime referenceInstant, int windowMonths) {
        return referenceInstant.minusMonths(windowMonths);
    }

    static boolean counts(ViolationRecord r, EntityKind kind, LocalDateTime windowStart, LocalDateTime referenceInstant) {
        return r.getEntityKind() == kind
                && r.isSustained()
                && r.getOccurredAt() != null
                && !r.getOccurredAt().isBefore(windowStart)
                && !r.getOccurredAt().isAfter(referenceInstant);
    }

    private EntityAggregate summarise(String key, EntityKind kind, int windowMonths,
                                      LocalDateTime referenceInstant, List<ViolationRecord> records) {
        int points = 0;
        int severe = 0;
        LocalDateTime first = null;
        LocalDateTime last = null;
        TreeSet<String> jurisdictions = new TreeSet<>();

        for (ViolationRecord r : records) {
            points += r.getPoints();
            if (r.getSeverity() != null && r.getSeverity().isHighest()) severe++;
            if (first == null || r.getOccurredAt().isBefore(first)) first = r.getOccurredAt();
            if (last == null || r.getOccurredAt().isAfter(last)) last = r.getOccurredAt();
            if (r.getJurisdiction() != null) jurisdictions.add(r.getJurisdiction());
        }

        return EntityAggregate.builder()
                .entityKey(key)
                .entityKind(kind)
                .windowMonths(windowMonths)
                .referenceInstant(referenceInstant)
                .total(kind == EntityKind.DRIVER ? points : records.size())
                .violationCount(records.size())
                .firstViolation(first)
                .lastViolation(last)
                .distinctJurisdictions(Collections.unmodifiableSortedSet(jurisdictions))
                .severeCount(severe)
                .build();
    }
}
