package com.speedwatch.isa.engine;

import com.speedwatch.isa.exception.ReferenceInstantMismatchException;
import com.speedwatch.isa.model.DeltaResult;
import com.speedwatch.isa.model.EntityAggregate;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.Tier;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Finds entities that cross into REQUIRED because of an incoming batch.
 *
 * Both passes use one reference instant, the latest occurredAt of the combined
 * (history + incoming) population of the requested kind:
 * <ol>
 *   <li>baseline = aggregate(history, window, ref)</li>
 *   <li>current  = aggregate(history + incoming, window, ref)</li>
 *   <li>newly crossed = REQUIRED in current and not REQUIRED in baseline</li>
 * </ol>
 * Pinning the baseline to the combined population's instant means the comparison only
 * sees the effect of the new records, never a shifted window on one side.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DeltaDetector {

    private final WindowedAggregator aggregator;
    private final ThresholdClassifier classifier;

    public DeltaResult findNewCrossings(Collection<ViolationRecord> history, Collection<ViolationRecord> incoming,
                                        EntityKind kind, PolicyConfiguration policy) {
        int windowMonths = policy.windowMonthsFor(kind);

        // history first, so a history copy wins any duplicate with the batch
        ViolationDeduplicator combinedDedup = new ViolationDeduplicator();
        combinedDedup.offerAll(history);
        combinedDedup.offerAll(incoming);
        List<ViolationRecord> combined = combinedDedup.records();
        List<ViolationRecord> baselinePopulation = ViolationDeduplicator.deduplicate(history);

        LocalDateTime referenceInstant = combined.stream()
                .filter(r -> r.getEntityKind() == kind)
                .map(ViolationRecord::getOccurredAt)
                .filter(Objects::nonNull)
                .max(LocalDateTime::compareTo)
                .orElse(null);

        if (referenceInstant == null) {
            log.info("No {} records in history or batch; nothing to compare", kind);
            return DeltaResult.empty(kind, windowMonths);
        }

        Map<String, EntityAggregate> baseline =
                aggregator.aggregate(baselinePopulation, kind, windowMonths, referenceInstant);
        Map<String, EntityAggregate> current =
                aggregator.aggregate(combined, kind, windowMonths, referenceInstant);

        DeltaResult result = diff(baseline, current, kind, policy);
        log.info("Delta {} at {}: {} required before, {} after, {} newly crossed",
                kind, referenceInstant, result.getBaselineRequired(), result.getCurrentRequired(),
                result.getNewlyCrossed().size());
        return result;
    }

    /**
     * Compare two aggregations of the same kind and window.
     *
     * @throws ReferenceInstantMismatchException when the aggregates were not all computed
     *         against the same reference instant and window length
     */
    public DeltaResult diff(Map<String, EntityAggregate> baseline, Map<String, EntityAggregate> current,
                            EntityKind kind, PolicyConfiguration policy) {
        LocalDateTime ref = null;
        Integer window = null;
        for (EntityAggregate a : concat(baseline.values(), current.values())) {
            if (a.getEntityKind() != kind) {
                throw new ReferenceInstantMismatchException(
                        "Aggregate for " + a.getEntityKey() + " is " + a.getEntityKind() + ", expected " + kind);
            }
            if (ref == null) {
                ref = a.getReferenceInstant();
                window = a.getWindowMonths();
            } else if (!ref.equals(a.getReferenceInstant()) || window != a.getWindowMonths()) {
                throw new ReferenceInstantMismatchException(String.format(
                        "Baseline and current must share one window; found %s/%dm and %s/%dm",
                        ref, window, a.getReferenceInstant(), a.getWindowMonths()));
            }
        }

        TreeSet<String> newlyCrossed = new TreeSet<>();
        Map<String, EntityAggregate> crossedAggregates = new LinkedHashMap<>();
        int baselineRequired = 0;
        int currentRequired = 0;

        for (EntityAggregate a : baseline.values()) {
            if (classifier.classify(a, policy) == Tier.REQUIRED) baselineRequired++;
        }
        for (EntityAggregate a : current.values()) {
            if (classifier.classify(a, policy) != Tier.REQUIRED) continue;
            currentRequired++;
            EntityAggregate before = baseline.get(a.getEntityKey());
            if (before == null || classifier.classify(before, policy) != Tier.REQUIRED) {
                newlyCrossed.add(a.getEntityKey());
            }
        }
        newlyCrossed.forEach(key -> crossedAggregates.put(key, current.get(key)));

        return DeltaResult.builder()
                .entityKind(kind)
                .referenceInstant(ref)
                .windowMonths(window == null ? policy.windowMonthsFor(kind) : window)
                .newlyCrossed(Collections.unmodifiableSortedSet(newlyCrossed))
                .currentAggregates(Collections.unmodifiableMap(crossedAggregates))
                .baselineRequired(baselineRequired)
                .currentRequired(currentRequired)
                .build();
    }

    private static List<EntityAggregate> concat(Collection<EntityAggregate> a, Collection<EntityAggregate> b) {
        List<EntityAggregate> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }
}
