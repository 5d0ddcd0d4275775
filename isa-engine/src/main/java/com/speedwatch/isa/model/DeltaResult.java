package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Entities that crossed into REQUIRED because of an incoming batch.
 */
@Value
@Builder
public class DeltaResult {

    EntityKind entityKind;

    /** Latest occurredAt of the combined population; null when it was empty. */
    LocalDateTime referenceInstant;

    int windowMonths;

    /** Sorted entity keys that are REQUIRED now and were not before the batch. */
    Set<String> newlyCrossed;

    /** Current (history + incoming) aggregates of the newly crossed entities. */
    Map<String, EntityAggregate> currentAggregates;

    int baselineRequired;

    int currentRequired;

    public static DeltaResult empty(EntityKind kind, int windowMonths) {
        return DeltaResult.builder()
                .entityKind(kind)
                .windowMonths(windowMonths)
                .newlyCrossed(Set.of())
                .currentAggregates(Map.of())
                .build();
    }
}
