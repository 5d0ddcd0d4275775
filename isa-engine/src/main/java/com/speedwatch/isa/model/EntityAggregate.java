package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.SortedSet;

/**
 * Windowed totals for one entity at one reference instant.
 * Always derived from a record population, never updated in place.
 */
@Value
@Builder
public class EntityAggregate {

    String entityKey;

    EntityKind entityKind;

    int windowMonths;

    LocalDateTime referenceInstant;

    /** Sum of points (DRIVER) or count of tickets (VEHICLE). */
    int total;

    int violationCount;

    LocalDateTime firstViolation;

    LocalDateTime lastViolation;

    SortedSet<String> distinctJurisdictions;

    /** Violations in the SEVERE code tier. */
    int severeCount;
}
