package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.SortedSet;

/**
 * One row of the classified roster handed to the presentation layer.
 */
@Value
@Builder
public class RosterEntry {

    String entityKey;
    EntityKind entityKind;
    Tier tier;
    boolean superSpeeder;
    int total;
    int violationCount;
    int severeCount;
    int remainingToThreshold;
    String reason;
    double riskScore;
    RiskLevel riskLevel;
    LocalDateTime firstViolation;
    LocalDateTime lastViolation;
    SortedSet<String> jurisdictions;

    /** Status of the entity's latest alert, or null when it never had one. */
    AlertStatus enforcementStatus;

    LocalDateTime enforcementDueDate;
}
