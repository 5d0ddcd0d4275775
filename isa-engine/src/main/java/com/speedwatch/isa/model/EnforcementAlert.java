package com.speedwatch.isa.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Notice lifecycle of one entity.
 *
 * Instances handed out by the alert repository are copies; a change only takes
 * effect through a conditional replace, so a reader never sees a half-applied transition.
 * Alerts are never deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnforcementAlert {

    private long alertId;

    /** 1 when created, incremented by each transition. The archive keeps every version. */
    private long version;

    private String entityKey;

    private EntityKind entityKind;

    private AlertStatus status;

    private double riskScoreAtCreation;

    /** Points or tickets in the window when the alert was created. */
    private int totalAtCreation;

    /** Why the entity was flagged, e.g. "12 points (threshold: 11)". */
    private String reason;

    private LocalDateTime createdAt;

    /** End of the notice or follow-up period; null once terminal. */
    private LocalDateTime dueDate;

    private LocalDateTime resolvedAt;

    private LocalDateTime updatedAt;

    /** Append-only transition log, one line per transition. */
    private String notes;
}
