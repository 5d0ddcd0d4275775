package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each incremental detection run for observability.
 * Stored in the detection_runs table in ClickHouse.
 */
@Data
@Builder
public class DetectionRun {

    private String runId;           // UUID
    private EntityKind entityKind;
    private LocalDateTime referenceInstant;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | CANCELLED | FAILED
    private int rowsReceived;
    private int rowsAccepted;
    private int rowsRejected;
    private int duplicates;
    private int newlyCrossed;
    private int noticesIssued;
    private int conflicts;
    private String errorMessage;    // null on success
}
