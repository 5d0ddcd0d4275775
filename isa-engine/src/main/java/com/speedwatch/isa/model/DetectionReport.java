package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one incremental detection run.
 */
@Value
@Builder
public class DetectionReport {

    DetectionRun run;

    DeduplicationReport ingest;

    DeltaResult delta;

    /** Alerts opened by this run, in entity key order. */
    @Singular
    List<EnforcementAlert> issuedAlerts;

    /** Newly crossed entities that already had an open alert. */
    @Singular
    List<String> conflicts;
}
