package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

/**
 * Counted violations of one jurisdiction inside the lookback window.
 * Percentages are of the jurisdiction's total, to one decimal.
 */
@Value
@Builder
public class JurisdictionStats {

    public static final String UNKNOWN = "UNKNOWN";

    String jurisdiction;

    int totalViolations;

    /** SEVERE code tier only. */
    int severe;

    /** HIGH or SEVERE code tier. */
    int highSeverity;

    int nighttime;

    double severePercent;

    double nighttimePercent;
}
