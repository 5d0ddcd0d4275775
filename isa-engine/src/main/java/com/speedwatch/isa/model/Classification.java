package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

/**
 * Tier of an aggregate plus the signals that travel with it.
 *
 * superSpeeder is a separate signal from the tier: a driver with any SEVERE-tier
 * violation in the window is designated even when the point total is below threshold.
 */
@Value
@Builder
public class Classification {

    Tier tier;

    boolean superSpeeder;

    /** Points or tickets still missing to reach the threshold; 0 once REQUIRED. */
    int remainingToThreshold;

    /** Human-readable trigger, e.g. "12 points (threshold: 11)". Null unless REQUIRED. */
    String reason;
}
