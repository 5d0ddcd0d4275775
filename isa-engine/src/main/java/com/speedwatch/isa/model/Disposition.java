package com.speedwatch.isa.model;

import java.util.Set;

/**
 * Adjudicated outcome of a violation. Only {@link #SUSTAINED} violations count
 * toward point and ticket totals.
 */
public enum Disposition {
    SUSTAINED,
    PENDING,
    UNDER_APPEAL,
    DISMISSED;

    private static final Set<String> SUSTAINED_VALUES = Set.of(
            "GUILTY", "SUSTAINED", "CONVICTED", "PAID", "ADJUDICATED",
            "ADJUDICATED GUILTY", "HEARING HELD GUILTY", "PAID IN FULL");

    private static final Set<String> DISMISSED_VALUES = Set.of(
            "DISMISSED", "NOT GUILTY", "HEARING HELD NOT GUILTY", "ADJUDICATED NOT GUILTY");

    private static final Set<String> APPEAL_VALUES = Set.of(
            "APPEAL", "UNDER APPEAL", "APPEALED", "APPEAL PENDING");

    public boolean countsTowardTotals() {
        return this == SUSTAINED;
    }

    /**
     * Maps a feed disposition string to a disposition. Blank and unrecognised values
     * are treated as not yet final.
     */
    public static Disposition fromFeedValue(String value) {
        if (value == null || value.isBlank()) return PENDING;
        String v = value.trim().toUpperCase().replaceAll("[-_]+", " ").replaceAll("\\s+", " ");
        if (SUSTAINED_VALUES.contains(v)) return SUSTAINED;
        if (DISMISSED_VALUES.contains(v)) return DISMISSED;
        if (APPEAL_VALUES.contains(v)) return UNDER_APPEAL;
        return PENDING;
    }
}
