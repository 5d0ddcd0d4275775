package com.speedwatch.isa.model;

/**
 * What a violation is counted against.
 *
 * Drivers accumulate license points; vehicles accumulate camera tickets.
 * The two are aggregated and classified independently.
 */
public enum EntityKind {
    DRIVER("points"),
    VEHICLE("tickets");

    private final String unit;

    EntityKind(String unit) {
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }

    public static EntityKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind is required (DRIVER or VEHICLE)");
        }
        try {
            return EntityKind.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity kind: " + value + " (expected DRIVER or VEHICLE)", e);
        }
    }
}
