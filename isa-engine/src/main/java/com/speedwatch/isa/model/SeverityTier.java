package com.speedwatch.isa.model;

/**
 * Severity of a violation code, ordered from least to most severe.
 */
public enum SeverityTier {
    LOW,
    MODERATE,
    HIGH,
    SEVERE;

    public boolean isHighest() {
        return this == SEVERE;
    }
}
