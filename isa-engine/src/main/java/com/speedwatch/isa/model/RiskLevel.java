package com.speedwatch.isa.model;

/**
 * Banding of the 0-100 crash-risk score for display and notice text.
 */
public enum RiskLevel {
    LOW("Low risk"),
    MODERATE("Concerning"),
    HIGH("Very dangerous"),
    CRITICAL("High fatality risk");

    private final String description;

    RiskLevel(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static RiskLevel fromScore(double score) {
        if (score >= 75) return CRITICAL;
        if (score >= 50) return HIGH;
        if (score >= 25) return MODERATE;
        return LOW;
    }
}
