package com.speedwatch.isa.model;

/**
 * Where a violation came from. The source decides which identifier keys the record:
 * camera tickets are issued to a plate, officer tickets to a license.
 */
public enum SourceType {
    CAMERA(EntityKind.VEHICLE),
    OFFICER(EntityKind.DRIVER);

    private final EntityKind entityKind;

    SourceType(EntityKind entityKind) {
        this.entityKind = entityKind;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    /**
     * Lenient parse for feed values such as "SPEED_CAMERA", "camera", "TRAFFIC_VIOLATIONS",
     * "officer", "court". Returns null when the value names neither source.
     */
    public static SourceType fromFeedValue(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim().toUpperCase();
        if (v.contains("CAMERA") || v.contains("PHTO")) return CAMERA;
        if (v.contains("OFFICER") || v.contains("TRAFFIC") || v.contains("COURT") || v.contains("POLICE")) {
            return OFFICER;
        }
        return null;
    }
}
