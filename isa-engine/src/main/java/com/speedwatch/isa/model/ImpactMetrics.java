package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Headline figures for one entity kind at one reference instant.
 *
 * The estimates apply fixed rates: 21% of severe speeding events are taken to carry
 * fatal exposure, and an ISA device is credited with preventing 64% of those.
 */
@Value
@Builder
public class ImpactMetrics {

    public static final double FATAL_EXPOSURE_RATE = 0.21;
    public static final double ISA_REDUCTION_RATE = 0.64;

    EntityKind entityKind;

    LocalDateTime referenceInstant;

    int totalSevereViolations;

    /** REQUIRED entities whose notice is not yet sent or not yet answered. */
    int highRiskPendingNotice;

    int crossJurisdictionOffenders;

    /** Alerts that ended with a confirmed installation. */
    int isaCompliant;

    int estimatedFatalExposure;

    int potentialLivesSaved;

    int livesSavedSoFar;

    public static ImpactMetrics of(EntityKind kind, LocalDateTime ref, int severe, int pendingNotice,
                                   int crossJurisdiction, int compliant) {
        int exposure = (int) (severe * FATAL_EXPOSURE_RATE);
        return ImpactMetrics.builder()
                .entityKind(kind)
                .referenceInstant(ref)
                .totalSevereViolations(severe)
                .highRiskPendingNotice(pendingNotice)
                .crossJurisdictionOffenders(crossJurisdiction)
                .isaCompliant(compliant)
                .estimatedFatalExposure(exposure)
                .potentialLivesSaved((int) (exposure * ISA_REDUCTION_RATE))
                .livesSavedSoFar((int) (compliant * FATAL_EXPOSURE_RATE * ISA_REDUCTION_RATE))
                .build();
    }
}
