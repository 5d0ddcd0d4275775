package com.speedwatch.isa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ImpactMetricsTest {

    @Test
    @DisplayName("should truncate the exposure and lives-saved estimates")
    void estimates() {
        ImpactMetrics metrics = ImpactMetrics.of(EntityKind.DRIVER, LocalDateTime.of(2024, 6, 30, 0, 0),
                100, 7, 3, 10);

        assertThat(metrics.getEstimatedFatalExposure()).isEqualTo(21);
        assertThat(metrics.getPotentialLivesSaved()).isEqualTo(13);
        assertThat(metrics.getLivesSavedSoFar()).isEqualTo(1);
        assertThat(metrics.getHighRiskPendingNotice()).isEqualTo(7);
    }

    @Test
    @DisplayName("should estimate nothing for small counts")
    void smallCounts() {
        ImpactMetrics metrics = ImpactMetrics.of(EntityKind.VEHICLE, null, 4, 0, 0, 4);

        assertThat(metrics.getEstimatedFatalExposure()).isZero();
        assertThat(metrics.getPotentialLivesSaved()).isZero();
        assertThat(metrics.getLivesSavedSoFar()).isZero();
    }
}
