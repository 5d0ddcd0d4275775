package com.speedwatch.isa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DispositionTest {

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @DisplayName("should map court and camera disposition strings")
    @CsvSource({
            "GUILTY,                   SUSTAINED",
            "guilty,                   SUSTAINED",
            "HEARING HELD-GUILTY,      SUSTAINED",
            "PAID IN FULL,             SUSTAINED",
            "NOT GUILTY,               DISMISSED",
            "HEARING HELD-NOT GUILTY,  DISMISSED",
            "UNDER_APPEAL,             UNDER_APPEAL",
            "SCHEDULED,                PENDING"
    })
    void mapping(String raw, Disposition expected) {
        assertThat(Disposition.fromFeedValue(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat blank as pending and count only sustained")
    void blankAndCounting() {
        assertThat(Disposition.fromFeedValue("  ")).isEqualTo(Disposition.PENDING);
        assertThat(Disposition.fromFeedValue(null)).isEqualTo(Disposition.PENDING);
        assertThat(Disposition.SUSTAINED.countsTowardTotals()).isTrue();
        assertThat(Disposition.UNDER_APPEAL.countsTowardTotals()).isFalse();
    }
}
