package com.speedwatch.isa.model;

import com.speedwatch.isa.exception.PolicyConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PolicyConfigurationTest {

    private final PolicyConfiguration defaults = PolicyConfiguration.defaults();

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should accept the default policy")
        void defaultsValid() {
            assertThat(defaults.validate()).isSameAs(defaults);
        }

        @Test
        @DisplayName("should reject weights that do not sum to one")
        void weights() {
            PolicyConfiguration bad = defaults.toBuilder().nighttimeWeight(0.4).build();

            assertThatThrownBy(bad::validate)
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("sum to 1.0");
        }

        @Test
        @DisplayName("should accept weights off by floating point noise only")
        void weightTolerance() {
            PolicyConfiguration policy = defaults.toBuilder()
                    .severityWeight(0.1).nighttimeWeight(0.2).crossJurisdictionWeight(0.7)
                    .build();

            assertThat(policy.validate()).isSameAs(policy);
        }

        @Test
        @DisplayName("should list every problem in one exception")
        void allProblems() {
            PolicyConfiguration bad = defaults.toBuilder()
                    .pointsThreshold(0)
                    .warningBandTickets(new PolicyConfiguration.Band(15, 14))
                    .noticePeriod(Duration.ZERO)
                    .build();

            PolicyConfigurationException e = catchThrowableOfType(bad::validate, PolicyConfigurationException.class);

            assertThat(e.getProblems())
                    .anyMatch(p -> p.startsWith("points threshold"))
                    .anyMatch(p -> p.contains("empty or inverted"))
                    .anyMatch(p -> p.startsWith("notice period"));
        }

        @Test
        @DisplayName("should reject a warning band reaching past the threshold")
        void bandPastThreshold() {
            PolicyConfiguration bad = defaults.toBuilder()
                    .warningBandPoints(new PolicyConfiguration.Band(8, 12))
                    .build();

            assertThatThrownBy(bad::validate).hasMessageContaining("exceeds the threshold 11");
        }
    }

    @Nested
    @DisplayName("Night window")
    class NightWindow {

        @ParameterizedTest(name = "{0} -> {1}")
        @DisplayName("should wrap midnight with an inclusive start and exclusive end")
        @CsvSource({
                "22:00, true",
                "23:59, true",
                "00:00, true",
                "03:59, true",
                "04:00, false",
                "21:59, false",
                "12:00, false"
        })
        void wrapping(String time, boolean night) {
            assertThat(defaults.isNighttime(LocalTime.parse(time))).isEqualTo(night);
        }

        @Test
        @DisplayName("should support a window inside one day")
        void sameDay() {
            PolicyConfiguration early = defaults.toBuilder()
                    .nightStart(LocalTime.of(1, 0))
                    .nightEnd(LocalTime.of(5, 0))
                    .build();

            assertThat(early.isNighttime(LocalTime.of(2, 0))).isTrue();
            assertThat(early.isNighttime(LocalTime.of(23, 0))).isFalse();
        }
    }

    @Test
    @DisplayName("should pick threshold, window and band per entity kind")
    void perKind() {
        assertThat(defaults.thresholdFor(EntityKind.DRIVER)).isEqualTo(11);
        assertThat(defaults.thresholdFor(EntityKind.VEHICLE)).isEqualTo(16);
        assertThat(defaults.windowMonthsFor(EntityKind.DRIVER)).isEqualTo(24);
        assertThat(defaults.windowMonthsFor(EntityKind.VEHICLE)).isEqualTo(12);
        assertThat(defaults.warningBandFor(EntityKind.VEHICLE).contains(15)).isTrue();
        assertThat(defaults.warningBandFor(EntityKind.VEHICLE).contains(16)).isFalse();
        assertThat(defaults.warningBandFor(EntityKind.DRIVER)).hasToString("[8,11)");
    }
}
