package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.Classification;
import com.speedwatch.isa.model.EntityAggregate;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.TreeSet;

import static com.speedwatch.isa.engine.ViolationFixtures.REF;
import static org.assertj.core.api.Assertions.assertThat;

class ThresholdClassifierTest {

    private final ThresholdClassifier classifier = new ThresholdClassifier();
    private final PolicyConfiguration policy = PolicyConfiguration.defaults();

    @ParameterizedTest(name = "{0} {1} -> {2}")
    @DisplayName("should tier totals against threshold and half-open warning band")
    @CsvSource({
            "DRIVER,  12, REQUIRED",
            "DRIVER,  11, REQUIRED",
            "DRIVER,  10, WARNING",
            "DRIVER,   8, WARNING",
            "DRIVER,   7, COMPLIANT",
            "DRIVER,   0, COMPLIANT",
            "VEHICLE, 16, REQUIRED",
            "VEHICLE, 15, WARNING",
            "VEHICLE, 14, WARNING",
            "VEHICLE, 13, COMPLIANT"
    })
    void tiers(EntityKind kind, int total, Tier expected) {
        assertThat(classifier.classify(kind, total, policy)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should follow a stricter policy passed for one call")
    void policyPerCall() {
        PolicyConfiguration strict = policy.toBuilder()
                .pointsThreshold(6)
                .warningBandPoints(new PolicyConfiguration.Band(4, 6))
                .build();

        assertThat(classifier.classify(EntityKind.DRIVER, 6, strict)).isEqualTo(Tier.REQUIRED);
        assertThat(classifier.classify(EntityKind.DRIVER, 6, policy)).isEqualTo(Tier.COMPLIANT);
    }

    @Nested
    @DisplayName("Assessment")
    class Assessment {

        @Test
        @DisplayName("should explain a REQUIRED driver with its points and threshold")
        void requiredReason() {
            Classification c = classifier.assess(aggregate(EntityKind.DRIVER, 12, 0), policy);

            assertThat(c.getTier()).isEqualTo(Tier.REQUIRED);
            assertThat(c.isSuperSpeeder()).isTrue();
            assertThat(c.getReason()).isEqualTo("12 points (threshold: 11)");
            assertThat(c.getRemainingToThreshold()).isZero();
        }

        @Test
        @DisplayName("should explain a REQUIRED vehicle in tickets")
        void vehicleReason() {
            Classification c = classifier.assess(aggregate(EntityKind.VEHICLE, 17, 0), policy);

            assertThat(c.getReason()).isEqualTo("17 tickets (threshold: 16)");
        }

        @Test
        @DisplayName("should flag a driver with a severe violation as super speeder without changing the tier")
        void severeDriver() {
            Classification c = classifier.assess(aggregate(EntityKind.DRIVER, 8, 1), policy);

            assertThat(c.getTier()).isEqualTo(Tier.WARNING);
            assertThat(c.isSuperSpeeder()).isTrue();
            assertThat(c.getRemainingToThreshold()).isEqualTo(3);
            assertThat(c.getReason()).isEqualTo("1 severe violation");
        }

        @Test
        @DisplayName("should not flag a compliant driver without severe violations")
        void ordinary() {
            Classification c = classifier.assess(aggregate(EntityKind.DRIVER, 4, 0), policy);

            assertThat(c.isSuperSpeeder()).isFalse();
            assertThat(c.getReason()).isNull();
        }
    }

    private static EntityAggregate aggregate(EntityKind kind, int total, int severe) {
        return EntityAggregate.builder()
                .entityKey("E1")
                .entityKind(kind)
                .windowMonths(24)
                .referenceInstant(REF)
                .total(total)
                .violationCount(Math.max(1, total / 2))
                .firstViolation(REF.minusMonths(6))
                .lastViolation(REF)
                .distinctJurisdictions(new TreeSet<>())
                .severeCount(severe)
                .build();
    }
}
