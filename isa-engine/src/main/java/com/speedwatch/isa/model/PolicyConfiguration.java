package com.speedwatch.isa.model;

import com.speedwatch.isa.exception.PolicyConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable enforcement policy for one detection run.
 *
 * Passed explicitly to every engine call so that runs with different policies
 * (simulation vs production thresholds) can execute side by side. Built from
 * configuration once and checked with {@link #validate()} before first use.
 */
@Value
@Builder(toBuilder = true)
public class PolicyConfiguration {

    private static final double WEIGHT_TOLERANCE = 1e-9;

    /** ISA required at or above this many driver points in the window. */
    int pointsThreshold;

    /** ISA required at or above this many vehicle tickets in the window. */
    int ticketThreshold;

    int driverWindowMonths;

    int vehicleWindowMonths;

    /** Half-open [low, high) band of driver points signalling an imminent crossing. */
    Band warningBandPoints;

    /** Half-open [low, high) band of vehicle tickets signalling an imminent crossing. */
    Band warningBandTickets;

    double severityWeight;

    double nighttimeWeight;

    double crossJurisdictionWeight;

    /** Upper bound on points / threshold before weighting. */
    double severityCap;

    /** Start of the night window, inclusive. The window may wrap midnight. */
    LocalTime nightStart;

    /** End of the night window, exclusive. */
    LocalTime nightEnd;

    Duration noticePeriod;

    Duration followUpPeriod;

    public record Band(int low, int high) {
        public boolean contains(int value) {
            return value >= low && value < high;
        }

        @Override
        public String toString() {
            return "[" + low + "," + high + ")";
        }
    }

    public static PolicyConfiguration defaults() {
        return PolicyConfiguration.builder()
                .pointsThreshold(11)
                .ticketThreshold(16)
                .driverWindowMonths(24)
                .vehicleWindowMonths(12)
                .warningBandPoints(new Band(8, 11))
                .warningBandTickets(new Band(14, 16))
                .severityWeight(0.6)
                .nighttimeWeight(0.3)
                .crossJurisdictionWeight(0.1)
                .severityCap(2.0)
                .nightStart(LocalTime.of(22, 0))
                .nightEnd(LocalTime.of(4, 0))
                .noticePeriod(Duration.ofDays(14))
                .followUpPeriod(Duration.ofDays(7))
                .build();
    }

    public int thresholdFor(EntityKind kind) {
        return kind == EntityKind.DRIVER ? pointsThreshold : ticketThreshold;
    }

    public int windowMonthsFor(EntityKind kind) {
        return kind == EntityKind.DRIVER ? driverWindowMonths : vehicleWindowMonths;
    }

    public Band warningBandFor(EntityKind kind) {
        return kind == EntityKind.DRIVER ? warningBandPoints : warningBandTickets;
    }

    public boolean isNighttime(LocalTime time) {
        if (nightStart.isBefore(nightEnd)) {
            return !time.isBefore(nightStart) && time.isBefore(nightEnd);
        }
        // window wraps midnight, e.g. 22:00-04:00
        return !time.isBefore(nightStart) || time.isBefore(nightEnd);
    }

    /**
     * Rejects a policy that cannot be applied as written. Nothing is clamped or
     * renormalised: every problem found is reported in one exception.
     *
     * @return this policy, for chaining after {@code build()}
     * @throws PolicyConfigurationException listing every problem found
     */
    public PolicyConfiguration validate() {
        List<String> problems = problems();
        if (!problems.isEmpty()) {
            throw new PolicyConfigurationException(problems);
        }
        return this;
    }

    /** Every reason this policy cannot be applied; empty when it is valid. */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();

        if (pointsThreshold <= 0) problems.add("points threshold must be > 0, was " + pointsThreshold);
        if (ticketThreshold <= 0) problems.add("ticket threshold must be > 0, was " + ticketThreshold);
        if (driverWindowMonths <= 0) problems.add("driver window must be > 0 months, was " + driverWindowMonths);
        if (vehicleWindowMonths <= 0) problems.add("vehicle window must be > 0 months, was " + vehicleWindowMonths);

        checkBand("points", warningBandPoints, pointsThreshold, problems);
        checkBand("tickets", warningBandTickets, ticketThreshold, problems);

        if (severityWeight < 0 || nighttimeWeight < 0 || crossJurisdictionWeight < 0) {
            problems.add("scoring weights must be non-negative");
        }
        double weightSum = severityWeight + nighttimeWeight + crossJurisdictionWeight;
        if (Math.abs(weightSum - 1.0) > WEIGHT_TOLERANCE) {
            problems.add("scoring weights must sum to 1.0, sum to " + weightSum);
        }
        if (severityCap <= 0) problems.add("severity cap must be > 0, was " + severityCap);

        if (nightStart == null || nightEnd == null) {
            problems.add("night window start and end are required");
        } else if (nightStart.equals(nightEnd)) {
            problems.add("night window start and end must differ");
        }

        if (noticePeriod == null || noticePeriod.isNegative() || noticePeriod.isZero()) {
            problems.add("notice period must be positive");
        }
        if (followUpPeriod == null || followUpPeriod.isNegative() || followUpPeriod.isZero()) {
            problems.add("follow-up period must be positive");
        }
        return problems;
    }

    private static void checkBand(String name, Band band, int threshold, List<String> problems) {
        if (band == null) {
            problems.add("warning band for " + name + " is required");
            return;
        }
        if (band.low() < 0) {
            problems.add("warning band for " + name + " must not start below 0, was " + band);
        }
        if (band.low() >= band.high()) {
            problems.add("warning band for " + name + " is empty or inverted: " + band);
        }
        if (band.high() > threshold) {
            problems.add("warning band for " + name + " " + band
                    + " overlaps or exceeds the threshold " + threshold);
        }
    }
}
