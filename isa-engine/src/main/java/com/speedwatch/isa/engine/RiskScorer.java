package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;

/**
 * Crash-risk estimate in [0, 100].
 *
 * <pre>
 * risk = 100 * clamp(severityWeight * min(severity, cap)
 *                  + nighttimeWeight * nightFraction
 *                  + crossJurisdictionWeight * crossFlag, 0, 1)
 * </pre>
 *
 * severity is points / pointsThreshold for drivers and tickets / ticketThreshold for
 * vehicles. nightFraction is the share of violations whose local time falls in the
 * policy night window. crossFlag is 1 when the violations span more than one
 * jurisdiction. The result is clamped even for well-formed input: a bad code mapping
 * can produce negative points, and the score must stay inside its bounds.
 */
@Component
@Slf4j
public class RiskScorer {

    public double score(String entityKey, Collection<ViolationRecord> violations, PolicyConfiguration policy) {
        if (violations == null || violations.isEmpty()) {
            return 0.0;
        }

        EntityKind kind = violations.iterator().next().getEntityKind();
        int points = 0;
        int night = 0;
        long jurisdictions = violations.stream()
                .map(ViolationRecord::getJurisdiction)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        for (ViolationRecord v : violations) {
            points += v.getPoints();
            if (v.getOccurredAt() != null && policy.isNighttime(v.getOccurredAt().toLocalTime())) {
                night++;
            }
        }

        double severityFactor = kind == EntityKind.VEHICLE
                ? (double) violations.size() / policy.getTicketThreshold()
                : (double) points / policy.getPointsThreshold();
        double nightFraction = (double) night / violations.size();
        double crossFlag = jurisdictions > 1 ? 1.0 : 0.0;

        double weighted = policy.getSeverityWeight() * Math.min(severityFactor, policy.getSeverityCap())
                + policy.getNighttimeWeight() * nightFraction
                + policy.getCrossJurisdictionWeight() * crossFlag;

        double score = round1(100.0 * clamp(weighted));
        log.debug("Risk {} = {} (severity {}, night {}/{}, jurisdictions {})",
                entityKey, score, severityFactor, night, violations.size(), jurisdictions);
        return score;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
