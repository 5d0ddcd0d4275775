package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.Classification;
import com.speedwatch.isa.model.EntityAggregate;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.PolicyConfiguration;
import com.speedwatch.isa.model.Tier;
import org.springframework.stereotype.Component;

/**
 * Maps an aggregate to its policy tier.
 *
 * <ul>
 *   <li>REQUIRED when total &gt;= threshold</li>
 *   <li>WARNING when total lies in the warning band (always below threshold)</li>
 *   <li>COMPLIANT otherwise</li>
 * </ul>
 * Drivers use the points threshold and band, vehicles the ticket threshold and band.
 */
@Component
public class ThresholdClassifier {

    public Tier classify(EntityAggregate aggregate, PolicyConfiguration policy) {
        return classify(aggregate.getEntityKind(), aggregate.getTotal(), policy);
    }

    public Tier classify(EntityKind kind, int total, PolicyConfiguration policy) {
        if (total >= policy.thresholdFor(kind)) {
            return Tier.REQUIRED;
        }
        if (policy.warningBandFor(kind).contains(total)) {
            return Tier.WARNING;
        }
        return Tier.COMPLIANT;
    }

    /**
     * Tier plus the super-speeder designation, distance to threshold and trigger reason.
     * A driver with any SEVERE-tier violation in the window is a super speeder whatever
     * the point total; the severity signal is never added into the points.
     */
    public Classification assess(EntityAggregate aggregate, PolicyConfiguration policy) {
        EntityKind kind = aggregate.getEntityKind();
        int threshold = policy.thresholdFor(kind);
        Tier tier = classify(aggregate, policy);

        boolean severe = kind == EntityKind.DRIVER && aggregate.getSevereCount() > 0;

        String reason = null;
        if (tier == Tier.REQUIRED) {
            reason = String.format("%d %s (threshold: %d)", aggregate.getTotal(), kind.getUnit(), threshold);
        } else if (severe) {
            reason = String.format("%d severe violation%s", aggregate.getSevereCount(),
                    aggregate.getSevereCount() == 1 ? "" : "s");
        }

        return Classification.builder()
                .tier(tier)
                .superSpeeder(tier == Tier.REQUIRED || severe)
                .remainingToThreshold(Math.max(0, threshold - aggregate.getTotal()))
                .reason(reason)
                .build();
    }
}
