package com.speedwatch.isa.enforcement;

import com.speedwatch.isa.model.EnforcementAlert;

/**
 * Receives every alert state after it has been committed. Implementations must not
 * throw; a failed audit write never undoes a transition.
 */
@FunctionalInterface
public interface AlertAuditSink {

    void record(EnforcementAlert alert);
}
