package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Classified entity with the violations that produced its total and its alert history.
 */
@Value
@Builder
public class EntityDetail {

    RosterEntry entry;

    /** Counted violations in the window, newest first. */
    List<ViolationRecord> violations;

    /** Alert history, oldest first. */
    List<EnforcementAlert> alerts;
}
