package com.speedwatch.isa.exception;

import com.speedwatch.isa.model.AlertStatus;
import lombok.Getter;

@Getter
public class IllegalAlertTransitionException extends RuntimeException {

    private final long alertId;
    private final AlertStatus from;
    private final AlertStatus to;

    public IllegalAlertTransitionException(long alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot move from " + from + " to " + to);
        this.alertId = alertId;
        this.from = from;
        this.to = to;
    }
}
