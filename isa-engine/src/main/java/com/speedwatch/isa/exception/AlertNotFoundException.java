package com.speedwatch.isa.exception;

public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(long alertId) {
        super("Alert not found: " + alertId);
    }
}
