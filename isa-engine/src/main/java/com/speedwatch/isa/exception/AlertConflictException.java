package com.speedwatch.isa.exception;

import com.speedwatch.isa.model.EntityKind;
import lombok.Getter;

/**
 * An entity already has an open alert, or a concurrent transition changed the alert
 * first. The caller should re-read the current state before retrying.
 */
@Getter
public class AlertConflictException extends RuntimeException {

    private final EntityKind entityKind;
    private final String entityKey;
    private final Long existingAlertId;

    public AlertConflictException(EntityKind entityKind, String entityKey, Long existingAlertId, String message) {
        super(message);
        this.entityKind = entityKind;
        this.entityKey = entityKey;
        this.existingAlertId = existingAlertId;
    }
}
