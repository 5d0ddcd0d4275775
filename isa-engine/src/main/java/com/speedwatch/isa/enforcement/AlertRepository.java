package com.speedwatch.isa.enforcement;

import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.exception.AlertNotFoundException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Alert table. All writes are conditional so that the one-open-alert-per-entity rule
 * holds under concurrent detection runs. Returned alerts are copies.
 */
public interface AlertRepository {

    /**
     * Store a new alert and assign its id, unless the entity already has an open alert.
     *
     * @throws AlertConflictException when an open alert exists for the entity
     */
    EnforcementAlert insertIfNoneOpen(EnforcementAlert alert);

    /**
     * Replace a stored alert if its status is still {@code expectedStatus}.
     *
     * @throws AlertConflictException when the stored status differs
     * @throws AlertNotFoundException when no alert has that id
     */
    EnforcementAlert replace(EnforcementAlert updated, AlertStatus expectedStatus);

    Optional<EnforcementAlert> findById(long alertId);

    Optional<EnforcementAlert> findOpen(EntityKind kind, String entityKey);

    /** Every alert of the entity, oldest first. */
    List<EnforcementAlert> findByEntity(EntityKind kind, String entityKey);

    List<EnforcementAlert> findByStatus(AlertStatus status);

    List<EnforcementAlert> findAll();
}
