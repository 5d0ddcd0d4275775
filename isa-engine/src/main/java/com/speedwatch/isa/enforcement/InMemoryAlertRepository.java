package com.speedwatch.isa.enforcement;

import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.exception.AlertNotFoundException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Alert table held in memory. Every state change is also written through the audit
 * sink, so the ClickHouse alert table carries the durable history.
 *
 * The open-alert index is claimed with putIfAbsent before the alert row is stored,
 * which makes "check no open alert, then insert" a single atomic step per entity.
 */
@Repository
@Slf4j
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<Long, EnforcementAlert> alerts = new ConcurrentHashMap<>();
    private final Map<String, Long> openByEntity = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public EnforcementAlert insertIfNoneOpen(EnforcementAlert alert) {
        if (alert.getStatus() == null || !alert.getStatus().isOpen()) {
            throw new IllegalArgumentException("New alerts must start in an open status, got " + alert.getStatus());
        }
        long id = ids.incrementAndGet();
        String ref = entityRef(alert.getEntityKind(), alert.getEntityKey());

        Long existing = openByEntity.putIfAbsent(ref, id);
        if (existing != null) {
            throw new AlertConflictException(alert.getEntityKind(), alert.getEntityKey(), existing,
                    "Entity " + alert.getEntityKey() + " already has open alert " + existing);
        }

        EnforcementAlert stored = alert.toBuilder().alertId(id).version(1).build();
        alerts.put(id, stored);
        return copy(stored);
    }

    @Override
    public EnforcementAlert replace(EnforcementAlert updated, AlertStatus expectedStatus) {
        long id = updated.getAlertId();
        EnforcementAlert stored = alerts.compute(id, (key, current) -> {
            if (current == null) {
                throw new AlertNotFoundException(id);
            }
            if (current.getStatus() != expectedStatus) {
                throw new AlertConflictException(current.getEntityKind(), current.getEntityKey(), id,
                        "Alert " + id + " is " + current.getStatus() + ", expected " + expectedStatus);
            }
            return updated.toBuilder().version(current.getVersion() + 1).build();
        });

        if (!stored.getStatus().isOpen()) {
            openByEntity.remove(entityRef(stored.getEntityKind(), stored.getEntityKey()), id);
        }
        return copy(stored);
    }

    /**
     * Load the latest version of archived alerts, e.g. at startup. Ids already held are
     * left alone. New ids continue after the highest id seen.
     *
     * @return number of alerts loaded
     */
    public int restore(Collection<EnforcementAlert> latest) {
        int loaded = 0;
        long maxId = 0;
        for (EnforcementAlert alert : latest) {
            maxId = Math.max(maxId, alert.getAlertId());
            if (alerts.putIfAbsent(alert.getAlertId(), copy(alert)) != null) {
                continue;
            }
            loaded++;
            if (alert.getStatus().isOpen()) {
                String ref = entityRef(alert.getEntityKind(), alert.getEntityKey());
                Long other = openByEntity.get(ref);
                Long tracked = openByEntity.merge(ref, alert.getAlertId(), Math::max);
                if (other != null) {
                    log.warn("Entity {} has open alerts {} and {} in the archive, tracking {}",
                            alert.getEntityKey(), other, alert.getAlertId(), tracked);
                }
            }
        }
        ids.accumulateAndGet(maxId, Math::max);
        log.info("Restored {} alerts, next alert id {}", loaded, ids.get() + 1);
        return loaded;
    }

    @Override
    public Optional<EnforcementAlert> findById(long alertId) {
        return Optional.ofNullable(alerts.get(alertId)).map(this::copy);
    }

    @Override
    public Optional<EnforcementAlert> findOpen(EntityKind kind, String entityKey) {
        Long id = openByEntity.get(entityRef(kind, entityKey));
        if (id == null) return Optional.empty();
        return findById(id).filter(a -> a.getStatus().isOpen());
    }

    @Override
    public List<EnforcementAlert> findByEntity(EntityKind kind, String entityKey) {
        return alerts.values().stream()
                .filter(a -> a.getEntityKind() == kind && a.getEntityKey().equals(entityKey))
                .sorted(Comparator.comparingLong(EnforcementAlert::getAlertId))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<EnforcementAlert> findByStatus(AlertStatus status) {
        return alerts.values().stream()
                .filter(a -> a.getStatus() == status)
                .sorted(Comparator.comparingLong(EnforcementAlert::getAlertId))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<EnforcementAlert> findAll() {
        return alerts.values().stream()
                .sorted(Comparator.comparingLong(EnforcementAlert::getAlertId))
                .map(this::copy)
                .toList();
    }

    private static String entityRef(EntityKind kind, String entityKey) {
        return kind + "|" + entityKey;
    }

    private EnforcementAlert copy(EnforcementAlert alert) {
        return alert.toBuilder().build();
    }
}
