package com.speedwatch.isa.enforcement;

import com.speedwatch.isa.exception.AlertConflictException;
import com.speedwatch.isa.exception.AlertNotFoundException;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAlertRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 7, 1, 9, 0);

    private final InMemoryAlertRepository repository = new InMemoryAlertRepository();

    private static EnforcementAlert alert(String key, AlertStatus status) {
        return EnforcementAlert.builder()
                .entityKind(EntityKind.DRIVER)
                .entityKey(key)
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("should assign increasing ids on insert")
    void ids() {
        EnforcementAlert a = repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW));
        EnforcementAlert b = repository.insertIfNoneOpen(alert("D2", AlertStatus.NEW));

        assertThat(b.getAlertId()).isGreaterThan(a.getAlertId());
        assertThat(repository.findAll()).extracting(EnforcementAlert::getEntityKey).containsExactly("D1", "D2");
    }

    @Test
    @DisplayName("should refuse to insert an alert that is already terminal")
    void terminalInsert() {
        assertThatThrownBy(() -> repository.insertIfNoneOpen(alert("D1", AlertStatus.COMPLIANT)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should replace only when the stored status matches")
    void conditionalReplace() {
        EnforcementAlert stored = repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW));
        EnforcementAlert sent = stored.toBuilder().status(AlertStatus.NOTICE_SENT).build();

        repository.replace(sent, AlertStatus.NEW);

        assertThatThrownBy(() -> repository.replace(sent, AlertStatus.NEW))
                .isInstanceOf(AlertConflictException.class)
                .hasMessage("Alert " + stored.getAlertId() + " is NOTICE_SENT, expected NEW");
        assertThat(repository.findByStatus(AlertStatus.NOTICE_SENT)).hasSize(1);
    }

    @Test
    @DisplayName("should report a replace of an unknown alert")
    void unknownReplace() {
        assertThatThrownBy(() -> repository.replace(alert("D1", AlertStatus.NOTICE_SENT).toBuilder().alertId(5).build(),
                AlertStatus.NEW))
                .isInstanceOf(AlertNotFoundException.class);
    }

    @Test
    @DisplayName("should release the open slot once the alert is terminal")
    void releasesOpenSlot() {
        EnforcementAlert stored = repository.insertIfNoneOpen(alert("D1", AlertStatus.FOLLOW_UP_DUE));
        assertThat(repository.findOpen(EntityKind.DRIVER, "D1")).isPresent();

        repository.replace(stored.toBuilder().status(AlertStatus.ESCALATED).build(), AlertStatus.FOLLOW_UP_DUE);

        assertThat(repository.findOpen(EntityKind.DRIVER, "D1")).isEmpty();
        assertThat(repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW)).getStatus()).isEqualTo(AlertStatus.NEW);
        assertThat(repository.findByEntity(EntityKind.DRIVER, "D1")).hasSize(2);
    }

    @Test
    @DisplayName("should hand out copies that do not alias the stored alert")
    void copies() {
        EnforcementAlert stored = repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW));

        stored.setStatus(AlertStatus.ESCALATED);
        stored.setNotes("tampered");

        EnforcementAlert reread = repository.findById(stored.getAlertId()).orElseThrow();
        assertThat(reread.getStatus()).isEqualTo(AlertStatus.NEW);
        assertThat(reread.getNotes()).isNull();
    }

    @Test
    @DisplayName("should start each alert at version 1 and bump the version on every replace")
    void versions() {
        EnforcementAlert stored = repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW));
        assertThat(stored.getVersion()).isEqualTo(1);

        EnforcementAlert sent = repository.replace(stored.toBuilder().status(AlertStatus.NOTICE_SENT).build(), AlertStatus.NEW);
        EnforcementAlert due = repository.replace(sent.toBuilder().status(AlertStatus.FOLLOW_UP_DUE).build(),
                AlertStatus.NOTICE_SENT);

        assertThat(sent.getVersion()).isEqualTo(2);
        assertThat(due.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("should rebuild open alerts from archived state and continue ids after the highest")
    void restore() {
        EnforcementAlert openD1 = alert("D1", AlertStatus.NOTICE_SENT).toBuilder().alertId(4).version(2).build();
        EnforcementAlert closedD2 = alert("D2", AlertStatus.COMPLIANT).toBuilder().alertId(9).version(4).build();

        int loaded = repository.restore(List.of(openD1, closedD2));

        assertThat(loaded).isEqualTo(2);
        assertThat(repository.findOpen(EntityKind.DRIVER, "D1")).map(EnforcementAlert::getAlertId).contains(4L);
        assertThat(repository.findOpen(EntityKind.DRIVER, "D2")).isEmpty();
        assertThatThrownBy(() -> repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW)))
                .isInstanceOf(AlertConflictException.class)
                .hasMessage("Entity D1 already has open alert 4");
        assertThat(repository.insertIfNoneOpen(alert("D2", AlertStatus.NEW)).getAlertId()).isGreaterThan(9L);
    }

    @Test
    @DisplayName("should keep the live copy when the archive holds an older version of a known alert")
    void restoreKeepsLiveState() {
        EnforcementAlert live = repository.insertIfNoneOpen(alert("D1", AlertStatus.NEW));
        repository.replace(live.toBuilder().status(AlertStatus.NOTICE_SENT).build(), AlertStatus.NEW);

        int loaded = repository.restore(List.of(live));

        assertThat(loaded).isZero();
        assertThat(repository.findById(live.getAlertId()).orElseThrow().getStatus()).isEqualTo(AlertStatus.NOTICE_SENT);
    }

    @Test
    @DisplayName("should track the newest open alert when the archive holds two for one entity")
    void restoreDuplicateOpen() {
        repository.restore(List.of(
                alert("D1", AlertStatus.NEW).toBuilder().alertId(3).version(1).build(),
                alert("D1", AlertStatus.NOTICE_SENT).toBuilder().alertId(6).version(2).build()));

        assertThat(repository.findOpen(EntityKind.DRIVER, "D1")).map(EnforcementAlert::getAlertId).contains(6L);
    }
}
