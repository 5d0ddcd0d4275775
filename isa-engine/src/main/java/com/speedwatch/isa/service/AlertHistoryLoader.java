package com.speedwatch.isa.service;

import com.speedwatch.isa.enforcement.InMemoryAlertRepository;
import com.speedwatch.isa.model.AlertStatus;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.EntityKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the alert table from the ClickHouse archive, which holds one row per
 * committed version of each alert. Only the highest version of each alert is loaded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertHistoryLoader {

    static final String ALERT_QUERY = """
            SELECT
                alert_id,
                version,
                entity_key,
                entity_kind,
                status,
                risk_score,
                total_at_creation,
                reason,
                created_at,
                due_date,
                resolved_at,
                updated_at,
                notes
            FROM isa.enforcement_alerts
            ORDER BY alert_id ASC, version ASC
            """;

    static final RowMapper<EnforcementAlert> ROW_MAPPER = (rs, rowNum) -> EnforcementAlert.builder()
            .alertId(rs.getLong("alert_id"))
            .version(rs.getLong("version"))
            .entityKey(rs.getString("entity_key"))
            .entityKind(EntityKind.valueOf(rs.getString("entity_kind")))
            .status(AlertStatus.valueOf(rs.getString("status")))
            .riskScoreAtCreation(rs.getDouble("risk_score"))
            .totalAtCreation(rs.getInt("total_at_creation"))
            .reason(rs.getString("reason"))
            .createdAt(toLocal(rs.getTimestamp("created_at")))
            .dueDate(toLocal(rs.getTimestamp("due_date")))
            .resolvedAt(toLocal(rs.getTimestamp("resolved_at")))
            .updatedAt(toLocal(rs.getTimestamp("updated_at")))
            .notes(rs.getString("notes"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final InMemoryAlertRepository repository;

    /** The latest version of every archived alert, by id. */
    public Collection<EnforcementAlert> loadLatest() {
        List<EnforcementAlert> versions = jdbcTemplate.query(ALERT_QUERY, ROW_MAPPER);
        Map<Long, EnforcementAlert> latest = new LinkedHashMap<>();
        for (EnforcementAlert version : versions) {
            latest.merge(version.getAlertId(), version,
                    (held, candidate) -> candidate.getVersion() >= held.getVersion() ? candidate : held);
        }
        log.debug("Read {} alert versions for {} alerts", versions.size(), latest.size());
        return latest.values();
    }

    /**
     * Load the archive into the repository.
     *
     * @return number of alerts loaded
     */
    public int restoreIntoRepository() {
        Collection<EnforcementAlert> latest = loadLatest();
        int loaded = repository.restore(latest);
        long open = latest.stream().filter(a -> a.getStatus().isOpen()).count();
        log.info("Restored {} archived alerts ({} open)", loaded, open);
        return loaded;
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
