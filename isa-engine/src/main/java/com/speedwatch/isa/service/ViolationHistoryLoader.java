package com.speedwatch.isa.service;

import com.speedwatch.isa.engine.ViolationStore;
import com.speedwatch.isa.model.DeduplicationReport;
import com.speedwatch.isa.model.Disposition;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.SeverityTier;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.List;

/**
 * Reads archived violations back from ClickHouse so the in-memory store survives
 * restarts. FINAL collapses any copies the ReplacingMergeTree has not merged yet.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ViolationHistoryLoader {

    static final String HISTORY_QUERY = """
            SELECT
                record_id,
                entity_key,
                entity_kind,
                source_type,
                violation_code,
                points,
                severity,
                disposition,
                occurred_at,
                jurisdiction,
                ingest_sequence
            FROM isa.violations FINAL
            ORDER BY ingest_sequence ASC
            """;

    static final RowMapper<ViolationRecord> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp occurred = rs.getTimestamp("occurred_at");
        return ViolationRecord.builder()
                .recordId(rs.getString("record_id"))
                .entityKey(rs.getString("entity_key"))
                .entityKind(EntityKind.valueOf(rs.getString("entity_kind")))
                .sourceType(SourceType.valueOf(rs.getString("source_type")))
                .violationCode(rs.getString("violation_code"))
                .points(rs.getInt("points"))
                .severity(SeverityTier.valueOf(rs.getString("severity")))
                .disposition(Disposition.valueOf(rs.getString("disposition")))
                .occurredAt(occurred == null ? null : occurred.toLocalDateTime())
                .jurisdiction(rs.getString("jurisdiction"))
                .sequence(rs.getLong("ingest_sequence"))
                .build();
    };

    private final JdbcTemplate jdbcTemplate;
    private final ViolationStore store;

    public List<ViolationRecord> loadAll() {
        return jdbcTemplate.query(HISTORY_QUERY, ROW_MAPPER);
    }

    /**
     * Load the archive into the store.
     *
     * @return how the archived records fared against what the store already held
     */
    public DeduplicationReport restoreIntoStore() {
        List<ViolationRecord> history = loadAll();
        DeduplicationReport report = store.restore(history);
        log.info("Restored {} archived violations ({} already present)",
                report.getAccepted(), report.getDuplicates());
        return report;
    }
}
