package com.speedwatch.isa.output;

import com.speedwatch.isa.model.DetectionRun;
import com.speedwatch.isa.model.EnforcementAlert;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter SQL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS isa");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS isa.violations
            (
                dedup_key           String,
                record_id           Nullable(String),
                entity_key          String,
                entity_kind         LowCardinality(String),
                source_type         LowCardinality(String),
                violation_code      LowCardinality(String),
                points              Int32,
                severity            LowCardinality(String),
                disposition         LowCardinality(String),
                occurred_at         DateTime,
                jurisdiction        LowCardinality(Nullable(String)),
                ingest_sequence     Int64
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(occurred_at)
            ORDER BY (entity_kind, entity_key, dedup_key)
            SETTINGS index_granularity = 8192
        """);

        // one row per committed transition; the highest version is the current state
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS isa.enforcement_alerts
            (
                alert_id            Int64,
                version             Int64,
                entity_key          String,
                entity_kind         LowCardinality(String),
                status              LowCardinality(String),
                risk_score          Float64,
                total_at_creation   Int32,
                reason              Nullable(String),
                created_at          DateTime,
                due_date            Nullable(DateTime),
                resolved_at         Nullable(DateTime),
                updated_at          DateTime,
                notes               Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (alert_id, version)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS isa.detection_runs
            (
                run_id              String,
                entity_kind         LowCardinality(String),
                reference_instant   Nullable(DateTime),
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                rows_received       Int32,
                rows_accepted       Int32,
                rows_rejected       Int32,
                duplicates          Int32,
                newly_crossed       Int32,
                notices_issued      Int32,
                conflicts           Int32,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, entity_kind)
        """);

        log.info("ClickHouse schema ready.");
    }

    public void write(List<ViolationRecord> records) {
        if (records.isEmpty()) return;

        int total = records.size();
        log.info("Writing {} violations to ClickHouse in batches of {}", total, BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<ViolationRecord> batch = records.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                writeBatchAsValues(batch);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} violations", total);
    }

    /**
     * One INSERT ... VALUES statement per batch; the ClickHouse JDBC driver handles this
     * more reliably than PreparedStatement batches.
     */
    private void writeBatchAsValues(List<ViolationRecord> batch) {
        StringBuilder sql = new StringBuilder("""
            INSERT INTO isa.violations
            (dedup_key, record_id, entity_key, entity_kind, source_type, violation_code,
             points, severity, disposition, occurred_at, jurisdiction, ingest_sequence)
            VALUES
            """);

        String rows = batch.stream()
                .map(this::toValueRow)
                .collect(Collectors.joining(",\n"));

        sql.append(rows);
        jdbcTemplate.execute(sql.toString());
    }

    String toValueRow(ViolationRecord r) {
        return String.format("(%s,%s,%s,%s,%s,%s,%d,%s,%s,%s,%s,%d)",
                sqlStr(r.dedupKey()),
                sqlStr(r.getRecordId()),
                sqlStr(r.getEntityKey()),
                sqlStr(r.getEntityKind()),
                sqlStr(r.getSourceType()),
                sqlStr(r.getViolationCode()),
                r.getPoints(),
                sqlStr(r.getSeverity()),
                sqlStr(r.getDisposition()),
                sqlDateTime(r.getOccurredAt()),
                sqlStr(r.getJurisdiction()),
                r.getSequence()
        );
    }

    public void writeAlert(EnforcementAlert a) {
        String sql = String.format("""
            INSERT INTO isa.enforcement_alerts
            (alert_id, version, entity_key, entity_kind, status, risk_score, total_at_creation, reason,
             created_at, due_date, resolved_at, updated_at, notes)
            VALUES (%d,%d,%s,%s,%s,%s,%d,%s,%s,%s,%s,%s,%s)
            """,
                a.getAlertId(),
                a.getVersion(),
                sqlStr(a.getEntityKey()),
                sqlStr(a.getEntityKind()),
                sqlStr(a.getStatus()),
                a.getRiskScoreAtCreation(),
                a.getTotalAtCreation(),
                sqlStr(a.getReason()),
                sqlDateTime(a.getCreatedAt()),
                sqlDateTime(a.getDueDate()),
                sqlDateTime(a.getResolvedAt()),
                sqlDateTime(a.getUpdatedAt()),
                sqlStr(a.getNotes())
        );
        jdbcTemplate.execute(sql);
    }

    public void writeDetectionRun(DetectionRun run) {
        String sql = String.format("""
            INSERT INTO isa.detection_runs
            (run_id, entity_kind, reference_instant, started_at, completed_at, status,
             rows_received, rows_accepted, rows_rejected, duplicates, newly_crossed,
             notices_issued, conflicts, error_message)
            VALUES (%s,%s,%s,%s,%s,%s,%d,%d,%d,%d,%d,%d,%d,%s)
            """,
                sqlStr(run.getRunId()),
                sqlStr(run.getEntityKind()),
                sqlDateTime(run.getReferenceInstant()),
                sqlDateTime(run.getStartedAt()),
                sqlDateTime(run.getCompletedAt()),
                sqlStr(run.getStatus()),
                run.getRowsReceived(),
                run.getRowsAccepted(),
                run.getRowsRejected(),
                run.getDuplicates(),
                run.getNewlyCrossed(),
                run.getNoticesIssued(),
                run.getConflicts(),
                sqlStr(run.getErrorMessage())
        );
        jdbcTemplate.execute(sql);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlDateTime(LocalDateTime val) {
        if (val == null) return "NULL";
        return "toDateTime('" + SQL_DATE_TIME.format(val) + "')";
    }
}
