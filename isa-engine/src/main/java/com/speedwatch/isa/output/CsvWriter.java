package com.speedwatch.isa.output;

import com.opencsv.CSVWriter;
import com.speedwatch.isa.config.IsaEngineProperties;
import com.speedwatch.isa.model.EntityDetail;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.RosterEntry;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the notice-generation exports and the violation archive as CSV.
 *
 * Output path patterns:
 *   {outputDir}/roster_{kind}_{yyyyMMdd'T'HHmm}.csv      one row per entity
 *   {outputDir}/detail_{kind}_{yyyyMMdd'T'HHmm}.csv      one row per entity-violation pair
 *   {outputDir}/violations_{label}.csv                    ingested facts, CSV output mode
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm");

    static final String[] ROSTER_HEADERS = {
            "entity_key", "entity_kind", "tier", "super_speeder",
            "total", "unit", "violation_count", "severe_count",
            "first_violation", "last_violation", "jurisdictions",
            "risk_score", "risk_level",
            "enforcement_status", "enforcement_due_date", "reason"
    };

    static final String[] DETAIL_HEADERS = {
            "entity_key", "entity_kind", "tier", "total", "enforcement_status",
            "record_id", "violation_code", "points", "severity",
            "occurred_at", "disposition", "jurisdiction", "source_type"
    };

    static final String[] VIOLATION_HEADERS = {
            "record_id", "entity_key", "entity_kind", "source_type",
            "violation_code", "points", "severity", "disposition",
            "occurred_at", "jurisdiction"
    };

    private final IsaEngineProperties properties;

    // ── File exports ──────────────────────────────────────────────────────────

    public Path writeRoster(List<RosterEntry> entries, EntityKind kind, LocalDateTime referenceInstant) {
        Path path = outputPath(String.format("roster_%s_%s.csv", kind.name().toLowerCase(),
                FILE_STAMP.format(referenceInstant)));
        try (Writer out = new FileWriter(path.toFile(), StandardCharsets.UTF_8)) {
            writeRoster(out, entries);
        } catch (IOException e) {
            log.error("Failed to write roster CSV {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("Roster CSV write failed", e);
        }
        log.info("Written {} roster rows to CSV: {}", entries.size(), path);
        return path;
    }

    public Path writeDetail(List<EntityDetail> details, EntityKind kind, LocalDateTime referenceInstant) {
        Path path = outputPath(String.format("detail_%s_%s.csv", kind.name().toLowerCase(),
                FILE_STAMP.format(referenceInstant)));
        try (Writer out = new FileWriter(path.toFile(), StandardCharsets.UTF_8)) {
            writeDetail(out, details);
        } catch (IOException e) {
            log.error("Failed to write detail CSV {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("Detail CSV write failed", e);
        }
        log.info("Written detail for {} entities to CSV: {}", details.size(), path);
        return path;
    }

    public void writeViolations(List<ViolationRecord> records, String label) {
        if (records.isEmpty()) return;

        Path path = outputPath(String.format("violations_%s.csv", label));
        try (CSVWriter writer = newWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8))) {
            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(VIOLATION_HEADERS);
            }
            for (ViolationRecord r : records) {
                writer.writeNext(new String[]{
                        str(r.getRecordId()),
                        str(r.getEntityKey()),
                        str(r.getEntityKind()),
                        str(r.getSourceType()),
                        str(r.getViolationCode()),
                        str(r.getPoints()),
                        str(r.getSeverity()),
                        str(r.getDisposition()),
                        str(r.getOccurredAt()),
                        str(r.getJurisdiction())
                });
            }
            log.info("Written {} violations to CSV: {}", records.size(), path);
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed", e);
        }
    }

    // ── Stream exports (HTTP responses) ───────────────────────────────────────

    public void writeRoster(Writer out, List<RosterEntry> entries) throws IOException {
        CSVWriter writer = newWriter(out);
        if (properties.getOutput().getCsv().isIncludeHeader()) {
            writer.writeNext(ROSTER_HEADERS);
        }
        for (RosterEntry e : entries) {
            writer.writeNext(toRosterRow(e));
        }
        writer.flush();
    }

    public void writeDetail(Writer out, List<EntityDetail> details) throws IOException {
        CSVWriter writer = newWriter(out);
        if (properties.getOutput().getCsv().isIncludeHeader()) {
            writer.writeNext(DETAIL_HEADERS);
        }
        for (EntityDetail d : details) {
            RosterEntry e = d.getEntry();
            for (ViolationRecord v : d.getViolations()) {
                writer.writeNext(new String[]{
                        str(e.getEntityKey()),
                        str(e.getEntityKind()),
                        str(e.getTier()),
                        str(e.getTotal()),
                        statusOf(e),
                        str(v.getRecordId()),
                        str(v.getViolationCode()),
                        str(v.getPoints()),
                        str(v.getSeverity()),
                        str(v.getOccurredAt()),
                        str(v.getDisposition()),
                        str(v.getJurisdiction()),
                        str(v.getSourceType())
                });
            }
        }
        writer.flush();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String[] toRosterRow(RosterEntry e) {
        return new String[]{
                str(e.getEntityKey()),
                str(e.getEntityKind()),
                str(e.getTier()),
                str(e.isSuperSpeeder()),
                str(e.getTotal()),
                e.getEntityKind() == null ? "" : e.getEntityKind().getUnit(),
                str(e.getViolationCount()),
                str(e.getSevereCount()),
                str(e.getFirstViolation()),
                str(e.getLastViolation()),
                e.getJurisdictions() == null ? "" : String.join("; ", e.getJurisdictions()),
                str(e.getRiskScore()),
                str(e.getRiskLevel()),
                statusOf(e),
                str(e.getEnforcementDueDate()),
                str(e.getReason())
        };
    }

    private String statusOf(RosterEntry e) {
        return e.getEnforcementStatus() == null ? "NONE" : e.getEnforcementStatus().name();
    }

    private CSVWriter newWriter(Writer out) {
        return new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }

    private Path outputPath(String filename) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);
        return outputDir.resolve(filename);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
