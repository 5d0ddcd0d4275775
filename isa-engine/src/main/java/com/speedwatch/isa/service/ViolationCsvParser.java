package com.speedwatch.isa.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.speedwatch.isa.exception.MissingIdentifierColumnException;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses court and camera CSV exports into {@link RawViolationRow}s.
 *
 * Headers are matched case-insensitively against the aliases used by the known feeds
 * ("Summons Number", "summons_number" and "record_id" all land in recordId).
 * Values are passed through untouched; validation happens in the record mapper, so a
 * bad value rejects its row and never the file. A missing identifier column does
 * reject the whole file.
 *
 * Feeds without a plate state column are NY camera exports; their rows get "NY".
 */
@Component
@Slf4j
public class ViolationCsvParser {

    static final String DEFAULT_PLATE_STATE = "NY";

    private static final Map<String, Field> ALIASES = new HashMap<>();

    enum Field {
        RECORD_ID("summons_number", "record_id", "ticket_number"),
        SOURCE_TYPE("source_type"),
        LICENSE("driver_license_number", "license_number", "license_id", "lic_id"),
        PLATE("plate_id", "plate"),
        PLATE_STATE("plate_state", "state", "registration_state"),
        CODE("violation_code", "violation", "v_code"),
        OCCURRED_AT("date_of_violation", "occurred_at", "issue_date", "violation_date"),
        DISPOSITION("disposition", "violation_status"),
        JURISDICTION("jurisdiction", "police_agency", "county", "issuing_agency");

        private final List<String> aliases;

        Field(String... aliases) {
            this.aliases = Arrays.asList(aliases);
        }
    }

    static {
        for (Field f : Field.values()) {
            f.aliases.forEach(alias -> ALIASES.put(alias, f));
        }
    }

    /**
     * @param sourceType feed type of the whole file, or null when every row carries a
     *                   source_type column
     * @throws MissingIdentifierColumnException when a column needed to key or date the
     *         rows is absent
     * @throws IOException on read failures and malformed CSV
     */
    public List<RawViolationRow> parse(Reader reader, SourceType sourceType) throws IOException {
        try (CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                return List.of();
            }

            Map<Field, Integer> columns = resolveColumns(header);
            requireColumns(columns, sourceType);

            List<RawViolationRow> rows = new ArrayList<>();
            int rowNumber = 0;
            int blank = 0;
            String[] line;
            while ((line = csv.readNext()) != null) {
                if (isBlank(line)) {
                    blank++;
                    continue;
                }
                rowNumber++;
                rows.add(toRow(line, columns, rowNumber));
            }

            log.info("Parsed {} violation rows ({} source, {} blank lines skipped)",
                    rows.size(), sourceType == null ? "mixed" : sourceType, blank);
            return rows;
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
    }

    // ── Header handling ──────────────────────────────────────────────────────

    static Map<Field, Integer> resolveColumns(String[] header) {
        Map<Field, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            Field field = ALIASES.get(normaliseHeader(header[i]));
            if (field != null) {
                columns.putIfAbsent(field, i);
            }
        }
        return columns;
    }

    static String normaliseHeader(String name) {
        if (name == null) return "";
        // strip a UTF-8 BOM left on the first header by spreadsheet exports
        String cleaned = name.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        return cleaned.replaceAll("[\\s\\-]+", "_");
    }

    private void requireColumns(Map<Field, Integer> columns, SourceType sourceType) {
        List<String> missing = new ArrayList<>();
        if (!columns.containsKey(Field.CODE)) missing.add("violation_code");
        if (!columns.containsKey(Field.OCCURRED_AT)) missing.add("date_of_violation");

        if (sourceType == null) {
            if (!columns.containsKey(Field.SOURCE_TYPE)) missing.add("source_type");
        } else if (sourceType == SourceType.OFFICER) {
            if (!columns.containsKey(Field.LICENSE)) missing.add("license_number");
        } else if (!columns.containsKey(Field.PLATE)) {
            missing.add("plate_id");
        }

        if (!missing.isEmpty()) {
            throw new MissingIdentifierColumnException(sourceType, missing);
        }
    }

    // ── Rows ─────────────────────────────────────────────────────────────────

    private RawViolationRow toRow(String[] line, Map<Field, Integer> columns, int rowNumber) {
        String plateState = get(line, columns, Field.PLATE_STATE);
        if (!columns.containsKey(Field.PLATE_STATE)) {
            plateState = DEFAULT_PLATE_STATE;
        }
        return RawViolationRow.builder()
                .rowNumber(rowNumber)
                .recordId(get(line, columns, Field.RECORD_ID))
                .sourceType(get(line, columns, Field.SOURCE_TYPE))
                .licenseNumber(get(line, columns, Field.LICENSE))
                .plateId(get(line, columns, Field.PLATE))
                .plateState(plateState)
                .violationCode(get(line, columns, Field.CODE))
                .occurredAt(get(line, columns, Field.OCCURRED_AT))
                .disposition(get(line, columns, Field.DISPOSITION))
                .jurisdiction(get(line, columns, Field.JURISDICTION))
                .build();
    }

    private String get(String[] line, Map<Field, Integer> columns, Field field) {
        Integer idx = columns.get(field);
        if (idx == null || idx >= line.length || line[idx] == null) return null;
        String val = line[idx].trim();
        return val.isEmpty() ? null : val;
    }

    private boolean isBlank(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }
}
