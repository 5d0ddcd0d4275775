package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.Disposition;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.RowRejection;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Validates raw rows and maps them to {@link ViolationRecord}s.
 *
 * A row is rejected, with a reason, when it lacks its entity identifier, its
 * timestamp or its violation code, when the timestamp cannot be parsed, or when the
 * code is not in the catalog. Rejection never throws; one bad row does not stop a batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ViolationRecordMapper {

    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm[:ss]"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private final ViolationCodeCatalog catalog;

    /** Either a record or the reason there is none. */
    public record Result(ViolationRecord record, RowRejection rejection) {
        public boolean isAccepted() {
            return record != null;
        }
    }

    /**
     * @param row           raw row; its rowNumber is echoed in any rejection
     * @param defaultSource source to assume when the row does not name one; may be null
     * @param sequence      ingest order stamped on the record
     */
    public Result map(RawViolationRow row, SourceType defaultSource, long sequence) {
        String recordId = emptyToNull(row.getRecordId());

        SourceType source;
        String feedSource = emptyToNull(row.getSourceType());
        if (feedSource != null) {
            source = SourceType.fromFeedValue(feedSource);
            if (source == null) {
                return reject(row, recordId, "unknown source type '" + feedSource + "'");
            }
        } else if (defaultSource != null) {
            source = defaultSource;
        } else {
            return reject(row, recordId, "missing source type");
        }

        String entityKey;
        if (source.getEntityKind() == EntityKind.DRIVER) {
            String license = emptyToNull(row.getLicenseNumber());
            if (license == null) return reject(row, recordId, "missing license number");
            entityKey = license.trim().toUpperCase();
        } else {
            String plate = emptyToNull(row.getPlateId());
            if (plate == null) return reject(row, recordId, "missing plate id");
            String state = emptyToNull(row.getPlateState());
            if (state == null) return reject(row, recordId, "missing plate state");
            entityKey = vehicleKey(plate, state);
        }

        String rawCode = emptyToNull(row.getViolationCode());
        if (rawCode == null) return reject(row, recordId, "missing violation code");

        String rawTimestamp = emptyToNull(row.getOccurredAt());
        if (rawTimestamp == null) return reject(row, recordId, "missing violation timestamp");

        Optional<LocalDateTime> occurredAt = parseTimestamp(rawTimestamp);
        if (occurredAt.isEmpty()) {
            return reject(row, recordId, "unparseable timestamp '" + rawTimestamp + "'");
        }

        Optional<ViolationCodeCatalog.CodeDefinition> code = catalog.resolve(rawCode);
        if (code.isEmpty()) {
            return reject(row, recordId, "unknown violation code '" + rawCode + "'");
        }

        ViolationRecord record = ViolationRecord.builder()
                .recordId(recordId == null ? null : recordId.trim())
                .entityKey(entityKey)
                .entityKind(source.getEntityKind())
                .sourceType(source)
                .violationCode(code.get().code())
                .points(code.get().points())
                .severity(code.get().severity())
                .disposition(Disposition.fromFeedValue(row.getDisposition()))
                .occurredAt(occurredAt.get())
                .jurisdiction(normaliseJurisdiction(row.getJurisdiction()))
                .sequence(sequence)
                .build();

        return new Result(record, null);
    }

    public static String vehicleKey(String plate, String state) {
        return plate.trim().toUpperCase().replace(" ", "") + ":" + state.trim().toUpperCase();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static Optional<LocalDateTime> parseTimestamp(String value) {
        String v = value.trim();
        LocalDateTime parsed = parseOffset(v);
        for (DateTimeFormatter f : LOCAL_DATE_TIME_FORMATS) {
            if (parsed == null) parsed = parseLocal(v, f);
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            if (parsed == null) parsed = parseDate(v, f);
        }
        return Optional.ofNullable(parsed);
    }

    private static LocalDateTime parseOffset(String v) {
        try { return OffsetDateTime.parse(v).toLocalDateTime(); }
        catch (DateTimeParseException e) { return null; }
    }

    private static LocalDateTime parseLocal(String v, DateTimeFormatter f) {
        try { return LocalDateTime.parse(v, f); }
        catch (DateTimeParseException e) { return null; }
    }

    private static LocalDateTime parseDate(String v, DateTimeFormatter f) {
        try { return LocalDate.parse(v, f).atStartOfDay(); }
        catch (DateTimeParseException e) { return null; }
    }

    private Result reject(RawViolationRow row, String recordId, String reason) {
        log.debug("Row {} rejected: {}", row.getRowNumber(), reason);
        return new Result(null, new RowRejection(row.getRowNumber(), recordId, reason));
    }

    private String normaliseJurisdiction(String value) {
        String v = emptyToNull(value);
        return v == null ? null : v.trim().toUpperCase();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank() || val.trim().equalsIgnoreCase("null")) ? null : val;
    }
}
