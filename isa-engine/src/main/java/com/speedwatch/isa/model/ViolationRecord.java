package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One validated violation fact.
 *
 * Design notes:
 *  - recordId is the source-provided natural identity (summons / ticket number) and
 *    the primary deduplication key; it may be null for feeds that carry none
 *  - occurredAt is local time at the place of the violation; nighttime detection
 *    reads its time-of-day directly
 *  - points and severity are resolved from the violation code catalog at ingest
 *  - sequence is the ingest order and decides which copy of a duplicate survives
 */
@Value
@Builder(toBuilder = true)
public class ViolationRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Summons / ticket number. Null when the feed has none. */
    String recordId;

    /** Upper-cased license number (DRIVER) or PLATE:STATE (VEHICLE). */
    String entityKey;

    EntityKind entityKind;

    SourceType sourceType;

    // ── Classification ──────────────────────────────────────────────────────
    /** Normalised violation code, e.g. 1180D. */
    String violationCode;

    int points;

    SeverityTier severity;

    Disposition disposition;

    // ── Time and place ──────────────────────────────────────────────────────
    LocalDateTime occurredAt;

    /** County / agency label; null when the feed does not say. */
    String jurisdiction;

    // ── Lineage ─────────────────────────────────────────────────────────────
    /** Monotonic ingest order. Lower values were seen first. */
    long sequence;

    public boolean hasRecordId() {
        return recordId != null && !recordId.isBlank();
    }

    /**
     * Natural identity used for deduplication. Falls back to
     * kind|entity|occurredAt|code when no record id is present; that key is lossier,
     * two distinct violations of the same code at the same instant collapse into one.
     */
    public String dedupKey() {
        if (hasRecordId()) {
            return "ID|" + recordId.trim().toUpperCase();
        }
        return "FB|" + entityKind + "|" + entityKey + "|" + occurredAt + "|" + violationCode;
    }

    public boolean isSustained() {
        return disposition != null && disposition.countsTowardTotals();
    }

    /**
     * True when both records describe the same event with the same payload,
     * ignoring ingest order.
     */
    public boolean samePayloadAs(ViolationRecord other) {
        return other != null
                && Objects.equals(entityKey, other.entityKey)
                && entityKind == other.entityKind
                && Objects.equals(violationCode, other.violationCode)
                && Objects.equals(occurredAt, other.occurredAt)
                && disposition == other.disposition
                && Objects.equals(jurisdiction, other.jurisdiction);
    }
}
