package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.ViolationRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses violation records to one per dedup key.
 *
 * Tie-break: the first copy offered wins and is never replaced. Callers offer records
 * in the order they were seen (history before incoming, earlier rows before later
 * rows), which makes the surviving copy the earliest-seen one on every run.
 *
 * Not thread-safe; {@link ViolationStore} guards its instance with a lock.
 */
public class ViolationDeduplicator {

    public enum Outcome { ACCEPTED, DUPLICATE, CONFLICTING_DUPLICATE }

    private final Map<String, ViolationRecord> byKey = new LinkedHashMap<>();

    public Outcome offer(ViolationRecord record) {
        String key = record.dedupKey();
        ViolationRecord existing = byKey.putIfAbsent(key, record);
        if (existing == null) {
            return Outcome.ACCEPTED;
        }
        return existing.samePayloadAs(record) ? Outcome.DUPLICATE : Outcome.CONFLICTING_DUPLICATE;
    }

    public void offerAll(Collection<ViolationRecord> records) {
        records.forEach(this::offer);
    }

    public ViolationRecord get(String dedupKey) {
        return byKey.get(dedupKey);
    }

    public int size() {
        return byKey.size();
    }

    /** Surviving records in first-seen order. */
    public List<ViolationRecord> records() {
        return new ArrayList<>(byKey.values());
    }

    public static List<ViolationRecord> deduplicate(Collection<ViolationRecord> records) {
        ViolationDeduplicator dedup = new ViolationDeduplicator();
        dedup.offerAll(records);
        return dedup.records();
    }
}
