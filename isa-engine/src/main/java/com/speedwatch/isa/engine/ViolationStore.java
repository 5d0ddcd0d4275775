package com.speedwatch.isa.engine;

import com.speedwatch.isa.model.DeduplicationReport;
import com.speedwatch.isa.model.EntityKind;
import com.speedwatch.isa.model.RawViolationRow;
import com.speedwatch.isa.model.RowRejection;
import com.speedwatch.isa.model.SourceType;
import com.speedwatch.isa.model.ViolationRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Append-only set of deduplicated violation facts.
 *
 * Stored records are never replaced or removed; a later copy of a known dedup key is
 * counted as a duplicate and dropped. Corrections arrive as superseding batches that
 * the calling system handles. Readers work on immutable snapshots, so detection runs
 * never observe a half-applied ingest.
 */
@Component
@Slf4j
public class ViolationStore {

    private final ViolationRecordMapper mapper;
    private final ViolationDeduplicator index = new ViolationDeduplicator();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ViolationStore(ViolationRecordMapper mapper) {
        this.mapper = mapper;
    }

    /** Validated records and the rows that failed validation. */
    public record PreparedBatch(int received, List<ViolationRecord> records, List<RowRejection> rejections) {}

    /** Report of an append plus the records that were new to the store. */
    public record AppendResult(DeduplicationReport report, List<ViolationRecord> added) {}

    /** What an inspector made of the history, the history itself, and the append that followed. */
    public record InspectedAppend<T>(T inspection, List<ViolationRecord> history, AppendResult appended) {}

    /**
     * Validate and ingest raw rows. Each row must name its source type.
     */
    public DeduplicationReport ingest(List<RawViolationRow> rows) {
        return ingest(rows, null);
    }

    /**
     * Validate and ingest raw rows; rows that do not name a source are taken to be from
     * {@code defaultSource}. Invalid rows are rejected individually and reported.
     */
    public DeduplicationReport ingest(List<RawViolationRow> rows, SourceType defaultSource) {
        PreparedBatch batch = prepare(rows, defaultSource);
        return append(batch).report();
    }

    /**
     * Validate rows without storing them. Sequence numbers are assigned now, so a batch
     * prepared earlier still sorts before one prepared later.
     */
    public PreparedBatch prepare(List<RawViolationRow> rows, SourceType defaultSource) {
        return prepare(rows, defaultSource, null);
    }

    /**
     * Validate rows for a run that only examines {@code onlyKind}. Valid rows of the
     * other kind are rejected, so nothing reaches the store without being examined.
     * A null kind accepts both.
     */
    public PreparedBatch prepare(List<RawViolationRow> rows, SourceType defaultSource, EntityKind onlyKind) {
        List<ViolationRecord> records = new ArrayList<>(rows.size());
        List<RowRejection> rejections = new ArrayList<>();
        int rowNumber = 0;
        for (RawViolationRow row : rows) {
            rowNumber++;
            if (row.getRowNumber() <= 0) {
                row.setRowNumber(rowNumber);
            }
            ViolationRecordMapper.Result result = mapper.map(row, defaultSource, sequence.incrementAndGet());
            if (result.isAccepted() && onlyKind != null && result.record().getEntityKind() != onlyKind) {
                rejections.add(new RowRejection(row.getRowNumber(), result.record().getRecordId(),
                        result.record().getEntityKind() + " record in a " + onlyKind + " run"));
            } else if (result.isAccepted()) {
                records.add(result.record());
            } else {
                rejections.add(result.rejection());
            }
        }
        return new PreparedBatch(rows.size(), records, rejections);
    }

    /**
     * Append a prepared batch.
     */
    public AppendResult append(PreparedBatch batch) {
        DeduplicationReport.DeduplicationReportBuilder report = DeduplicationReport.builder()
                .received(batch.received())
                .rejections(batch.rejections());

        List<ViolationRecord> added = appendInto(batch.records(), report);
        DeduplicationReport result = report.build();

        log.info("Ingested batch: {} received, {} accepted, {} duplicates ({} conflicting), {} rejected",
                result.getReceived(), result.getAccepted(), result.getDuplicates(),
                result.getConflictingDuplicates(), result.getRejected());
        if (result.getRejected() > 0) {
            log.warn("{} rows rejected, first: row {} ({})", result.getRejected(),
                    batch.rejections().get(0).rowNumber(), batch.rejections().get(0).reason());
        }
        return new AppendResult(result, added);
    }

    /**
     * Hand the current history to {@code inspector} and append the batch, with no other
     * append in between. Detection uses this so two concurrent batches are judged one
     * after the other. If the inspector throws, nothing is appended.
     */
    public <T> InspectedAppend<T> inspectAndAppend(PreparedBatch batch, Function<List<ViolationRecord>, T> inspector) {
        lock.writeLock().lock();
        try {
            List<ViolationRecord> history = snapshot();
            T inspection = inspector.apply(history);
            return new InspectedAppend<>(inspection, history, append(batch));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Append records that were validated elsewhere, e.g. history reloaded from the
     * archive. Their sequence numbers are reassigned to follow anything already stored.
     */
    public DeduplicationReport restore(Collection<ViolationRecord> records) {
        List<ViolationRecord> resequenced = new ArrayList<>(records.size());
        for (ViolationRecord r : records) {
            resequenced.add(r.toBuilder().sequence(sequence.incrementAndGet()).build());
        }
        DeduplicationReport.DeduplicationReportBuilder report = DeduplicationReport.builder()
                .received(records.size());
        appendInto(resequenced, report);
        return report.build();
    }

    /** Immutable view of every stored record, in first-seen order. */
    public List<ViolationRecord> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(index.records());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ViolationRecord> snapshot(EntityKind kind) {
        return snapshot().stream()
                .filter(r -> r.getEntityKind() == kind)
                .toList();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ViolationRecord> appendInto(List<ViolationRecord> records,
                                             DeduplicationReport.DeduplicationReportBuilder report) {
        List<ViolationRecord> added = new ArrayList<>();
        int duplicates = 0;
        int conflicting = 0;
        int fallbackKeyed = 0;

        lock.writeLock().lock();
        try {
            for (ViolationRecord record : records) {
                switch (index.offer(record)) {
                    case ACCEPTED -> {
                        added.add(record);
                        if (!record.hasRecordId()) fallbackKeyed++;
                    }
                    case DUPLICATE -> duplicates++;
                    case CONFLICTING_DUPLICATE -> {
                        duplicates++;
                        conflicting++;
                        log.warn("Conflicting duplicate for {} ignored; first-seen copy kept", record.dedupKey());
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        report.accepted(added.size())
                .duplicates(duplicates)
                .conflictingDuplicates(conflicting)
                .fallbackKeyed(fallbackKeyed);
        return added;
    }
}
