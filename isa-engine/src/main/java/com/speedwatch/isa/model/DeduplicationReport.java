package com.speedwatch.isa.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one ingest call.
 *
 * received = accepted + duplicates + rejections.size()
 */
@Value
@Builder
public class DeduplicationReport {

    int received;

    /** New facts added to the store. */
    int accepted;

    /** Rows whose dedup key was already known (in the store or earlier in the batch). */
    int duplicates;

    /** Subset of duplicates whose payload differed from the surviving copy. */
    int conflictingDuplicates;

    /** Accepted rows that had no record id and were keyed by the composite fallback. */
    int fallbackKeyed;

    @Singular
    List<RowRejection> rejections;

    public int getRejected() {
        return rejections.size();
    }
}
