package com.speedwatch.isa.exception;

import com.speedwatch.isa.model.SourceType;
import lombok.Getter;

import java.util.List;

/**
 * A source file lacks a column it cannot be ingested without, typically the license
 * column of an officer feed or the plate column of a camera feed. The whole file is
 * refused; no synthetic key is substituted.
 */
@Getter
public class MissingIdentifierColumnException extends RuntimeException {

    private final SourceType sourceType;
    private final List<String> missingColumns;

    public MissingIdentifierColumnException(SourceType sourceType, List<String> missingColumns) {
        super("Source " + sourceType + " is missing required column(s): " + String.join(", ", missingColumns));
        this.sourceType = sourceType;
        this.missingColumns = List.copyOf(missingColumns);
    }
}
