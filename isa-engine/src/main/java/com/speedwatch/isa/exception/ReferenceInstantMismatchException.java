package com.speedwatch.isa.exception;

/**
 * Baseline and current aggregates were computed against different windows.
 * Comparing them would report crossings caused by the window shift rather than by
 * new records, so this is a programming error and is never recovered from.
 */
public class ReferenceInstantMismatchException extends IllegalStateException {

    public ReferenceInstantMismatchException(String message) {
        super(message);
    }
}
