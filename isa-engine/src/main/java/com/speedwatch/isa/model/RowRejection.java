package com.speedwatch.isa.model;

/**
 * A row refused at ingest, with the reason it was refused.
 */
public record RowRejection(int rowNumber, String recordId, String reason) {}
