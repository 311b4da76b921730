package com.clipflow.publisher.dto;

public record IngestionReport(int updated, int skipped, int failed) {

    public static final IngestionReport EMPTY = new IngestionReport(0, 0, 0);

    public IngestionReport plus(IngestionReport other) {
        return new IngestionReport(updated + other.updated, skipped + other.skipped, failed + other.failed);
    }
}
