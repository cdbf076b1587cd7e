package com.hydrokb.ingest;

import java.util.List;

/**
 * Outcome of storing one document. {@code errors} lists the chunks stored without a vector and
 * why.
 */
public record IngestionReport(
        String documentId,
        int totalChunks,
        int embeddedChunks,
        int degradedChunks,
        int failedChunks,
        int indexedRecords,
        List<String> errors) {

    public IngestionReport {
        errors = List.copyOf(errors);
    }
}
