package com.hydrokb.health;

import java.util.List;

public record IndexingValidationReport(
        int totalDocuments,
        int complete,
        int partial,
        int notIndexed,
        int corrupted,
        List<DocumentIndexReport> documents) {

    public IndexingValidationReport {
        documents = List.copyOf(documents);
    }
}
