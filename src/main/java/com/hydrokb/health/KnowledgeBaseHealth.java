package com.hydrokb.health;

import java.util.List;
import java.util.Map;

/**
 * Coverage figures are percentages rounded to whole numbers. {@code vectorIndexRows} is -1 when
 * the index could not be reached.
 */
public record KnowledgeBaseHealth(
        HealthStatus status,
        long totalDocuments,
        long totalChunks,
        long chunksWithEmbeddings,
        int embeddingCoverage,
        int indexedPercentage,
        long averageChunksPerDocument,
        long vectorIndexRows,
        Map<String, Long> documentsByCategory,
        List<String> issues) {

    public KnowledgeBaseHealth {
        documentsByCategory = Map.copyOf(documentsByCategory);
        issues = List.copyOf(issues);
    }
}
