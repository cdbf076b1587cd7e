package com.hydrokb.health;

/**
 * Embedding state of one document. {@code staleChunks} counts well-formed vectors whose width
 * differs from the active provider's.
 */
public record DocumentIndexReport(
        String documentId,
        String title,
        String category,
        DocumentIndexStatus status,
        int totalChunks,
        int chunksWithEmbeddings,
        int corruptedChunks,
        int staleChunks,
        int indexingPercentage) {
}
