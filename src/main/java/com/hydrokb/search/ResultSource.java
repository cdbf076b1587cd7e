package com.hydrokb.search;

import java.time.Instant;
import java.util.List;

import com.hydrokb.ingest.Document;

/**
 * Provenance of a result: the owning document's identity and the fields quality scoring reads.
 */
public record ResultSource(
        String documentId,
        long chunkId,
        int chunkIndex,
        String title,
        String category,
        String subcategory,
        List<String> regions,
        Instant createdAt,
        int referenceCount) {

    public ResultSource {
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public static ResultSource of(ScoredChunk scored) {
        Document document = scored.document();
        return new ResultSource(
                document.id(),
                scored.chunkId(),
                scored.chunk().chunkIndex(),
                document.title(),
                document.category(),
                document.subcategory(),
                document.regions(),
                document.createdAt(),
                document.metadata().references().size());
    }
}
