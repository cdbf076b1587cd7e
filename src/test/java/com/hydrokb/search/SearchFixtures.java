package com.hydrokb.search;

import java.time.Instant;
import java.util.List;

import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentMetadata;
import com.hydrokb.ingest.DocumentStatus;
import com.hydrokb.ingest.StoredEmbedding;

final class SearchFixtures {
    static final Instant CREATED = Instant.parse("2024-03-01T00:00:00Z");

    private SearchFixtures() {
    }

    static Document document(String id) {
        return new Document(id, "hydraulics", "hydraulics", List.of("spain"), "Manual " + id, "",
                DocumentMetadata.empty("es"), "1", DocumentStatus.ACTIVE, CREATED, CREATED);
    }

    static Candidate candidate(long chunkId, String documentId, String content) {
        return new Candidate(new Chunk(chunkId, documentId, 0, content, null), document(documentId));
    }

    static Candidate candidate(long chunkId, String documentId, String content, float... embedding) {
        return new Candidate(new Chunk(chunkId, documentId, 0, content, StoredEmbedding.of("test", embedding)),
                document(documentId));
    }

    static ScoredChunk scored(long chunkId, String documentId, String content, double score, SearchMethod method) {
        return ScoredChunk.of(candidate(chunkId, documentId, content), score, method);
    }
}
