package com.hydrokb.vector;

import java.util.List;

import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;

/**
 * Index-side mirror of a chunk. The id is the chunk's primary key rendered as text; the other
 * fields are denormalized from the owning document so the index can filter without a join.
 */
public record VectorRecord(
        String id,
        float[] vector,
        String content,
        String documentId,
        String documentTitle,
        String category,
        List<String> regions,
        String language,
        long timestamp) {

    public VectorRecord {
        vector = vector == null ? new float[0] : vector;
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public static VectorRecord of(Chunk chunk, Document document, float[] vector, long timestamp) {
        return new VectorRecord(
                idOf(chunk.id()),
                vector,
                chunk.content(),
                document.id(),
                document.title(),
                document.category(),
                document.regions(),
                document.language(),
                timestamp);
    }

    public static String idOf(long chunkId) {
        return Long.toString(chunkId);
    }

    public int dimension() {
        return vector.length;
    }
}
