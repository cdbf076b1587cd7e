package com.hydrokb.vector;

public record VectorHit(String id, double score, VectorRecord record) {

    /**
     * Chunk primary key behind this hit, or -1 when the id was not written by this engine.
     */
    public long chunkId() {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
