package com.hydrokb.ingest;

public record Chunk(long id, String documentId, int chunkIndex, String content, StoredEmbedding embedding) {

    public boolean hasEmbedding() {
        return embedding != null && embedding.values().length > 0;
    }

    public Chunk withEmbedding(StoredEmbedding newEmbedding) {
        return new Chunk(id, documentId, chunkIndex, content, newEmbedding);
    }

    public Chunk withId(long newId, String newDocumentId) {
        return new Chunk(newId, newDocumentId, chunkIndex, content, embedding);
    }
}
