package com.hydrokb.ingest;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Relational side of the knowledge base: documents own their chunks, chunks carry the
 * embedding column. Chunk ids are assigned by the store and grow monotonically, so they double
 * as a stable paging cursor.
 */
public interface KnowledgeStore {

    StoredDocument insert(Document document, List<Chunk> chunks);

    Optional<Document> findDocument(String documentId);

    List<Document> findDocuments(DocumentFilter filter);

    void updateDocument(Document document);

    List<Chunk> replaceChunks(String documentId, List<Chunk> chunks);

    List<Chunk> chunksOf(String documentId);

    /**
     * Chunks with the given ids, ascending by id. Unknown ids are ignored.
     */
    List<Chunk> findChunks(Collection<Long> chunkIds);

    /**
     * Removes the document and every chunk it owns.
     *
     * @return the removed chunks, empty when the document did not exist
     */
    List<Chunk> deleteDocument(String documentId);

    long countChunks();

    long countDocuments();

    /**
     * Chunks with an id strictly greater than {@code afterId}, ascending by id.
     */
    List<Chunk> listChunksAfter(long afterId, int pageSize);

    void updateEmbedding(long chunkId, StoredEmbedding embedding);
}
