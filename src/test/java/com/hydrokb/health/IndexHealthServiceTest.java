package com.hydrokb.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.HashingFallbackEmbeddingProvider;
import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentMetadata;
import com.hydrokb.ingest.DocumentStatus;
import com.hydrokb.ingest.LocalJsonKnowledgeStore;
import com.hydrokb.ingest.StoredDocument;
import com.hydrokb.ingest.StoredEmbedding;
import com.hydrokb.vector.CollectionDescription;
import com.hydrokb.vector.LocalJsonVectorIndex;
import com.hydrokb.vector.VectorIndexException;

class IndexHealthServiceTest {
    private static final String COLLECTION = "kb";

    private final LocalJsonKnowledgeStore store = new LocalJsonKnowledgeStore();
    private final LocalJsonVectorIndex index = new LocalJsonVectorIndex();
    private final EmbeddingProviderRegistry registry = EmbeddingProviderRegistry.of(new HashingFallbackEmbeddingProvider(4));

    @Test
    void shouldClassifyDocumentsByEmbeddingState() {
        store.insert(document("complete", "hydraulics"), List.of(chunk(vector(4)), chunk(vector(4))));
        store.insert(document("partial", "hydraulics"), List.of(chunk(vector(4)), chunk(null)));
        store.insert(document("missing", "regulations"), List.of(chunk(null)));
        store.insert(document("broken", "regulations"), List.of(chunk(vector(4)), chunk(malformed())));
        store.insert(document("stale", "hydraulics"), List.of(chunk(vector(2))));

        IndexingValidationReport report = new IndexHealthService(store, index, COLLECTION, registry).validateIndexing();

        assertEquals(5, report.totalDocuments());
        assertEquals(2, report.complete());
        assertEquals(1, report.partial());
        assertEquals(1, report.notIndexed());
        assertEquals(1, report.corrupted());
        DocumentIndexReport partial = find(report, "partial");
        assertEquals(DocumentIndexStatus.PARTIAL, partial.status());
        assertEquals(50, partial.indexingPercentage());
        assertEquals(1, find(report, "stale").staleChunks());
        assertEquals(DocumentIndexStatus.CORRUPTED, find(report, "broken").status());
    }

    @Test
    void healthShouldReflectCoverageAndIndexState() {
        store.insert(document("a", "hydraulics"), List.of(chunk(vector(4)), chunk(null)));
        store.insert(document("b", "regulations"), List.of(chunk(vector(4))));

        KnowledgeBaseHealth health = new IndexHealthService(store, index, COLLECTION, registry).health();

        assertEquals(HealthStatus.DEGRADED, health.status());
        assertEquals(67, health.embeddingCoverage());
        assertEquals(100, health.indexedPercentage());
        assertEquals(2L, health.documentsByCategory().values().stream().mapToLong(Long::longValue).sum());
        assertTrue(health.issues().contains("1 chunks missing embeddings"));
        assertTrue(health.issues().contains("Vector collection kb does not exist"));
        assertEquals(0L, health.vectorIndexRows());
    }

    @Test
    void emptyKnowledgeBaseShouldBeCritical() {
        KnowledgeBaseHealth health = new IndexHealthService(store, index, COLLECTION, registry).health();

        assertEquals(HealthStatus.CRITICAL, health.status());
        assertTrue(health.issues().contains("No documents in knowledge base"));
    }

    @Test
    void fullCoverageWithReachableIndexShouldBeExcellent() {
        store.insert(document("a", "hydraulics"), List.of(chunk(vector(4))));
        index.createCollection(COLLECTION, 4);

        KnowledgeBaseHealth health = new IndexHealthService(store, index, COLLECTION, registry).health();

        assertEquals(HealthStatus.EXCELLENT, health.status());
        assertTrue(health.issues().isEmpty());
    }

    @Test
    void unreachableIndexShouldBeReported() {
        store.insert(document("a", "hydraulics"), List.of(chunk(vector(4))));
        LocalJsonVectorIndex down = new LocalJsonVectorIndex() {
            @Override
            public synchronized Optional<CollectionDescription> describe(String collection) {
                throw new VectorIndexException("connection refused");
            }
        };

        KnowledgeBaseHealth health = new IndexHealthService(store, down, COLLECTION, registry).health();

        assertEquals(-1L, health.vectorIndexRows());
        assertEquals(HealthStatus.HEALTHY, health.status());
        assertTrue(health.issues().contains("Vector index unreachable"));
    }

    @Test
    void shouldClearMalformedEmbeddings() {
        StoredDocument stored = store.insert(document("broken", "hydraulics"), List.of(chunk(malformed()), chunk(vector(4))));
        IndexHealthService service = new IndexHealthService(store, index, COLLECTION, registry);

        assertEquals(1, service.clearMalformedEmbeddings());

        List<Chunk> chunks = store.chunksOf(stored.document().id());
        assertNull(chunks.get(0).embedding());
        assertEquals(4, chunks.get(1).embedding().dimension());
        assertEquals(DocumentIndexStatus.PARTIAL, service.validateIndexing().documents().get(0).status());
    }

    private static DocumentIndexReport find(IndexingValidationReport report, String id) {
        return report.documents().stream().filter(document -> document.documentId().equals(id)).findFirst().orElseThrow();
    }

    private static Document document(String id, String category) {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return new Document(id, category, null, List.of(), "Doc " + id, "contenido", DocumentMetadata.empty("es"), "1",
                DocumentStatus.ACTIVE, now, now);
    }

    private static Chunk chunk(StoredEmbedding embedding) {
        return new Chunk(0L, null, 0, "texto", embedding);
    }

    private static StoredEmbedding vector(int dimension) {
        return StoredEmbedding.of("test", HashingFallbackEmbeddingProvider.generateMockEmbedding("x", dimension));
    }

    private static StoredEmbedding malformed() {
        return new StoredEmbedding("test", 4, new float[] {1f, Float.NaN, 0f, 0f});
    }
}
