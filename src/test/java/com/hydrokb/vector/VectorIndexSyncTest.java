package com.hydrokb.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingResult;
import com.hydrokb.embedding.HashingFallbackEmbeddingProvider;
import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentMetadata;
import com.hydrokb.ingest.DocumentStatus;
import com.hydrokb.ingest.LocalJsonKnowledgeStore;
import com.hydrokb.ingest.StoredDocument;
import com.hydrokb.ingest.StoredEmbedding;

class VectorIndexSyncTest {
    private static final String COLLECTION = "hydraulic_knowledge";
    private static final VectorIndexSync.Settings NO_PAUSE = new VectorIndexSync.Settings(50, 0L, 8000);

    private final LocalJsonKnowledgeStore store = new LocalJsonKnowledgeStore();
    private final CountingEmbeddingProvider provider = new CountingEmbeddingProvider("nomic", 768);
    private final EmbeddingProviderRegistry registry = EmbeddingProviderRegistry.of(provider);

    @Test
    void shouldReembedOnlyChunksOfTheWrongDimension() {
        StoredDocument stored = store.insert(document("doc-1"), List.of(
                chunk(0, "Vector antiguo de 384 dimensiones", 384),
                chunk(1, "Vector vigente de 768 dimensiones", 768)));
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION, NO_PAUSE);

        SyncReport report = sync.sync();

        assertEquals(SyncOutcome.COMPLETED, report.outcome());
        assertEquals(CollectionState.CREATED, report.collectionState());
        assertEquals(2, report.scanned());
        assertEquals(1, report.reembedded());
        assertEquals(2, report.upserted());
        assertEquals(List.of("Vector antiguo de 384 dimensiones"), provider.texts);

        Chunk migrated = store.chunksOf(stored.document().id()).get(0);
        assertEquals(768, migrated.embedding().dimension());
        assertEquals("nomic", migrated.embedding().providerId());
        assertEquals(2, index.getStatistics(COLLECTION).rowCount());
        assertEquals(SyncState.IDLE, sync.state());
    }

    @Test
    void secondPassWithoutWritesShouldDoNothing() {
        store.insert(document("doc-1"), List.of(chunk(0, "Sin vector", 0), chunk(1, "Otro sin vector", 0)));
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION, NO_PAUSE);

        SyncReport first = sync.sync();
        SyncReport second = sync.sync();

        assertEquals(2, first.reembedded());
        assertEquals(SyncOutcome.UP_TO_DATE, second.outcome());
        assertEquals(0, second.reembedded());
        assertEquals(0, second.upserted());
        assertEquals(2, provider.calls());
        assertEquals(first.epoch() + 1, second.epoch());
    }

    @Test
    void fullPassShouldRescanWithoutCallingProviderForFittingVectors() {
        store.insert(document("doc-1"), List.of(chunk(0, "Uno", 768), chunk(1, "Dos", 768)));
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION, NO_PAUSE);
        sync.sync();

        SyncReport full = sync.sync(SyncMode.FULL);

        assertEquals(SyncOutcome.COMPLETED, full.outcome());
        assertEquals(2, full.scanned());
        assertEquals(0, full.reembedded());
        assertEquals(0, provider.calls());
    }

    @Test
    void shouldRecreateCollectionBuiltForAnotherDimension() {
        store.insert(document("doc-1"), List.of(chunk(0, "Uno", 768)));
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        index.createCollection(COLLECTION, 384);
        index.insert(COLLECTION, List.of(new VectorRecord("99", new float[384], "viejo", "doc-0", "t", "c", List.of(),
                "es", 0L)));

        SyncReport report = new VectorIndexSync(store, index, registry, COLLECTION, NO_PAUSE).sync();

        assertEquals(CollectionState.RECREATED, report.collectionState());
        assertEquals(0, report.indexRowsBefore());
        assertEquals(768, index.describe(COLLECTION).orElseThrow().dimension());
        assertEquals(1, index.getStatistics(COLLECTION).rowCount());
    }

    @Test
    void failedBatchShouldNotStopTheScan() {
        store.insert(document("doc-1"), List.of(chunk(0, "Uno", 768), chunk(1, "Dos", 768), chunk(2, "Tres", 768)));
        LocalJsonVectorIndex index = new FailingOnceIndex();
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION,
                new VectorIndexSync.Settings(1, 0L, 8000));

        SyncReport report = sync.sync();

        assertEquals(SyncOutcome.COMPLETED, report.outcome());
        assertEquals(1, report.failedBatches());
        assertEquals(2, report.upserted());
        assertEquals(3, report.scanned());
    }

    @Test
    void unreachableIndexShouldFailThePass() {
        store.insert(document("doc-1"), List.of(chunk(0, "Uno", 768)));
        VectorIndex down = new LocalJsonVectorIndex() {
            @Override
            public synchronized Optional<CollectionDescription> describe(String collection) {
                throw new VectorIndexException("connection refused");
            }
        };

        VectorIndexSync sync = new VectorIndexSync(store, down, registry, COLLECTION, NO_PAUSE);

        SyncReport report = sync.sync();

        assertEquals(SyncOutcome.FAILED, report.outcome());
        assertEquals(0, provider.calls());
        assertEquals(SyncState.IDLE, sync.state());
    }

    @Test
    void shouldTruncateTextBeforeReembedding() {
        store.insert(document("doc-1"), List.of(chunk(0, "x".repeat(50), 0)));
        VectorIndexSync sync = new VectorIndexSync(store, new LocalJsonVectorIndex(), registry, COLLECTION,
                new VectorIndexSync.Settings(10, 0L, 20));

        sync.sync();

        assertEquals(20, provider.texts.get(0).length());
    }

    @Test
    void concurrentPassShouldBeSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountingEmbeddingProvider blocking = new CountingEmbeddingProvider("blocking", 768) {
            @Override
            public EmbeddingResult embed(String text) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.embed(text);
            }
        };
        store.insert(document("doc-1"), List.of(chunk(0, "Sin vector", 0)));
        VectorIndexSync sync = new VectorIndexSync(store, new LocalJsonVectorIndex(),
                EmbeddingProviderRegistry.of(blocking), COLLECTION, NO_PAUSE);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncReport> running = executor.submit(() -> sync.sync());
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            SyncReport skipped = sync.sync();
            release.countDown();

            assertEquals(SyncOutcome.SKIPPED, skipped.outcome());
            assertEquals(SyncOutcome.COMPLETED, running.get(5, TimeUnit.SECONDS).outcome());
            assertEquals(1, sync.currentEpoch());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldIndexAndRemoveChunksOfOneDocument() {
        StoredDocument stored = store.insert(document("doc-1"), List.of(chunk(0, "Uno", 768), chunk(1, "Sin vector", 0)));
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION, NO_PAUSE);

        assertEquals(1, sync.indexChunks(stored.document(), stored.chunks()));
        assertEquals(1, index.getStatistics(COLLECTION).rowCount());

        sync.removeChunks(stored.chunks());
        assertEquals(0, index.getStatistics(COLLECTION).rowCount());
    }

    static Document document(String id) {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return new Document(id, "hydraulics", "hydraulics", List.of("spain"), "Manual " + id, "contenido",
                DocumentMetadata.empty("es"), "1", DocumentStatus.ACTIVE, now, now);
    }

    static Chunk chunk(int chunkIndex, String content, int dimension) {
        StoredEmbedding embedding = dimension == 0
                ? null
                : StoredEmbedding.of("old", HashingFallbackEmbeddingProvider.generateMockEmbedding(content, dimension));
        return new Chunk(0L, null, chunkIndex, content, embedding);
    }

    private static final class FailingOnceIndex extends LocalJsonVectorIndex {
        private boolean failed;

        @Override
        public synchronized void insert(String collection, List<VectorRecord> records) {
            if (!failed) {
                failed = true;
                throw new VectorIndexException("timeout");
            }
            super.insert(collection, records);
        }
    }
}
