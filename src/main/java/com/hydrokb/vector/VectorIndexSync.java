package com.hydrokb.vector;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingResult;
import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.KnowledgeStore;
import com.hydrokb.ingest.StoredEmbedding;

/**
 * Reconciles the knowledge store with the vector index. A pass pages through chunks by primary
 * key, re-embeds those whose stored vector is missing, malformed or of the wrong width, writes
 * the new vector back to the store and upserts each page to the index in one call.
 * <p>
 * Only one pass runs at a time; a concurrent request returns a {@link SyncOutcome#SKIPPED}
 * report. Each started pass gets the next epoch number.
 */
public class VectorIndexSync {
    private static final Logger log = LoggerFactory.getLogger(VectorIndexSync.class);

    private final KnowledgeStore store;
    private final VectorIndex index;
    private final EmbeddingProviderRegistry providers;
    private final String collection;
    private final Settings settings;
    private final Clock clock;
    private final ReentrantLock writerLock = new ReentrantLock();
    private final AtomicLong epoch = new AtomicLong();
    private volatile SyncState state = SyncState.IDLE;

    public VectorIndexSync(KnowledgeStore store,
            VectorIndex index,
            EmbeddingProviderRegistry providers,
            String collection,
            Settings settings) {
        this(store, index, providers, collection, settings, Clock.systemUTC());
    }

    public VectorIndexSync(KnowledgeStore store,
            VectorIndex index,
            EmbeddingProviderRegistry providers,
            String collection,
            Settings settings,
            Clock clock) {
        this.store = store;
        this.index = index;
        this.providers = providers;
        this.collection = collection;
        this.settings = settings;
        this.clock = clock;
    }

    public SyncState state() {
        return state;
    }

    public long currentEpoch() {
        return epoch.get();
    }

    public String collection() {
        return collection;
    }

    public SyncReport sync() {
        return sync(SyncMode.INCREMENTAL);
    }

    public SyncReport sync(SyncMode mode) {
        if (!writerLock.tryLock()) {
            log.info("sync.skipped reason=pass-in-progress epoch={}", epoch.get());
            return SyncReport.skipped(epoch.get());
        }
        long passEpoch = epoch.incrementAndGet();
        try {
            return runPass(passEpoch, mode);
        } finally {
            state = SyncState.IDLE;
            writerLock.unlock();
        }
    }

    /**
     * Upserts records for chunks whose stored vector already fits the active provider. Used on
     * the ingestion path; an unreachable index is logged and left for the next sync pass.
     *
     * @return number of records written
     */
    public int indexChunks(Document document, List<Chunk> chunks) {
        int dimension = providers.activeDimension();
        long now = clock.millis();
        List<VectorRecord> records = new ArrayList<>();
        for (Chunk chunk : chunks) {
            if (chunk.hasEmbedding() && chunk.embedding().fits(dimension)) {
                records.add(VectorRecord.of(chunk, document, chunk.embedding().values(), now));
            }
        }
        if (records.isEmpty()) {
            return 0;
        }
        try {
            index.ensureCollection(collection, dimension);
            index.insert(collection, records);
            return records.size();
        } catch (VectorIndexException e) {
            log.warn("index.upsert.deferred document={} records={} cause={}", document.id(), records.size(), e.getMessage());
            return 0;
        }
    }

    /**
     * Deletes the index records of the given chunks. Failures are logged; orphaned records are
     * dropped by the next collection rebuild.
     */
    public void removeChunks(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<String> ids = chunks.stream().map(chunk -> VectorRecord.idOf(chunk.id())).toList();
        try {
            if (index.describe(collection).isPresent()) {
                index.delete(collection, ids);
            }
        } catch (VectorIndexException e) {
            log.warn("index.delete.failed records={} cause={}", ids.size(), e.getMessage());
        }
    }

    private SyncReport runPass(long passEpoch, SyncMode mode) {
        state = SyncState.SCANNING;
        int dimension = providers.activeDimension();
        CollectionState collectionState;
        long indexRows;
        try {
            collectionState = index.ensureCollection(collection, dimension);
            indexRows = index.getStatistics(collection).rowCount();
        } catch (VectorIndexException e) {
            state = SyncState.ERROR;
            log.error("sync.failed epoch={} collection={} cause={}", passEpoch, collection, e.getMessage());
            return SyncReport.failed(passEpoch, null);
        }
        long storeChunks = store.countChunks();
        log.info("sync.started epoch={} mode={} collection={} dimension={} indexRows={} storeChunks={} collectionState={}",
                passEpoch, mode, collection, dimension, indexRows, storeChunks, collectionState);

        if (mode == SyncMode.INCREMENTAL && indexRows >= storeChunks) {
            log.info("sync.up-to-date epoch={} indexRows={} storeChunks={}", passEpoch, indexRows, storeChunks);
            return new SyncReport(passEpoch, SyncOutcome.UP_TO_DATE, collectionState, storeChunks, indexRows, 0, 0, 0, 0, 0);
        }

        Counters counters = new Counters();
        long cursor = 0L;
        boolean firstBatch = true;
        while (true) {
            if (!firstBatch && !pause()) {
                log.warn("sync.interrupted epoch={} cursor={}", passEpoch, cursor);
                break;
            }
            firstBatch = false;
            state = SyncState.FETCH;
            List<Chunk> page = store.listChunksAfter(cursor, settings.batchSize());
            if (page.isEmpty()) {
                break;
            }
            long batchStart = cursor;
            cursor = page.get(page.size() - 1).id();
            try {
                syncBatch(page, dimension, counters);
            } catch (RuntimeException e) {
                state = SyncState.ERROR;
                counters.failedBatches++;
                log.error("sync.batch.failed epoch={} cursor={} size={} cause={}", passEpoch, batchStart, page.size(), e.toString());
            }
        }

        log.info("sync.completed epoch={} scanned={} reembedded={} upserted={} failedBatches={} skipped={}",
                passEpoch, counters.scanned, counters.reembedded, counters.upserted, counters.failedBatches, counters.skipped);
        return new SyncReport(passEpoch, SyncOutcome.COMPLETED, collectionState, storeChunks, indexRows,
                counters.scanned, counters.reembedded, counters.upserted, counters.failedBatches, counters.skipped);
    }

    private void syncBatch(List<Chunk> page, int dimension, Counters counters) {
        state = SyncState.VALIDATE;
        Map<String, Optional<Document>> documents = new HashMap<>();
        List<VectorRecord> records = new ArrayList<>(page.size());
        int reembedded = 0;
        long now = clock.millis();
        for (Chunk chunk : page) {
            counters.scanned++;
            Optional<Document> document = documents.computeIfAbsent(chunk.documentId(), store::findDocument);
            if (document.isEmpty()) {
                counters.skipped++;
                log.warn("sync.chunk.orphaned chunk={} document={}", chunk.id(), chunk.documentId());
                continue;
            }
            float[] vector;
            if (chunk.hasEmbedding() && chunk.embedding().fits(dimension)) {
                vector = chunk.embedding().values();
            } else {
                state = SyncState.REEMBED;
                Optional<float[]> fresh = reembed(chunk, dimension);
                if (fresh.isEmpty()) {
                    counters.skipped++;
                    continue;
                }
                vector = fresh.get();
                reembedded++;
                state = SyncState.VALIDATE;
            }
            records.add(VectorRecord.of(chunk, document.get(), vector, now));
        }
        state = SyncState.UPSERT;
        index.insert(collection, records);
        counters.reembedded += reembedded;
        counters.upserted += records.size();
    }

    private Optional<float[]> reembed(Chunk chunk, int dimension) {
        String previous = chunk.embedding() == null
                ? "missing"
                : chunk.embedding().isMalformed() ? "malformed" : "dimension-" + chunk.embedding().dimension();
        String text = chunk.content().length() > settings.maxEmbeddingChars()
                ? chunk.content().substring(0, settings.maxEmbeddingChars())
                : chunk.content();
        EmbeddingResult result = providers.generateEmbedding(text);
        if (result.dimension() != dimension) {
            log.warn("sync.chunk.dimension-drift chunk={} expected={} produced={}", chunk.id(), dimension, result.dimension());
            return Optional.empty();
        }
        store.updateEmbedding(chunk.id(), StoredEmbedding.of(result.providerId(), result.vector()));
        if (result.degraded()) {
            log.warn("sync.chunk.reembedded-degraded chunk={} previous={} reason={}", chunk.id(), previous, result.reason());
        } else {
            log.debug("sync.chunk.reembedded chunk={} previous={}", chunk.id(), previous);
        }
        return Optional.of(result.vector());
    }

    private boolean pause() {
        if (settings.pauseBetweenBatchesMs() <= 0) {
            return true;
        }
        try {
            Thread.sleep(settings.pauseBetweenBatchesMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Counters {
        int scanned;
        int reembedded;
        int upserted;
        int failedBatches;
        int skipped;
    }

    public record Settings(int batchSize, long pauseBetweenBatchesMs, int maxEmbeddingChars) {
        public Settings {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            if (maxEmbeddingChars <= 0) {
                throw new IllegalArgumentException("maxEmbeddingChars must be positive");
            }
        }

        public static Settings defaults() {
            return new Settings(50, 100L, 8000);
        }
    }
}
