package com.hydrokb.ingest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingResult;
import com.hydrokb.vector.VectorIndexSync;

/**
 * Document write path: chunk, embed each chunk under a time budget, store, then mirror the new
 * vectors into the index.
 * <p>
 * A failure on the first chunk aborts the document, since it usually means the provider is
 * misconfigured; later failures are recorded and the chunk is stored without a vector for the
 * next sync pass to fill in.
 */
public class IngestionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final KnowledgeStore store;
    private final EmbeddingProviderRegistry providers;
    private final VectorIndexSync indexSync;
    private final Chunker chunker;
    private final long chunkTimeoutMs;
    private final Clock clock;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "hydrokb-embedding");
        thread.setDaemon(true);
        return thread;
    });

    public IngestionService(KnowledgeStore store,
            EmbeddingProviderRegistry providers,
            VectorIndexSync indexSync,
            Chunker chunker,
            long chunkTimeoutMs) {
        this(store, providers, indexSync, chunker, chunkTimeoutMs, Clock.systemUTC());
    }

    public IngestionService(KnowledgeStore store,
            EmbeddingProviderRegistry providers,
            VectorIndexSync indexSync,
            Chunker chunker,
            long chunkTimeoutMs,
            Clock clock) {
        if (chunkTimeoutMs <= 0) {
            throw new IllegalArgumentException("chunkTimeoutMs must be positive");
        }
        this.store = store;
        this.providers = providers;
        this.indexSync = indexSync;
        this.chunker = chunker;
        this.chunkTimeoutMs = chunkTimeoutMs;
        this.clock = clock;
    }

    public IngestionReport addDocument(DocumentDraft draft, ProgressListener listener) {
        Objects.requireNonNull(draft, "draft");
        requireContent(draft.content());
        Instant now = clock.instant();
        Document document = new Document(null, draft.category(), draft.subcategory(), draft.regions(), draft.title(),
                draft.content(), draft.metadata(), draft.version(), DocumentStatus.ACTIVE, now, now);

        EmbeddedChunks embedded = embedChunks(document.title(), document.content(), listener);
        StoredDocument stored = store.insert(document, embedded.chunks());
        int indexed = indexSync.indexChunks(stored.document(), stored.chunks());
        IngestionReport report = embedded.report(stored.document().id(), indexed);
        log.info("ingest.document.stored id={} title=\"{}\" chunks={} embedded={} degraded={} failed={} indexed={}",
                report.documentId(), document.title(), report.totalChunks(), report.embeddedChunks(),
                report.degradedChunks(), report.failedChunks(), report.indexedRecords());
        return report;
    }

    /**
     * Applies the patch. A content change re-chunks and re-embeds the document and replaces its
     * index records; other changes only refresh the denormalized index fields.
     */
    public IngestionReport updateDocument(String documentId, DocumentPatch patch, ProgressListener listener) {
        Document current = store.findDocument(documentId)
                .orElseThrow(() -> new IngestionException("Unknown document: " + documentId));
        Document updated = patch.applyTo(current, clock.instant());
        boolean contentChanged = !Objects.equals(current.content(), updated.content());

        if (!contentChanged) {
            store.updateDocument(updated);
            List<Chunk> chunks = store.chunksOf(documentId);
            int indexed = indexSync.indexChunks(updated, chunks);
            log.info("ingest.document.updated id={} rechunked=false indexed={}", documentId, indexed);
            return new IngestionReport(documentId, chunks.size(), 0, 0, 0, indexed, List.of());
        }

        requireContent(updated.content());
        EmbeddedChunks embedded = embedChunks(updated.title(), updated.content(), listener);
        List<Chunk> previous = store.chunksOf(documentId);
        store.updateDocument(updated);
        List<Chunk> replaced = store.replaceChunks(documentId, embedded.chunks());
        indexSync.removeChunks(previous);
        int indexed = indexSync.indexChunks(updated, replaced);
        IngestionReport report = embedded.report(documentId, indexed);
        log.info("ingest.document.updated id={} rechunked=true chunks={} failed={} indexed={}",
                documentId, report.totalChunks(), report.failedChunks(), indexed);
        return report;
    }

    /**
     * @return false when no such document existed
     */
    public boolean deleteDocument(String documentId) {
        if (store.findDocument(documentId).isEmpty()) {
            return false;
        }
        List<Chunk> removed = store.deleteDocument(documentId);
        indexSync.removeChunks(removed);
        log.info("ingest.document.deleted id={} chunks={}", documentId, removed.size());
        return true;
    }

    private EmbeddedChunks embedChunks(String title, String content, ProgressListener listener) {
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        List<String> pieces = chunker.chunk(content);
        EmbeddedChunks embedded = new EmbeddedChunks(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            String text = pieces.get(i);
            try {
                EmbeddingResult result = embedWithTimeout(text);
                embedded.add(new Chunk(0L, null, i, text, StoredEmbedding.of(result.providerId(), result.vector())),
                        result.degraded());
            } catch (ChunkEmbeddingFailure failure) {
                if (i == 0) {
                    log.error("ingest.document.aborted title=\"{}\" reason={}", title, failure.getMessage());
                    throw new IngestionException("Embedding the first chunk failed (" + failure.getMessage()
                            + "); check provider configuration", failure.getCause());
                }
                log.warn("ingest.chunk.failed title=\"{}\" chunk={} reason={}", title, i, failure.getMessage());
                embedded.fail(new Chunk(0L, null, i, text, null), "chunk " + i + ": " + failure.getMessage());
            }
            progress.onProgress(new IngestionProgress(i + 1, pieces.size(),
                    "Embedded chunk " + (i + 1) + " of " + pieces.size()));
        }
        return embedded;
    }

    private EmbeddingResult embedWithTimeout(String text) throws ChunkEmbeddingFailure {
        Future<EmbeddingResult> future = executor.submit(() -> providers.generateEmbedding(text));
        try {
            return future.get(chunkTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ChunkEmbeddingFailure("timed out after " + chunkTimeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw new ChunkEmbeddingFailure(String.valueOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IngestionException("Interrupted while embedding", e);
        }
    }

    private static void requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IngestionException("Document content is empty");
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class ChunkEmbeddingFailure extends Exception {
        ChunkEmbeddingFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class EmbeddedChunks {
        private final List<Chunk> chunks;
        private final List<String> errors = new ArrayList<>();
        private int embedded;
        private int degraded;

        EmbeddedChunks(int expected) {
            this.chunks = new ArrayList<>(expected);
        }

        void add(Chunk chunk, boolean degradedVector) {
            chunks.add(chunk);
            embedded++;
            if (degradedVector) {
                degraded++;
            }
        }

        void fail(Chunk chunk, String error) {
            chunks.add(chunk);
            errors.add(error);
        }

        List<Chunk> chunks() {
            return chunks;
        }

        IngestionReport report(String documentId, int indexed) {
            return new IngestionReport(documentId, chunks.size(), embedded, degraded, errors.size(), indexed, errors);
        }
    }
}
