package com.hydrokb.health;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentFilter;
import com.hydrokb.ingest.KnowledgeStore;
import com.hydrokb.ingest.StoredEmbedding;
import com.hydrokb.vector.VectorIndex;
import com.hydrokb.vector.VectorIndexException;

/**
 * Read-mostly diagnostics over the knowledge store and the vector index, plus the cleanup that
 * clears malformed vectors so the next sync pass re-embeds them.
 */
public class IndexHealthService {
    private static final Logger log = LoggerFactory.getLogger(IndexHealthService.class);
    private static final int PAGE_SIZE = 200;

    private final KnowledgeStore store;
    private final VectorIndex index;
    private final String collection;
    private final EmbeddingProviderRegistry providers;

    public IndexHealthService(KnowledgeStore store, VectorIndex index, String collection, EmbeddingProviderRegistry providers) {
        this.store = store;
        this.index = index;
        this.collection = collection;
        this.providers = providers;
    }

    public IndexingValidationReport validateIndexing() {
        int dimension = providers.activeDimension();
        List<DocumentIndexReport> documents = new ArrayList<>();
        int complete = 0;
        int partial = 0;
        int notIndexed = 0;
        int corrupted = 0;
        for (Document document : store.findDocuments(DocumentFilter.any())) {
            List<Chunk> chunks = store.chunksOf(document.id());
            int withEmbeddings = 0;
            int corruptedChunks = 0;
            int staleChunks = 0;
            for (Chunk chunk : chunks) {
                StoredEmbedding embedding = chunk.embedding();
                if (embedding == null) {
                    continue;
                }
                if (embedding.isMalformed()) {
                    corruptedChunks++;
                    continue;
                }
                withEmbeddings++;
                if (embedding.dimension() != dimension) {
                    staleChunks++;
                }
            }
            DocumentIndexStatus status;
            if (corruptedChunks > 0) {
                status = DocumentIndexStatus.CORRUPTED;
                corrupted++;
            } else if (chunks.isEmpty() || withEmbeddings == 0) {
                status = DocumentIndexStatus.NOT_INDEXED;
                notIndexed++;
            } else if (withEmbeddings == chunks.size()) {
                status = DocumentIndexStatus.COMPLETE;
                complete++;
            } else {
                status = DocumentIndexStatus.PARTIAL;
                partial++;
            }
            int percentage = chunks.isEmpty() ? 0 : (int) Math.round(100.0 * withEmbeddings / chunks.size());
            documents.add(new DocumentIndexReport(document.id(), document.title(), document.category(), status,
                    chunks.size(), withEmbeddings, corruptedChunks, staleChunks, percentage));
        }
        log.info("health.indexing.validated documents={} complete={} partial={} notIndexed={} corrupted={}",
                documents.size(), complete, partial, notIndexed, corrupted);
        return new IndexingValidationReport(documents.size(), complete, partial, notIndexed, corrupted, documents);
    }

    public KnowledgeBaseHealth health() {
        List<Document> documents = store.findDocuments(DocumentFilter.any());
        Map<String, Long> byCategory = new TreeMap<>();
        long totalChunks = 0;
        long withEmbeddings = 0;
        long indexedDocuments = 0;
        for (Document document : documents) {
            byCategory.merge(document.category() == null ? "uncategorized" : document.category(), 1L, Long::sum);
            List<Chunk> chunks = store.chunksOf(document.id());
            totalChunks += chunks.size();
            if (!chunks.isEmpty()) {
                indexedDocuments++;
            }
            withEmbeddings += chunks.stream()
                    .filter(chunk -> chunk.embedding() != null && !chunk.embedding().isMalformed())
                    .count();
        }
        long totalDocuments = documents.size();
        double coverage = totalChunks > 0 ? 100.0 * withEmbeddings / totalChunks : 0.0;
        double indexed = totalDocuments > 0 ? 100.0 * indexedDocuments / totalDocuments : 0.0;
        long averageChunks = totalDocuments > 0 ? Math.round((double) totalChunks / totalDocuments) : 0;

        List<String> issues = new ArrayList<>();
        if (coverage < 100 && totalChunks > 0) {
            issues.add((totalChunks - withEmbeddings) + " chunks missing embeddings");
        }
        if (indexed < 100 && totalDocuments > 0) {
            issues.add(Math.round(100 - indexed) + "% documents not indexed");
        }
        if (totalDocuments == 0) {
            issues.add("No documents in knowledge base");
        }
        long indexRows = vectorIndexRows(issues);

        HealthStatus status = HealthStatus.EXCELLENT;
        if (!issues.isEmpty()) {
            status = HealthStatus.HEALTHY;
        }
        if (coverage < 80 || indexed < 80) {
            status = HealthStatus.DEGRADED;
        }
        if (coverage < 50 || totalDocuments == 0) {
            status = HealthStatus.CRITICAL;
        }
        return new KnowledgeBaseHealth(status, totalDocuments, totalChunks, withEmbeddings,
                (int) Math.round(coverage), (int) Math.round(indexed), averageChunks, indexRows, byCategory, issues);
    }

    /**
     * Removes malformed vectors from the store.
     *
     * @return number of chunks cleared
     */
    public int clearMalformedEmbeddings() {
        int[] cleared = {0};
        forEachChunk(chunk -> {
            if (chunk.embedding() != null && chunk.embedding().isMalformed()) {
                store.updateEmbedding(chunk.id(), null);
                cleared[0]++;
            }
        });
        log.info("health.embeddings.cleared count={}", cleared[0]);
        return cleared[0];
    }

    private long vectorIndexRows(List<String> issues) {
        try {
            if (index.describe(collection).isEmpty()) {
                issues.add("Vector collection " + collection + " does not exist");
                return 0L;
            }
            return index.getStatistics(collection).rowCount();
        } catch (VectorIndexException e) {
            log.warn("health.index.unreachable collection={} cause={}", collection, e.getMessage());
            issues.add("Vector index unreachable");
            return -1L;
        }
    }

    private void forEachChunk(Consumer<Chunk> action) {
        long cursor = 0L;
        while (true) {
            List<Chunk> page = store.listChunksAfter(cursor, PAGE_SIZE);
            if (page.isEmpty()) {
                return;
            }
            page.forEach(action);
            cursor = page.get(page.size() - 1).id();
        }
    }
}
