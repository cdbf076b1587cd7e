package com.hydrokb.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.ingest.StoredEmbedding;

/**
 * Cosine similarity between a query vector and the vectors stored on chunks.
 */
public class SemanticScorer {
    private static final Logger log = LoggerFactory.getLogger(SemanticScorer.class);

    /** Similarities at or below this are noise and never reported. */
    public static final double MIN_SIMILARITY = 0.1;

    /**
     * {@code dot(a, b) / (|a| |b|)}; 0 when either vector has zero norm or the lengths differ.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    public List<ScoredChunk> scoreChunks(float[] queryVector, List<Candidate> candidates) {
        List<ScoredChunk> scored = new ArrayList<>();
        for (Candidate candidate : candidates) {
            StoredEmbedding embedding = candidate.chunk().embedding();
            if (embedding == null || embedding.values().length == 0) {
                continue;
            }
            if (embedding.isMalformed()) {
                log.warn("semantic.chunk.skipped chunk={} reason=malformed-embedding", candidate.chunk().id());
                continue;
            }
            if (embedding.dimension() != queryVector.length) {
                log.warn("semantic.chunk.skipped chunk={} reason=dimension-mismatch stored={} query={}",
                        candidate.chunk().id(), embedding.dimension(), queryVector.length);
                continue;
            }
            double similarity = cosineSimilarity(queryVector, embedding.values());
            if (similarity > MIN_SIMILARITY) {
                scored.add(ScoredChunk.of(candidate, similarity, SearchMethod.SEMANTIC));
            }
        }
        scored.sort(ScoredChunk.RANKING);
        return scored;
    }

    /**
     * One entry per document, scored by its single best chunk.
     */
    public List<ScoredChunk> scoreDocuments(float[] queryVector, List<Candidate> candidates) {
        Map<String, ScoredChunk> best = new LinkedHashMap<>();
        for (ScoredChunk scored : scoreChunks(queryVector, candidates)) {
            best.putIfAbsent(scored.document().id(), scored);
        }
        List<ScoredChunk> documents = new ArrayList<>(best.values());
        documents.sort(ScoredChunk.RANKING);
        return documents;
    }
}
