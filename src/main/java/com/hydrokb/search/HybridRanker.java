package com.hydrokb.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fuses lexical and semantic lists and re-ranks the fused candidates with content heuristics.
 */
public class HybridRanker {
    static final double EXACT_TERM_WEIGHT = 0.2;
    static final double TECHNICAL_DENSITY_WEIGHT = 0.1;
    static final double LENGTH_BONUS = 0.1;

    static final List<String> TECHNICAL_TERMS = List.of(
            "presión", "pressure", "caudal", "flow", "diámetro", "diameter",
            "tubería", "pipe", "bomba", "pump", "válvula", "valve",
            "hidráulico", "hydraulic", "agua", "water", "red", "network");

    private final int minWellFormedLength;
    private final int maxWellFormedLength;

    public HybridRanker() {
        this(200, 1500);
    }

    public HybridRanker(int minWellFormedLength, int maxWellFormedLength) {
        if (minWellFormedLength > maxWellFormedLength) {
            throw new IllegalArgumentException("minWellFormedLength > maxWellFormedLength");
        }
        this.minWellFormedLength = minWellFormedLength;
        this.maxWellFormedLength = maxWellFormedLength;
    }

    /**
     * Max-normalizes each list, then scores every chunk as
     * {@code alpha * semantic + (1 - alpha) * lexical}, a missing side counting as 0. Chunks in
     * both lists are tagged {@link SearchMethod#HYBRID}.
     */
    public List<ScoredChunk> fuse(List<ScoredChunk> lexical, List<ScoredChunk> semantic, double alpha) {
        Map<Long, ScoredChunk> fused = new LinkedHashMap<>();
        for (ScoredChunk result : normalize(semantic)) {
            fused.merge(result.chunkId(), result.withScore(alpha * result.score(), SearchMethod.SEMANTIC), HybridRanker::combine);
        }
        for (ScoredChunk result : normalize(lexical)) {
            fused.merge(result.chunkId(), result.withScore((1 - alpha) * result.score(), SearchMethod.LEXICAL),
                    HybridRanker::combine);
        }
        List<ScoredChunk> ranked = new ArrayList<>(fused.values());
        ranked.sort(ScoredChunk.RANKING);
        return ranked;
    }

    /**
     * Multiplies each score by {@code 1 + bonuses} and keeps the best {@code topK}. Lists no
     * longer than {@code topK} are returned unchanged.
     */
    public List<ScoredChunk> rerank(String query, List<ScoredChunk> fused, int topK) {
        if (fused.size() <= topK) {
            return fused;
        }
        List<String> queryTerms = Tokenizer.tokenize(query);
        List<ScoredChunk> reranked = new ArrayList<>(fused.size());
        for (ScoredChunk result : fused) {
            reranked.add(result.withScore(result.score() * (1 + bonus(queryTerms, result.content()))));
        }
        reranked.sort(ScoredChunk.RANKING);
        return List.copyOf(reranked.subList(0, topK));
    }

    /**
     * Keeps the best-ranked chunk of each document, in ranking order.
     */
    public List<ScoredChunk> collapseByDocument(List<ScoredChunk> ranked) {
        Map<String, ScoredChunk> best = new LinkedHashMap<>();
        for (ScoredChunk result : ranked) {
            best.merge(result.document().id(), result,
                    (current, candidate) -> ScoredChunk.RANKING.compare(candidate, current) < 0 ? candidate : current);
        }
        List<ScoredChunk> collapsed = new ArrayList<>(best.values());
        collapsed.sort(ScoredChunk.RANKING);
        return collapsed;
    }

    double bonus(List<String> queryTerms, String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        double bonus = 0.0;
        if (!queryTerms.isEmpty()) {
            long exact = queryTerms.stream().filter(lower::contains).count();
            bonus += ((double) exact / queryTerms.size()) * EXACT_TERM_WEIGHT;
        }
        bonus += technicalDensity(lower) * TECHNICAL_DENSITY_WEIGHT;
        int length = content.length();
        if (length >= minWellFormedLength && length <= maxWellFormedLength) {
            bonus += LENGTH_BONUS;
        }
        return bonus;
    }

    static double technicalDensity(String text) {
        String[] words = text.toLowerCase(Locale.ROOT).trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            return 0.0;
        }
        long technical = 0;
        for (String word : words) {
            if (TECHNICAL_TERMS.stream().anyMatch(word::contains)) {
                technical++;
            }
        }
        return (double) technical / words.length;
    }

    static List<ScoredChunk> normalize(List<ScoredChunk> results) {
        double max = results.stream().mapToDouble(ScoredChunk::score).max().orElse(0.0);
        if (max <= 0.0) {
            return results;
        }
        return results.stream().map(result -> result.withScore(result.score() / max)).toList();
    }

    private static ScoredChunk combine(ScoredChunk existing, ScoredChunk addition) {
        return existing.withScore(existing.score() + addition.score(), SearchMethod.HYBRID);
    }
}
