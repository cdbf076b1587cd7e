package com.hydrokb.search;

/**
 * Query knobs. {@code category}, {@code region} and {@code language} are optional filters;
 * {@code groupByDocument} keeps only the best passage of each document.
 */
public record SearchOptions(
        int topK,
        double alpha,
        double minSemanticScore,
        double minBm25Score,
        String category,
        String region,
        String language,
        boolean rerank,
        boolean groupByDocument) {

    public static final int DEFAULT_TOP_K = 10;
    public static final double DEFAULT_ALPHA = 0.6;
    public static final double QUICK_ALPHA = 0.7;

    public SearchOptions {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        if (alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be within [0, 1]");
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_TOP_K, DEFAULT_ALPHA, 0.3, 0.1, null, null, "es", true, false);
    }

    public SearchOptions withTopK(int value) {
        return new SearchOptions(value, alpha, minSemanticScore, minBm25Score, category, region, language, rerank,
                groupByDocument);
    }

    public SearchOptions withAlpha(double value) {
        return new SearchOptions(topK, value, minSemanticScore, minBm25Score, category, region, language, rerank,
                groupByDocument);
    }

    public SearchOptions withMinScores(double semantic, double bm25) {
        return new SearchOptions(topK, alpha, semantic, bm25, category, region, language, rerank, groupByDocument);
    }

    public SearchOptions withFilters(String newCategory, String newRegion, String newLanguage) {
        return new SearchOptions(topK, alpha, minSemanticScore, minBm25Score, newCategory, newRegion, newLanguage, rerank,
                groupByDocument);
    }

    public SearchOptions withRerank(boolean value) {
        return new SearchOptions(topK, alpha, minSemanticScore, minBm25Score, category, region, language, value,
                groupByDocument);
    }

    public SearchOptions withGroupByDocument(boolean value) {
        return new SearchOptions(topK, alpha, minSemanticScore, minBm25Score, category, region, language, rerank, value);
    }
}
