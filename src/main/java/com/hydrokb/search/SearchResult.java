package com.hydrokb.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One ranked passage. {@code id} is the chunk's primary key as text. {@code degradations} is
 * non-empty when the result set was produced without one of its normal inputs.
 */
public record SearchResult(
        String id,
        String content,
        double score,
        SearchMethod method,
        ResultSource source,
        List<String> highlights,
        Map<String, Object> metadata,
        Set<Degradation> degradations) {

    public SearchResult {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        degradations = degradations == null ? Set.of() : Set.copyOf(degradations);
    }

    public static SearchResult of(ScoredChunk scored, List<String> highlights, Set<Degradation> degradations) {
        ResultSource source = ResultSource.of(scored);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("documentId", source.documentId());
        metadata.put("documentTitle", source.title() == null ? "" : source.title());
        metadata.put("chunkIndex", source.chunkIndex());
        if (source.category() != null) {
            metadata.put("category", source.category());
        }
        if (source.subcategory() != null) {
            metadata.put("subcategory", source.subcategory());
        }
        return new SearchResult(
                Long.toString(scored.chunkId()),
                scored.content(),
                scored.score(),
                scored.method(),
                source,
                highlights,
                metadata,
                degradations);
    }

    public boolean degraded() {
        return !degradations.isEmpty();
    }

    public SearchResult withMetadata(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new SearchResult(id, content, score, method, source, highlights, next, degradations);
    }
}
