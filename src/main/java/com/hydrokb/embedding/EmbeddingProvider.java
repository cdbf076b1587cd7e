package com.hydrokb.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * One embedding backend. Implementations never throw on backend trouble: they answer with a
 * degraded fallback vector of their own dimension instead.
 */
public interface EmbeddingProvider {
    ProviderDescriptor descriptor();

    EmbeddingResult embed(String text);

    default List<EmbeddingResult> embedBatch(List<String> texts) {
        List<EmbeddingResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(embed(text));
        }
        return results;
    }

    default String id() {
        return descriptor().id();
    }

    default int dimension() {
        return descriptor().dimension();
    }
}
