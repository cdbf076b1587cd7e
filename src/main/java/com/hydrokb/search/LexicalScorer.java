package com.hydrokb.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 over a candidate corpus of chunks. Document frequencies and the average length are
 * computed over the candidates passed in, not over the whole store.
 */
public class LexicalScorer {
    public static final double K1 = 1.2;
    public static final double B = 0.75;

    /**
     * Lower bound for inverse document frequency. The textbook formula goes to zero or below
     * once a term occurs in half the corpus; a matching chunk still scores above zero.
     */
    static final double MIN_IDF = 0.01;

    public List<ScoredChunk> score(String query, List<Candidate> candidates) {
        return score(Tokenizer.tokenize(query), candidates);
    }

    /**
     * Chunks that contain at least one query term, best first. Chunks without a match are left
     * out.
     */
    public List<ScoredChunk> score(List<String> queryTerms, List<Candidate> candidates) {
        Set<String> terms = new LinkedHashSet<>(queryTerms);
        if (terms.isEmpty() || candidates.isEmpty()) {
            return List.of();
        }

        List<Map<String, Integer>> frequencies = new ArrayList<>(candidates.size());
        int[] lengths = new int[candidates.size()];
        long totalLength = 0;
        int corpusSize = 0;
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            List<String> tokens = Tokenizer.tokenize(candidates.get(i).chunk().content());
            Map<String, Integer> tf = new HashMap<>();
            tokens.forEach(token -> tf.merge(token, 1, Integer::sum));
            frequencies.add(tf);
            lengths[i] = tokens.size();
            if (!tokens.isEmpty()) {
                corpusSize++;
                totalLength += tokens.size();
                for (String term : new HashSet<>(tf.keySet())) {
                    if (terms.contains(term)) {
                        documentFrequency.merge(term, 1, Integer::sum);
                    }
                }
            }
        }
        if (corpusSize == 0) {
            return List.of();
        }
        double averageLength = (double) totalLength / corpusSize;

        Map<String, Double> idf = new HashMap<>();
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            idf.put(entry.getKey(), inverseDocumentFrequency(corpusSize, entry.getValue()));
        }

        List<ScoredChunk> scored = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (lengths[i] == 0) {
                continue;
            }
            Map<String, Integer> tf = frequencies.get(i);
            double score = 0.0;
            int matched = 0;
            for (String term : terms) {
                int frequency = tf.getOrDefault(term, 0);
                if (frequency == 0) {
                    continue;
                }
                matched++;
                double norm = K1 * (1 - B + B * (lengths[i] / averageLength));
                score += idf.get(term) * (frequency * (K1 + 1)) / (frequency + norm);
            }
            if (matched > 0) {
                scored.add(ScoredChunk.of(candidates.get(i), score, SearchMethod.LEXICAL));
            }
        }
        scored.sort(ScoredChunk.RANKING);
        return scored;
    }

    static double inverseDocumentFrequency(int corpusSize, int containing) {
        double idf = Math.log((corpusSize - containing + 0.5) / (containing + 0.5));
        return Math.max(MIN_IDF, idf);
    }
}
