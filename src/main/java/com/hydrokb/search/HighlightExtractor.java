package com.hydrokb.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks up to three sentences that mention the query, padding with the opening sentences when
 * fewer match.
 */
public final class HighlightExtractor {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    static final int MAX_HIGHLIGHTS = 3;

    private HighlightExtractor() {
    }

    public static List<String> extract(String query, String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<String> sentences = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(content.strip())) {
            if (!sentence.isBlank()) {
                sentences.add(sentence.strip());
            }
        }
        List<String> words = Tokenizer.tokenize(query);
        int required = Math.max(1, Math.min(2, words.size() / 2));

        List<String> highlights = new ArrayList<>();
        if (!words.isEmpty()) {
            for (String sentence : sentences) {
                String lower = sentence.toLowerCase(Locale.ROOT);
                long hits = words.stream().filter(lower::contains).count();
                if (hits >= required) {
                    highlights.add(sentence);
                    if (highlights.size() == MAX_HIGHLIGHTS) {
                        return highlights;
                    }
                }
            }
        }
        for (String sentence : sentences) {
            if (highlights.size() == MAX_HIGHLIGHTS) {
                break;
            }
            if (!highlights.contains(sentence)) {
                highlights.add(sentence);
            }
        }
        return highlights;
    }
}
