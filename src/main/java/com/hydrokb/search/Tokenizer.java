package com.hydrokb.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared by query and corpus so term frequencies compare like with like: lower-case, every
 * character that is not a letter or digit becomes a separator, tokens of fewer than three
 * characters and Spanish/English stop-words are dropped.
 */
public final class Tokenizer {
    static final Set<String> STOP_WORDS = Set.of(
            "el", "la", "de", "que", "y", "a", "en", "un", "es", "se", "no", "te", "lo", "le",
            "da", "su", "por", "son", "con", "para", "al", "del", "los", "las", "una", "como",
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "from");

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static boolean isStopWord(String token) {
        return STOP_WORDS.contains(token);
    }
}
