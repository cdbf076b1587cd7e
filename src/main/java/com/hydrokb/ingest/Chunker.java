package com.hydrokb.ingest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Paragraph-first splitter. Oversized paragraphs fall back to word boundaries and oversized
 * words are cut into fixed-width pieces. A closed chunk seeds the next one with its last
 * {@code overlap / 10} words; pieces of a hard-cut word carry no seed.
 */
public class Chunker {
    private final int maxChunkSize;
    private final int overlap;

    public Chunker(int maxChunkSize, int overlap) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative: " + overlap);
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
    }

    public static List<String> chunk(String text, int maxSize, int overlap) {
        return new Chunker(maxSize, overlap).chunk(text);
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Accumulator acc = new Accumulator();
        for (String paragraph : text.strip().split("\\n\\s*\\n")) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() > maxChunkSize) {
                acc.closeWithSeed();
                for (String word : trimmed.split("\\s+")) {
                    acc.addWord(word);
                }
            } else {
                acc.addParagraph(trimmed);
            }
        }
        acc.closeWithoutSeed();
        return acc.chunks;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public int overlap() {
        return overlap;
    }

    private final class Accumulator {
        private final List<String> chunks = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private boolean fresh;

        void addParagraph(String paragraph) {
            if (fits("\n\n", paragraph)) {
                append("\n\n", paragraph);
                return;
            }
            String seed = closeAndTakeSeed();
            startWith(seed, paragraph);
        }

        void addWord(String word) {
            if (word.length() > maxChunkSize) {
                hardSplit(word);
                return;
            }
            if (fits(" ", word)) {
                append(" ", word);
                return;
            }
            String seed = closeAndTakeSeed();
            startWith(seed, word);
        }

        void closeWithSeed() {
            if (!fresh) {
                return;
            }
            String seed = closeAndTakeSeed();
            current.append(seed);
        }

        void closeWithoutSeed() {
            if (fresh) {
                chunks.add(current.toString().strip());
            }
            current.setLength(0);
            fresh = false;
        }

        private void hardSplit(String word) {
            closeWithoutSeed();
            int start = 0;
            while (word.length() - start > maxChunkSize) {
                chunks.add(word.substring(start, start + maxChunkSize));
                start += maxChunkSize;
            }
            current.append(word, start, word.length());
            fresh = true;
        }

        private boolean fits(String separator, String piece) {
            int extra = current.length() == 0 ? 0 : separator.length();
            return current.length() + extra + piece.length() <= maxChunkSize;
        }

        private void append(String separator, String piece) {
            if (current.length() > 0) {
                current.append(separator);
            }
            current.append(piece);
            fresh = true;
        }

        private String closeAndTakeSeed() {
            if (!fresh) {
                String leftover = current.toString().strip();
                current.setLength(0);
                return leftover;
            }
            String closed = current.toString().strip();
            chunks.add(closed);
            current.setLength(0);
            fresh = false;
            return tailWords(closed, overlap / 10);
        }

        private void startWith(String seed, String piece) {
            String[] seedWords = seed.isBlank() ? new String[0] : seed.split("\\s+");
            for (int skip = 0; skip < seedWords.length; skip++) {
                String candidate = String.join(" ", Arrays.copyOfRange(seedWords, skip, seedWords.length));
                if (candidate.length() + 1 + piece.length() <= maxChunkSize) {
                    current.append(candidate).append(' ').append(piece);
                    fresh = true;
                    return;
                }
            }
            current.append(piece);
            fresh = true;
        }
    }

    static String tailWords(String text, int count) {
        if (count <= 0 || text.isBlank()) {
            return "";
        }
        String[] words = text.split("\\s+");
        int from = Math.max(0, words.length - count);
        return String.join(" ", Arrays.copyOfRange(words, from, words.length));
    }
}
