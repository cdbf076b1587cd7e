package com.hydrokb.ingest;

import java.util.Locale;

/**
 * Selects ACTIVE documents. Region matching is case-insensitive; {@link RegionMatch#TAG} asks for
 * one region tag equal to {@code region}, the way the vector index filters, while
 * {@link RegionMatch#CONTAINS} accepts any tag containing it.
 */
public record DocumentFilter(String category, String region, String language, RegionMatch regionMatch) {

    public enum RegionMatch {
        TAG,
        CONTAINS
    }

    public DocumentFilter(String category, String region, String language) {
        this(category, region, language, RegionMatch.TAG);
    }

    public DocumentFilter {
        regionMatch = regionMatch == null ? RegionMatch.TAG : regionMatch;
    }

    public static DocumentFilter any() {
        return new DocumentFilter(null, null, null);
    }

    public boolean matches(Document document) {
        if (document.status() != DocumentStatus.ACTIVE) {
            return false;
        }
        if (category != null && !category.equals(document.category())) {
            return false;
        }
        if (language != null && !language.equals(document.language())) {
            return false;
        }
        if (region != null) {
            String wanted = region.toLowerCase(Locale.ROOT);
            return document.regions().stream()
                    .map(tag -> tag.toLowerCase(Locale.ROOT))
                    .anyMatch(tag -> regionMatch == RegionMatch.TAG ? tag.equals(wanted) : tag.contains(wanted));
        }
        return true;
    }
}
