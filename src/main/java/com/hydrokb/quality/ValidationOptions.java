package com.hydrokb.quality;

import java.util.List;

public record ValidationOptions(
        boolean strictMode,
        double minQualityScore,
        double maxContentAgeYears,
        List<String> preferredSources) {

    public ValidationOptions {
        if (maxContentAgeYears <= 0) {
            throw new IllegalArgumentException("maxContentAgeYears must be positive");
        }
        preferredSources = preferredSources == null ? List.of() : List.copyOf(preferredSources);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(false, 0.6, 10.0, List.of());
    }

    public ValidationOptions withStrictMode(boolean value) {
        return new ValidationOptions(value, minQualityScore, maxContentAgeYears, preferredSources);
    }

    public ValidationOptions withMinQualityScore(double value) {
        return new ValidationOptions(strictMode, value, maxContentAgeYears, preferredSources);
    }
}
