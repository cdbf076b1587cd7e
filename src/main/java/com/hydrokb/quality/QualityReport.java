package com.hydrokb.quality;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate view over the metrics of one result set.
 */
public record QualityReport(
        double overallQuality,
        String summary,
        List<String> recommendations,
        Map<IssueType, Integer> issueCounts) {

    public QualityReport {
        recommendations = List.copyOf(recommendations);
        issueCounts = Map.copyOf(issueCounts);
    }

    public static QualityReport of(List<QualityMetrics> metrics) {
        if (metrics.isEmpty()) {
            return new QualityReport(0.0, "No results to evaluate.",
                    List.of("Rephrase the query", "Broaden the search filters"), Map.of());
        }
        double average = metrics.stream().mapToDouble(QualityMetrics::overall).average().orElse(0.0);
        Map<IssueType, Integer> counts = new EnumMap<>(IssueType.class);
        Set<String> recommendations = new LinkedHashSet<>();
        for (QualityMetrics metric : metrics) {
            metric.issues().forEach(issue -> counts.merge(issue.type(), 1, Integer::sum));
            recommendations.addAll(metric.recommendations());
        }
        String summary = String.format(Locale.ROOT, "Average quality: %.1f%%. %s", average * 100, band(average));
        return new QualityReport(average, summary, List.copyOf(recommendations), counts);
    }

    static String band(double average) {
        if (average >= 0.8) {
            return "Excellent result quality.";
        }
        if (average >= 0.6) {
            return "Good result quality.";
        }
        if (average >= 0.4) {
            return "Moderate quality; further validation recommended.";
        }
        return "Low quality; consider rephrasing the search.";
    }
}
