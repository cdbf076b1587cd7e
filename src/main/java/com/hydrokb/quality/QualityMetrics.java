package com.hydrokb.quality;

import java.util.List;

public record QualityMetrics(
        double relevance,
        double technicalAccuracy,
        double completeness,
        double freshness,
        double sourceReliability,
        double overall,
        List<QualityIssue> issues,
        List<String> recommendations) {

    public QualityMetrics {
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public boolean hasIssue(IssueType type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }
}
