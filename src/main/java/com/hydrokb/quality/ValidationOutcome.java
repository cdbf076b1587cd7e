package com.hydrokb.quality;

import java.util.List;

import com.hydrokb.search.SearchResult;

/**
 * {@code accepted} holds the results that cleared the threshold, best quality first;
 * {@code evaluated} holds every input result with its metrics, in input order.
 */
public record ValidationOutcome(List<AssessedResult> accepted, List<AssessedResult> evaluated) {

    public ValidationOutcome {
        accepted = List.copyOf(accepted);
        evaluated = List.copyOf(evaluated);
    }

    public List<SearchResult> results() {
        return accepted.stream().map(AssessedResult::result).toList();
    }

    public List<QualityMetrics> metrics() {
        return evaluated.stream().map(AssessedResult::metrics).toList();
    }
}
