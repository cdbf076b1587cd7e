package com.hydrokb.quality;

import com.hydrokb.search.SearchResult;

public record AssessedResult(SearchResult result, QualityMetrics metrics) {
}
