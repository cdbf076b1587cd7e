package com.hydrokb.search;

/**
 * Why a result set was produced in a reduced mode.
 */
public enum Degradation {
    QUERY_EMBEDDING_FALLBACK,
    INDEX_UNREACHABLE,
    LEXICAL_FAILED,
    RERANK_FAILED
}
