package com.hydrokb.search;

public enum SearchMethod {
    LEXICAL,
    SEMANTIC,
    HYBRID
}
