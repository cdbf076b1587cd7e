package com.hydrokb.quality;

public enum IssueType {
    LOW_RELEVANCE("low_relevance"),
    LOW_TECHNICAL_DENSITY("low_technical_density"),
    INCOMPLETE_INFO("incomplete_info"),
    OUTDATED_CONTENT("outdated_content"),
    UNRELIABLE_SOURCE("unreliable_source");

    private final String code;

    IssueType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
