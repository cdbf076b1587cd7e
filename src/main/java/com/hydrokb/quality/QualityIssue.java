package com.hydrokb.quality;

public record QualityIssue(IssueType type, Severity severity, String description, String suggestion) {
}
