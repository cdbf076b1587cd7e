package com.hydrokb.ingest;

import java.util.List;

/**
 * Caller-supplied fields of a document that has not been stored yet.
 */
public record DocumentDraft(
        String category,
        String subcategory,
        List<String> regions,
        String title,
        String content,
        DocumentMetadata metadata,
        String version) {
}
