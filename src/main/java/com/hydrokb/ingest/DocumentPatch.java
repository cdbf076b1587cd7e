package com.hydrokb.ingest;

import java.time.Instant;
import java.util.List;

/**
 * Partial document update. Null fields are left untouched.
 */
public record DocumentPatch(
        String category,
        String subcategory,
        List<String> regions,
        String title,
        String content,
        DocumentMetadata metadata,
        String version,
        DocumentStatus status) {

    public static DocumentPatch content(String content) {
        return new DocumentPatch(null, null, null, null, content, null, null, null);
    }

    public static DocumentPatch title(String title) {
        return new DocumentPatch(null, null, null, title, null, null, null, null);
    }

    public Document applyTo(Document current, Instant now) {
        return new Document(
                current.id(),
                category != null ? category : current.category(),
                subcategory != null ? subcategory : current.subcategory(),
                regions != null ? regions : current.regions(),
                title != null ? title : current.title(),
                content != null ? content : current.content(),
                metadata != null ? metadata : current.metadata(),
                version != null ? version : current.version(),
                status != null ? status : current.status(),
                current.createdAt(),
                now);
    }
}
