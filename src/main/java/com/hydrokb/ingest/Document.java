package com.hydrokb.ingest;

import java.time.Instant;
import java.util.List;

public record Document(
        String id,
        String category,
        String subcategory,
        List<String> regions,
        String title,
        String content,
        DocumentMetadata metadata,
        String version,
        DocumentStatus status,
        Instant createdAt,
        Instant updatedAt) {

    public Document {
        regions = regions == null ? List.of() : List.copyOf(regions);
        metadata = metadata == null ? DocumentMetadata.empty(null) : metadata;
        status = status == null ? DocumentStatus.ACTIVE : status;
    }

    public String language() {
        return metadata.language();
    }

    public Document withId(String newId) {
        return new Document(newId, category, subcategory, regions, title, content, metadata, version, status, createdAt,
                updatedAt);
    }
}
