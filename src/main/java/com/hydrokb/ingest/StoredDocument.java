package com.hydrokb.ingest;

import java.util.List;

public record StoredDocument(Document document, List<Chunk> chunks) {
}
