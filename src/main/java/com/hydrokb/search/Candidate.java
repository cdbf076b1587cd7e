package com.hydrokb.search;

import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;

public record Candidate(Chunk chunk, Document document) {
}
