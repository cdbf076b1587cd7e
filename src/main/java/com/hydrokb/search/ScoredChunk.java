package com.hydrokb.search;

import java.util.Comparator;

import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;

public record ScoredChunk(Chunk chunk, Document document, double score, SearchMethod method) {

    /** Score descending, then chunk id ascending. */
    public static final Comparator<ScoredChunk> RANKING = Comparator.comparingDouble(ScoredChunk::score)
            .reversed()
            .thenComparingLong(ScoredChunk::chunkId);

    public static ScoredChunk of(Candidate candidate, double score, SearchMethod method) {
        return new ScoredChunk(candidate.chunk(), candidate.document(), score, method);
    }

    public long chunkId() {
        return chunk.id();
    }

    public String content() {
        return chunk.content();
    }

    public ScoredChunk withScore(double newScore) {
        return new ScoredChunk(chunk, document, newScore, method);
    }

    public ScoredChunk withScore(double newScore, SearchMethod newMethod) {
        return new ScoredChunk(chunk, document, newScore, newMethod);
    }
}
