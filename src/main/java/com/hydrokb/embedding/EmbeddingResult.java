package com.hydrokb.embedding;

/**
 * A vector plus how it was obtained. {@code degraded} marks vectors produced by the hashing
 * fallback instead of the requested backend.
 */
public record EmbeddingResult(float[] vector, String providerId, boolean degraded, DegradationReason reason) {

    public static EmbeddingResult of(float[] vector, String providerId) {
        return new EmbeddingResult(vector, providerId, false, null);
    }

    public static EmbeddingResult degraded(float[] vector, String providerId, DegradationReason reason) {
        return new EmbeddingResult(vector, providerId, true, reason);
    }

    public int dimension() {
        return vector.length;
    }
}
