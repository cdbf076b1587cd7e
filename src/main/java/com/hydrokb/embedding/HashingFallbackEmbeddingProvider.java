package com.hydrokb.embedding;

/**
 * Deterministic stand-in used whenever no real backend can answer. The text's hash seeds a
 * linear congruential sequence, so equal text always maps to the equal vector for a given
 * dimension. Vectors carry no meaning beyond identity.
 */
public class HashingFallbackEmbeddingProvider implements EmbeddingProvider {
    public static final String ID = "fallback";

    private static final long MULTIPLIER = 1103515245L;
    private static final long INCREMENT = 12345L;
    private static final long MASK = 0x7fffffffL;

    private final ProviderDescriptor descriptor;

    public HashingFallbackEmbeddingProvider(int dimension) {
        this.descriptor = new ProviderDescriptor(ID, "Deterministic fallback", "hash-lcg", dimension, ProviderKind.FALLBACK);
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public EmbeddingResult embed(String text) {
        return EmbeddingResult.degraded(generateMockEmbedding(text), ID, DegradationReason.FALLBACK_ACTIVE);
    }

    public float[] generateMockEmbedding(String text) {
        return generateMockEmbedding(text, descriptor.dimension());
    }

    public static float[] generateMockEmbedding(String text, int dimension) {
        float[] vector = new float[dimension];
        long state = (text == null ? "" : text).hashCode() & MASK;
        for (int i = 0; i < dimension; i++) {
            state = (state * MULTIPLIER + INCREMENT) & MASK;
            vector[i] = (float) ((state / (double) MASK) * 2.0 - 1.0);
        }
        return vector;
    }
}
