package com.hydrokb.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class HashingFallbackEmbeddingProviderTest {

    @Test
    void shouldBeDeterministicAndBounded() {
        HashingFallbackEmbeddingProvider provider = new HashingFallbackEmbeddingProvider(64);

        EmbeddingResult first = provider.embed("caudal de diseño");
        EmbeddingResult second = provider.embed("caudal de diseño");

        assertArrayEquals(first.vector(), second.vector());
        assertEquals(64, first.dimension());
        assertTrue(first.degraded());
        assertEquals(DegradationReason.FALLBACK_ACTIVE, first.reason());
        for (float value : first.vector()) {
            assertTrue(value >= -1f && value <= 1f);
        }
    }

    @Test
    void differentTextShouldGiveDifferentVectors() {
        float[] a = HashingFallbackEmbeddingProvider.generateMockEmbedding("bomba", 16);
        float[] b = HashingFallbackEmbeddingProvider.generateMockEmbedding("válvula", 16);

        assertFalse(Arrays.equals(a, b));
        assertEquals(16, HashingFallbackEmbeddingProvider.generateMockEmbedding(null, 16).length);
    }
}
