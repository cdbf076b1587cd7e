package com.hydrokb.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Vector column of a chunk, tagged with the provider that produced it and its declared width.
 */
public record StoredEmbedding(String providerId, int dimension, float[] values) {

    public StoredEmbedding {
        values = values == null ? new float[0] : values;
    }

    public static StoredEmbedding of(String providerId, float[] values) {
        return new StoredEmbedding(providerId, values.length, values);
    }

    @JsonIgnore
    public boolean isMalformed() {
        if (values.length == 0 || values.length != dimension) {
            return true;
        }
        for (float value : values) {
            if (Float.isNaN(value) || Float.isInfinite(value)) {
                return true;
            }
        }
        return false;
    }

    public boolean fits(int expectedDimension) {
        return !isMalformed() && dimension == expectedDimension;
    }
}
