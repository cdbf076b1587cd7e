package com.hydrokb.embedding;

public record ProviderDescriptor(String id, String displayName, String model, int dimension, ProviderKind kind) {

    public ProviderDescriptor {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive for provider " + id);
        }
    }
}
