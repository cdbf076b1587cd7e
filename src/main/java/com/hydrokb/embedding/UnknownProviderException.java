package com.hydrokb.embedding;

public class UnknownProviderException extends RuntimeException {
    public UnknownProviderException(String providerId) {
        super("Unknown embedding provider: " + providerId);
    }
}
