package com.hydrokb.embedding;

import java.util.Optional;

/**
 * Source of API credentials for cloud backends. Empty means "not configured or disabled".
 */
@FunctionalInterface
public interface CredentialStore {
    Optional<String> apiKey(ProviderKind kind);

    static CredentialStore none() {
        return kind -> Optional.empty();
    }
}
