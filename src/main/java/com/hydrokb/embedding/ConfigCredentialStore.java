package com.hydrokb.embedding;

import java.util.Optional;

import com.hydrokb.runtime.AppConfig;

public class ConfigCredentialStore implements CredentialStore {
    private final AppConfig.EmbeddingConfig config;

    public ConfigCredentialStore(AppConfig.EmbeddingConfig config) {
        this.config = config;
    }

    @Override
    public Optional<String> apiKey(ProviderKind kind) {
        if (kind != ProviderKind.OPENAI || !config.getOpenai().isEnabled()) {
            return Optional.empty();
        }
        String key = config.getOpenai().getApiKey();
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key);
    }
}
