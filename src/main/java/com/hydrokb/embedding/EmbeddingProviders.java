package com.hydrokb.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviders.class);

    public static final int FALLBACK_DIMENSION = 768;

    private EmbeddingProviders() {
    }

    public static List<ProviderDescriptor> builtInCatalog() {
        return List.of(
                new ProviderDescriptor("openai-small", "OpenAI Small", "text-embedding-3-small", 1536, ProviderKind.OPENAI),
                new ProviderDescriptor("openai-large", "OpenAI Large", "text-embedding-3-large", 3072, ProviderKind.OPENAI),
                new ProviderDescriptor("ollama-nomic", "Ollama Nomic Embed", "nomic-embed-text", 768, ProviderKind.OLLAMA),
                new ProviderDescriptor("ollama-mxbai", "Ollama MxBai Embed", "mxbai-embed-large", 1024, ProviderKind.OLLAMA),
                new ProviderDescriptor("ollama-all-minilm", "Ollama All-MiniLM", "all-minilm", 384, ProviderKind.OLLAMA));
    }

    public static EmbeddingProviderRegistry fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        CredentialStore credentials = new ConfigCredentialStore(config);
        List<EmbeddingProvider> providers = new ArrayList<>();
        for (ProviderDescriptor descriptor : builtInCatalog()) {
            providers.add(create(descriptor, config, credentials, httpClient));
        }
        providers.add(new HashingFallbackEmbeddingProvider(FALLBACK_DIMENSION));

        String configured = config.getActiveProvider();
        String activeId = configured;
        if (providers.stream().noneMatch(provider -> provider.id().equals(configured))) {
            log.warn("embedding.provider.unknown configured={} using={}", configured, HashingFallbackEmbeddingProvider.ID);
            activeId = HashingFallbackEmbeddingProvider.ID;
        }
        return new EmbeddingProviderRegistry(providers, activeId);
    }

    /**
     * Adds installed Ollama embedding models that are not already in the registry.
     *
     * @return how many providers were added
     */
    public static int discoverOllamaModels(EmbeddingProviderRegistry registry,
            AppConfig.EmbeddingConfig config,
            OkHttpClient httpClient) {
        if (!config.getOllama().isEnabled()) {
            return 0;
        }
        OllamaModelCatalog catalog = new OllamaModelCatalog(httpClient, config.getOllama().getBaseUrl());
        try {
            List<String> known = registry.listProviders().stream().map(ProviderDescriptor::model).toList();
            int added = 0;
            for (ProviderDescriptor descriptor : catalog.embeddingProviders()) {
                if (known.stream().anyMatch(model -> OllamaModelCatalog.sameModel(descriptor.model(), model))) {
                    continue;
                }
                registry.register(create(descriptor, config, CredentialStore.none(), httpClient));
                added++;
            }
            log.info("embedding.discovery.completed added={}", added);
            return added;
        } catch (IOException e) {
            log.warn("embedding.discovery.unavailable baseUrl={} cause={}", config.getOllama().getBaseUrl(), e.getMessage());
            return 0;
        }
    }

    static EmbeddingProvider create(ProviderDescriptor descriptor,
            AppConfig.EmbeddingConfig config,
            CredentialStore credentials,
            OkHttpClient httpClient) {
        return switch (descriptor.kind()) {
            case OPENAI -> new OpenAiEmbeddingProvider(
                    httpClient,
                    descriptor,
                    config.getOpenai().getBaseUrl(),
                    credentials,
                    config.getOpenai().getTimeoutMs());
            case OLLAMA -> new OllamaEmbeddingProvider(
                    httpClient,
                    descriptor,
                    config.getOllama().getBaseUrl(),
                    config.getOllama().getTimeoutMs());
            case FALLBACK -> new HashingFallbackEmbeddingProvider(descriptor.dimension());
        };
    }
}
