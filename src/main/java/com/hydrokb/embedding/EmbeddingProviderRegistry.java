package com.hydrokb.embedding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the known embedding providers and which one is active. Handed to the engine by
 * reference; switching is an explicit call that notifies listeners and does not touch vectors
 * already stored.
 */
public class EmbeddingProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviderRegistry.class);

    private final Map<String, EmbeddingProvider> providers = new LinkedHashMap<>();
    private final List<ProviderSwitchListener> listeners = new CopyOnWriteArrayList<>();
    private volatile EmbeddingProvider active;

    public EmbeddingProviderRegistry(List<? extends EmbeddingProvider> initial, String activeId) {
        for (EmbeddingProvider provider : initial) {
            providers.put(provider.id(), provider);
        }
        EmbeddingProvider selected = providers.get(activeId);
        if (selected == null) {
            throw new UnknownProviderException(activeId);
        }
        this.active = selected;
    }

    public static EmbeddingProviderRegistry of(EmbeddingProvider provider) {
        return new EmbeddingProviderRegistry(List.of(provider), provider.id());
    }

    public synchronized List<ProviderDescriptor> listProviders() {
        List<ProviderDescriptor> descriptors = new ArrayList<>(providers.size());
        providers.values().forEach(provider -> descriptors.add(provider.descriptor()));
        return descriptors;
    }

    public synchronized void register(EmbeddingProvider provider) {
        providers.put(provider.id(), provider);
    }

    public void addSwitchListener(ProviderSwitchListener listener) {
        listeners.add(listener);
    }

    public void setActiveProvider(String providerId) {
        ProviderDescriptor previous;
        ProviderDescriptor current;
        synchronized (this) {
            EmbeddingProvider selected = providers.get(providerId);
            if (selected == null) {
                throw new UnknownProviderException(providerId);
            }
            previous = active.descriptor();
            if (previous.id().equals(providerId)) {
                return;
            }
            active = selected;
            current = selected.descriptor();
        }
        log.info("embedding.provider.switched from={} to={} dimension={}->{}",
                previous.id(), current.id(), previous.dimension(), current.dimension());
        for (ProviderSwitchListener listener : listeners) {
            listener.onProviderSwitch(previous, current);
        }
    }

    public EmbeddingProvider activeProvider() {
        return active;
    }

    public ProviderDescriptor activeDescriptor() {
        return active.descriptor();
    }

    public int activeDimension() {
        return active.dimension();
    }

    public EmbeddingResult generateEmbedding(String text) {
        EmbeddingProvider provider = active;
        try {
            return provider.embed(text);
        } catch (RuntimeException e) {
            log.warn("embedding.degraded provider={} reason={} cause={}",
                    provider.id(), DegradationReason.BACKEND_ERROR, e.toString());
            return fallbackFor(provider, text);
        }
    }

    public List<EmbeddingResult> generateBatchEmbeddings(List<String> texts) {
        EmbeddingProvider provider = active;
        try {
            return provider.embedBatch(texts);
        } catch (RuntimeException e) {
            log.warn("embedding.batch.degraded provider={} size={} reason={} cause={}",
                    provider.id(), texts.size(), DegradationReason.BACKEND_ERROR, e.toString());
            return texts.stream().map(text -> fallbackFor(provider, text)).toList();
        }
    }

    private static EmbeddingResult fallbackFor(EmbeddingProvider provider, String text) {
        float[] vector = HashingFallbackEmbeddingProvider.generateMockEmbedding(text, provider.dimension());
        return EmbeddingResult.degraded(vector, provider.id(), DegradationReason.BACKEND_ERROR);
    }
}
