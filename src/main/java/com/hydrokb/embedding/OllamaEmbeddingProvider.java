package com.hydrokb.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Local model server backend. Ollama has no batch endpoint, so a batch is served as sequential
 * single-text calls after one model-presence check.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ProviderDescriptor descriptor;
    private final String baseUrl;
    private final OllamaModelCatalog catalog;
    private final HashingFallbackEmbeddingProvider fallback;

    public OllamaEmbeddingProvider(OkHttpClient httpClient, ProviderDescriptor descriptor, String baseUrl, long timeoutMs) {
        this.httpClient = httpClient.newBuilder().callTimeout(timeoutMs, TimeUnit.MILLISECONDS).build();
        this.descriptor = descriptor;
        this.baseUrl = OpenAiEmbeddingProvider.stripTrailingSlash(baseUrl);
        this.catalog = new OllamaModelCatalog(this.httpClient, this.baseUrl);
        this.fallback = new HashingFallbackEmbeddingProvider(descriptor.dimension());
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public EmbeddingResult embed(String text) {
        if (!modelAvailable()) {
            return degraded(text, DegradationReason.MODEL_NOT_FOUND);
        }
        return embedUnchecked(text);
    }

    @Override
    public List<EmbeddingResult> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        boolean available = modelAvailable();
        List<EmbeddingResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(available ? embedUnchecked(text) : degraded(text, DegradationReason.MODEL_NOT_FOUND));
        }
        return results;
    }

    private boolean modelAvailable() {
        try {
            if (catalog.isInstalled(descriptor.model())) {
                return true;
            }
            log.warn("embedding.degraded provider={} reason={} hint=\"ollama pull {}\"",
                    descriptor.id(), DegradationReason.MODEL_NOT_FOUND, descriptor.model());
            return false;
        } catch (IOException e) {
            log.warn("embedding.model-check.skipped provider={} cause={}", descriptor.id(), e.getMessage());
            return true;
        }
    }

    private EmbeddingResult embedUnchecked(String text) {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("model", descriptor.model(), "prompt", text == null ? "" : text));
        } catch (IOException e) {
            log.warn("embedding.degraded provider={} reason={} cause={}",
                    descriptor.id(), DegradationReason.BACKEND_ERROR, e.getMessage());
            return degraded(text, DegradationReason.BACKEND_ERROR);
        }
        Request request = new Request.Builder()
                .url(baseUrl + "/api/embeddings")
                .post(RequestBody.create(payload, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("embedding.degraded provider={} reason={} status={}",
                        descriptor.id(), DegradationReason.BACKEND_ERROR, response.code());
                return degraded(text, DegradationReason.BACKEND_ERROR);
            }
            float[] vector = OpenAiEmbeddingProvider.toVector(mapper.readTree(response.body().string()).path("embedding"));
            if (vector.length == 0) {
                log.warn("embedding.degraded provider={} reason={}", descriptor.id(), DegradationReason.EMPTY_RESPONSE);
                return degraded(text, DegradationReason.EMPTY_RESPONSE);
            }
            if (vector.length != descriptor.dimension()) {
                log.warn("embedding.degraded provider={} reason={} model={} declared={} returned={}",
                        descriptor.id(), DegradationReason.DIMENSION_MISMATCH, descriptor.model(),
                        descriptor.dimension(), vector.length);
                return degraded(text, DegradationReason.DIMENSION_MISMATCH);
            }
            return EmbeddingResult.of(vector, descriptor.id());
        } catch (IOException e) {
            log.warn("embedding.degraded provider={} reason={} cause={}",
                    descriptor.id(), DegradationReason.BACKEND_ERROR, e.getMessage());
            return degraded(text, DegradationReason.BACKEND_ERROR);
        }
    }

    private EmbeddingResult degraded(String text, DegradationReason reason) {
        return EmbeddingResult.degraded(fallback.generateMockEmbedding(text), descriptor.id(), reason);
    }
}
