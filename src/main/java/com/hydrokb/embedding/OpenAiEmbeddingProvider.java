package com.hydrokb.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Cloud embeddings over the OpenAI {@code /embeddings} endpoint. One HTTP call per text or per
 * batch.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ProviderDescriptor descriptor;
    private final String baseUrl;
    private final CredentialStore credentials;
    private final HashingFallbackEmbeddingProvider fallback;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient,
            ProviderDescriptor descriptor,
            String baseUrl,
            CredentialStore credentials,
            long timeoutMs) {
        this.httpClient = httpClient.newBuilder().callTimeout(timeoutMs, TimeUnit.MILLISECONDS).build();
        this.descriptor = descriptor;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.credentials = credentials;
        this.fallback = new HashingFallbackEmbeddingProvider(descriptor.dimension());
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public EmbeddingResult embed(String text) {
        Optional<String> apiKey = credentials.apiKey(ProviderKind.OPENAI);
        if (apiKey.isEmpty()) {
            log.warn("embedding.degraded provider={} reason={}", descriptor.id(), DegradationReason.NO_CREDENTIAL);
            return degraded(text, DegradationReason.NO_CREDENTIAL);
        }
        try {
            List<float[]> vectors = post(apiKey.get(), text);
            if (vectors.isEmpty() || vectors.get(0).length == 0) {
                log.warn("embedding.degraded provider={} reason={}", descriptor.id(), DegradationReason.EMPTY_RESPONSE);
                return degraded(text, DegradationReason.EMPTY_RESPONSE);
            }
            return EmbeddingResult.of(vectors.get(0), descriptor.id());
        } catch (IOException e) {
            log.warn("embedding.degraded provider={} reason={} cause={}",
                    descriptor.id(), DegradationReason.BACKEND_ERROR, e.getMessage());
            return degraded(text, DegradationReason.BACKEND_ERROR);
        }
    }

    @Override
    public List<EmbeddingResult> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        Optional<String> apiKey = credentials.apiKey(ProviderKind.OPENAI);
        if (apiKey.isEmpty()) {
            log.warn("embedding.batch.degraded provider={} size={} reason={}",
                    descriptor.id(), texts.size(), DegradationReason.NO_CREDENTIAL);
            return degradedAll(texts, DegradationReason.NO_CREDENTIAL);
        }
        try {
            List<float[]> vectors = post(apiKey.get(), texts);
            if (vectors.size() != texts.size()) {
                log.warn("embedding.batch.degraded provider={} expected={} received={} reason={}",
                        descriptor.id(), texts.size(), vectors.size(), DegradationReason.EMPTY_RESPONSE);
                return degradedAll(texts, DegradationReason.EMPTY_RESPONSE);
            }
            List<EmbeddingResult> results = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                float[] vector = vectors.get(i);
                results.add(vector.length == 0
                        ? degraded(texts.get(i), DegradationReason.EMPTY_RESPONSE)
                        : EmbeddingResult.of(vector, descriptor.id()));
            }
            return results;
        } catch (IOException e) {
            log.warn("embedding.batch.degraded provider={} size={} reason={} cause={}",
                    descriptor.id(), texts.size(), DegradationReason.BACKEND_ERROR, e.getMessage());
            return degradedAll(texts, DegradationReason.BACKEND_ERROR);
        }
    }

    private List<float[]> post(String apiKey, Object input) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", descriptor.model());
        body.put("input", input);
        body.put("encoding_format", "float");
        Request request = new Request.Builder()
                .url(baseUrl + "/embeddings")
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from " + request.url());
            }
            JsonNode data = mapper.readTree(response.body().string()).path("data");
            if (!data.isArray()) {
                return List.of();
            }
            float[][] ordered = new float[data.size()][];
            for (int i = 0; i < data.size(); i++) {
                JsonNode item = data.get(i);
                int index = item.path("index").asInt(i);
                if (index < 0 || index >= ordered.length) {
                    index = i;
                }
                ordered[index] = toVector(item.path("embedding"));
            }
            List<float[]> vectors = new ArrayList<>(ordered.length);
            for (float[] vector : ordered) {
                vectors.add(vector == null ? new float[0] : vector);
            }
            return vectors;
        }
    }

    static float[] toVector(JsonNode node) {
        if (!node.isArray()) {
            return new float[0];
        }
        float[] out = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            out[i] = (float) node.get(i).asDouble();
        }
        return out;
    }

    private EmbeddingResult degraded(String text, DegradationReason reason) {
        return EmbeddingResult.degraded(fallback.generateMockEmbedding(text), descriptor.id(), reason);
    }

    private List<EmbeddingResult> degradedAll(List<String> texts, DegradationReason reason) {
        return texts.stream().map(text -> degraded(text, reason)).toList();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
