package com.hydrokb.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Reads the models installed on a local Ollama server ({@code GET /api/tags}).
 */
public class OllamaModelCatalog {
    private static final List<String> EMBEDDING_MARKERS = List.of("embed", "nomic", "mxbai", "minilm", "bge", "e5-");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;

    public OllamaModelCatalog(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = OpenAiEmbeddingProvider.stripTrailingSlash(baseUrl);
    }

    public List<String> installedModels() throws IOException {
        Request request = new Request.Builder().url(baseUrl + "/api/tags").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("HTTP " + response.code() + " from " + request.url());
            }
            JsonNode models = mapper.readTree(response.body().string()).path("models");
            List<String> names = new ArrayList<>();
            for (JsonNode model : models) {
                String name = model.path("name").asText("");
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
            return names;
        }
    }

    public boolean isInstalled(String model) throws IOException {
        return installedModels().stream().anyMatch(name -> sameModel(name, model));
    }

    /**
     * Installed models that look like embedding models, described as providers with an inferred
     * dimension.
     */
    public List<ProviderDescriptor> embeddingProviders() throws IOException {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (String name : installedModels()) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (EMBEDDING_MARKERS.stream().noneMatch(lower::contains)) {
                continue;
            }
            String base = stripTag(name);
            descriptors.add(new ProviderDescriptor(
                    "ollama-" + base.replaceAll("[^A-Za-z0-9.-]", "-"),
                    "Ollama " + base,
                    name,
                    inferDimension(name),
                    ProviderKind.OLLAMA));
        }
        return descriptors;
    }

    public static int inferDimension(String modelName) {
        String name = modelName.toLowerCase(Locale.ROOT);
        if (name.contains("mxbai") || name.contains("bge-large") || name.contains("e5-large")) {
            return 1024;
        }
        if (name.contains("minilm")) {
            return 384;
        }
        if (name.contains("gemma")) {
            return 3072;
        }
        if (name.contains("llama") || name.contains("mistral")) {
            return 4096;
        }
        return 768;
    }

    static boolean sameModel(String installed, String requested) {
        return installed.equals(requested)
                || stripTag(installed).equals(requested)
                || installed.equals(requested + ":latest");
    }

    private static String stripTag(String name) {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(0, colon);
    }
}
