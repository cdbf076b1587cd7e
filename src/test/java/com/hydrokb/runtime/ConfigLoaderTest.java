package com.hydrokb.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadYamlSections() throws IOException {
        Path configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                chunking:
                  maxChunkSize: 600
                  overlap: 50
                embedding:
                  activeProvider: openai-small
                  openai:
                    apiKey: from-file
                vectorIndex:
                  type: milvus
                  collection: canales
                retrieval:
                  topK: 5
                  alpha: 0.4
                  rerank: false
                quality:
                  strictMode: true
                  preferredSources:
                    - Canal de Isabel II
                unknownSection:
                  ignored: true
                """);

        AppConfig config = ConfigLoader.load(configPath, Map.of());

        assertEquals(600, config.getChunking().getMaxChunkSize());
        assertEquals(50, config.getChunking().getOverlap());
        assertEquals("openai-small", config.getEmbedding().getActiveProvider());
        assertEquals("from-file", config.getEmbedding().getOpenai().getApiKey());
        assertEquals("milvus", config.getVectorIndex().getType());
        assertEquals("canales", config.getVectorIndex().getCollection());
        assertEquals(5, config.getRetrieval().getTopK());
        assertEquals(0.4, config.getRetrieval().getAlpha(), 1e-9);
        assertFalse(config.getRetrieval().isRerank());
        assertTrue(config.getQuality().isStrictMode());
        assertEquals(List.of("Canal de Isabel II"), config.getQuality().getPreferredSources());
        // sections absent from the file keep their defaults
        assertEquals(50, config.getSync().getBatchSize());
        assertEquals("http://127.0.0.1:11434", config.getEmbedding().getOllama().getBaseUrl());
    }

    @Test
    void shouldFallBackToDefaultsWhenFileIsMissing() throws IOException {
        AppConfig config = ConfigLoader.load(tempDir.resolve("absent.yml"), Map.of());

        assertEquals(1000, config.getChunking().getMaxChunkSize());
        assertEquals(200, config.getChunking().getOverlap());
        assertEquals("ollama-nomic", config.getEmbedding().getActiveProvider());
        assertEquals(60000, config.getEmbedding().getChunkTimeoutMs());
        assertEquals("local", config.getVectorIndex().getType());
        assertEquals(10, config.getRetrieval().getTopK());
        assertEquals(0.6, config.getRetrieval().getAlpha(), 1e-9);
        assertEquals(0.3, config.getRetrieval().getMinSemanticScore(), 1e-9);
        assertEquals(0.1, config.getRetrieval().getMinBm25Score(), 1e-9);
        assertEquals("es", config.getRetrieval().getLanguage());
        assertFalse(config.getQuality().isEnabled());
        assertEquals(0.6, config.getQuality().getMinQualityScore(), 1e-9);
        assertEquals(5000L, config.getSync().getMigrationDelayMs());
        assertNull(config.getEmbedding().getOpenai().getApiKey());
    }

    @Test
    void shouldLetEnvironmentOverrideSecretsAndEndpoints() throws IOException {
        Path configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                embedding:
                  openai:
                    apiKey: from-file
                """);

        AppConfig config = ConfigLoader.load(configPath, Map.of(
                ConfigLoader.OPENAI_KEY_ENV, "from-env",
                ConfigLoader.OLLAMA_URL_ENV, "http://gpu-box:11434"));

        assertEquals("from-env", config.getEmbedding().getOpenai().getApiKey());
        assertEquals("http://gpu-box:11434", config.getEmbedding().getOllama().getBaseUrl());
    }

    @Test
    void shouldIgnoreBlankEnvironmentValues() throws IOException {
        AppConfig config = ConfigLoader.load(tempDir.resolve("absent.yml"), Map.of(ConfigLoader.OPENAI_KEY_ENV, "  "));

        assertNull(config.getEmbedding().getOpenai().getApiKey());
    }
}
