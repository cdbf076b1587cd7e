package com.hydrokb.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VectorIndexConfig vectorIndex = new VectorIndexConfig();
    private SyncConfig sync = new SyncConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private QualityConfig quality = new QualityConfig();
    private StoreConfig store = new StoreConfig();

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VectorIndexConfig getVectorIndex() {
        return vectorIndex;
    }

    public void setVectorIndex(VectorIndexConfig vectorIndex) {
        this.vectorIndex = vectorIndex == null ? new VectorIndexConfig() : vectorIndex;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public QualityConfig getQuality() {
        return quality;
    }

    public void setQuality(QualityConfig quality) {
        this.quality = quality == null ? new QualityConfig() : quality;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int maxChunkSize = 1000;
        private int overlap = 200;

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String activeProvider = "ollama-nomic";
        private int chunkTimeoutMs = 60000;
        private OpenAiConfig openai = new OpenAiConfig();
        private OllamaConfig ollama = new OllamaConfig();

        public String getActiveProvider() {
            return activeProvider;
        }

        public void setActiveProvider(String activeProvider) {
            this.activeProvider = activeProvider;
        }

        public int getChunkTimeoutMs() {
            return chunkTimeoutMs;
        }

        public void setChunkTimeoutMs(int chunkTimeoutMs) {
            this.chunkTimeoutMs = chunkTimeoutMs;
        }

        public OpenAiConfig getOpenai() {
            return openai;
        }

        public void setOpenai(OpenAiConfig openai) {
            this.openai = openai == null ? new OpenAiConfig() : openai;
        }

        public OllamaConfig getOllama() {
            return ollama;
        }

        public void setOllama(OllamaConfig ollama) {
            this.ollama = ollama == null ? new OllamaConfig() : ollama;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpenAiConfig {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private int timeoutMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaConfig {
        private boolean enabled = true;
        private String baseUrl = "http://127.0.0.1:11434";
        private int timeoutMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorIndexConfig {
        private String type = "local";
        private String collection = "hydraulic_knowledge";
        private String path = ".hydrokb/vector-index.json";
        private String milvusUrl = "http://127.0.0.1:19530";
        private String milvusToken;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getMilvusUrl() {
            return milvusUrl;
        }

        public void setMilvusUrl(String milvusUrl) {
            this.milvusUrl = milvusUrl;
        }

        public String getMilvusToken() {
            return milvusToken;
        }

        public void setMilvusToken(String milvusToken) {
            this.milvusToken = milvusToken;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private int batchSize = 50;
        private long pauseBetweenBatchesMs = 100;
        private int maxEmbeddingChars = 8000;
        private long migrationDelayMs = 5000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getPauseBetweenBatchesMs() {
            return pauseBetweenBatchesMs;
        }

        public void setPauseBetweenBatchesMs(long pauseBetweenBatchesMs) {
            this.pauseBetweenBatchesMs = pauseBetweenBatchesMs;
        }

        public int getMaxEmbeddingChars() {
            return maxEmbeddingChars;
        }

        public void setMaxEmbeddingChars(int maxEmbeddingChars) {
            this.maxEmbeddingChars = maxEmbeddingChars;
        }

        public long getMigrationDelayMs() {
            return migrationDelayMs;
        }

        public void setMigrationDelayMs(long migrationDelayMs) {
            this.migrationDelayMs = migrationDelayMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 10;
        private double alpha = 0.6;
        private double minSemanticScore = 0.3;
        private double minBm25Score = 0.1;
        private boolean rerank = true;
        private int rerankMinLength = 200;
        private int rerankMaxLength = 1500;
        private String language = "es";

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }

        public double getMinSemanticScore() {
            return minSemanticScore;
        }

        public void setMinSemanticScore(double minSemanticScore) {
            this.minSemanticScore = minSemanticScore;
        }

        public double getMinBm25Score() {
            return minBm25Score;
        }

        public void setMinBm25Score(double minBm25Score) {
            this.minBm25Score = minBm25Score;
        }

        public boolean isRerank() {
            return rerank;
        }

        public void setRerank(boolean rerank) {
            this.rerank = rerank;
        }

        public int getRerankMinLength() {
            return rerankMinLength;
        }

        public void setRerankMinLength(int rerankMinLength) {
            this.rerankMinLength = rerankMinLength;
        }

        public int getRerankMaxLength() {
            return rerankMaxLength;
        }

        public void setRerankMaxLength(int rerankMaxLength) {
            this.rerankMaxLength = rerankMaxLength;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QualityConfig {
        private boolean enabled = false;
        private boolean strictMode = false;
        private double minQualityScore = 0.6;
        private double maxContentAgeYears = 10;
        private List<String> preferredSources = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isStrictMode() {
            return strictMode;
        }

        public void setStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
        }

        public double getMinQualityScore() {
            return minQualityScore;
        }

        public void setMinQualityScore(double minQualityScore) {
            this.minQualityScore = minQualityScore;
        }

        public double getMaxContentAgeYears() {
            return maxContentAgeYears;
        }

        public void setMaxContentAgeYears(double maxContentAgeYears) {
            this.maxContentAgeYears = maxContentAgeYears;
        }

        public List<String> getPreferredSources() {
            return preferredSources;
        }

        public void setPreferredSources(List<String> preferredSources) {
            this.preferredSources = preferredSources == null ? new ArrayList<>() : preferredSources;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path = ".hydrokb/knowledge-store.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
