package com.hydrokb;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingProviders;
import com.hydrokb.health.IndexHealthService;
import com.hydrokb.ingest.Chunker;
import com.hydrokb.ingest.IngestionService;
import com.hydrokb.ingest.LocalJsonKnowledgeStore;
import com.hydrokb.quality.QualityValidator;
import com.hydrokb.quality.ValidationOptions;
import com.hydrokb.runtime.AppConfig;
import com.hydrokb.search.HybridRanker;
import com.hydrokb.search.SearchOptions;
import com.hydrokb.vector.BackgroundSyncRunner;
import com.hydrokb.vector.LocalJsonVectorIndex;
import com.hydrokb.vector.MilvusRestVectorIndex;
import com.hydrokb.vector.VectorIndex;
import com.hydrokb.vector.VectorIndexSync;

import okhttp3.OkHttpClient;

/**
 * Wires the engine from configuration: the JSON knowledge store, the configured vector index,
 * the provider registry with its switch hook, and the services on top.
 */
public final class HydroKb implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HydroKb.class);

    private final AppConfig config;
    private final OkHttpClient httpClient;
    private final Path storePath;
    private final LocalJsonKnowledgeStore store;
    private final VectorIndex index;
    private final EmbeddingProviderRegistry providers;
    private final VectorIndexSync sync;
    private final BackgroundSyncRunner migrations;
    private final IngestionService ingestion;
    private final RetrievalService retrieval;
    private final IndexHealthService health;

    private HydroKb(AppConfig config, OkHttpClient httpClient, LocalJsonKnowledgeStore store, VectorIndex index,
            EmbeddingProviderRegistry providers) {
        this.config = config;
        this.httpClient = httpClient;
        this.storePath = Path.of(config.getStore().getPath());
        this.store = store;
        this.index = index;
        this.providers = providers;

        AppConfig.SyncConfig syncConfig = config.getSync();
        String collection = config.getVectorIndex().getCollection();
        this.sync = new VectorIndexSync(store, index, providers, collection, new VectorIndexSync.Settings(
                syncConfig.getBatchSize(), syncConfig.getPauseBetweenBatchesMs(), syncConfig.getMaxEmbeddingChars()));
        this.migrations = new BackgroundSyncRunner(sync, syncConfig.getMigrationDelayMs());
        providers.addSwitchListener(migrations);

        this.ingestion = new IngestionService(store, providers, sync,
                new Chunker(config.getChunking().getMaxChunkSize(), config.getChunking().getOverlap()),
                config.getEmbedding().getChunkTimeoutMs());
        AppConfig.RetrievalConfig retrievalConfig = config.getRetrieval();
        this.retrieval = new RetrievalService(store, providers, index, collection, ingestion,
                new HybridRanker(retrievalConfig.getRerankMinLength(), retrievalConfig.getRerankMaxLength()),
                new QualityValidator(),
                searchDefaults(retrievalConfig),
                config.getQuality().isEnabled() ? validationOptions(config.getQuality()) : null);
        this.health = new IndexHealthService(store, index, collection, providers);
    }

    public static HydroKb open(AppConfig config) throws IOException {
        return open(config, new OkHttpClient());
    }

    public static HydroKb open(AppConfig config, OkHttpClient httpClient) throws IOException {
        LocalJsonKnowledgeStore store = LocalJsonKnowledgeStore.load(Path.of(config.getStore().getPath()));
        VectorIndex index = openIndex(config.getVectorIndex(), httpClient);
        EmbeddingProviderRegistry providers = EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient);
        log.info("kb.opened documents={} chunks={} index={} collection={} provider={} dimension={}",
                store.countDocuments(), store.countChunks(), config.getVectorIndex().getType(),
                config.getVectorIndex().getCollection(), providers.activeDescriptor().id(), providers.activeDimension());
        return new HydroKb(config, httpClient, store, index, providers);
    }

    static VectorIndex openIndex(AppConfig.VectorIndexConfig config, OkHttpClient httpClient) throws IOException {
        String type = config.getType() == null ? "local" : config.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "local" -> LocalJsonVectorIndex.load(Path.of(config.getPath()));
            case "milvus" -> new MilvusRestVectorIndex(httpClient, config.getMilvusUrl(), config.getMilvusToken());
            default -> throw new IllegalArgumentException("Unknown vector index type: " + config.getType());
        };
    }

    static SearchOptions searchDefaults(AppConfig.RetrievalConfig config) {
        return new SearchOptions(config.getTopK(), config.getAlpha(), config.getMinSemanticScore(),
                config.getMinBm25Score(), null, null, config.getLanguage(), config.isRerank(), false);
    }

    static ValidationOptions validationOptions(AppConfig.QualityConfig config) {
        return new ValidationOptions(config.isStrictMode(), config.getMinQualityScore(),
                config.getMaxContentAgeYears(), config.getPreferredSources());
    }

    public void save() throws IOException {
        store.save(storePath);
        log.debug("kb.saved path={}", storePath);
    }

    public AppConfig config() {
        return config;
    }

    public OkHttpClient httpClient() {
        return httpClient;
    }

    public LocalJsonKnowledgeStore store() {
        return store;
    }

    public VectorIndex index() {
        return index;
    }

    public EmbeddingProviderRegistry providers() {
        return providers;
    }

    public VectorIndexSync sync() {
        return sync;
    }

    public RetrievalService retrieval() {
        return retrieval;
    }

    public IndexHealthService health() {
        return health;
    }

    @Override
    public void close() {
        migrations.close();
        ingestion.close();
    }
}
