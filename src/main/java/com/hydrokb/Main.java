package com.hydrokb;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviders;
import com.hydrokb.embedding.ProviderDescriptor;
import com.hydrokb.embedding.UnknownProviderException;
import com.hydrokb.health.DocumentIndexReport;
import com.hydrokb.health.IndexingValidationReport;
import com.hydrokb.health.KnowledgeBaseHealth;
import com.hydrokb.ingest.DocumentDraft;
import com.hydrokb.ingest.DocumentMetadata;
import com.hydrokb.ingest.IngestionException;
import com.hydrokb.quality.AssessedResult;
import com.hydrokb.quality.QualityReport;
import com.hydrokb.quality.ValidationOptions;
import com.hydrokb.quality.ValidationOutcome;
import com.hydrokb.runtime.AppConfig;
import com.hydrokb.runtime.ConfigLoader;
import com.hydrokb.search.SearchOptions;
import com.hydrokb.search.SearchResult;
import com.hydrokb.vector.SyncMode;
import com.hydrokb.vector.SyncReport;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "hydro-kb",
        mixinStandardHelpOptions = true,
        version = "hydro-kb 0.1.0",
        description = "Hybrid lexical and semantic retrieval over a hydraulic engineering knowledge base.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "search")
    Mode mode;

    @Option(names = "--provider", description = "Embedding provider to activate before running")
    String provider;

    @Option(names = "--file", description = "Text or markdown file to ingest")
    Path file;

    @Option(names = "--title", description = "Document title (defaults to the file name)")
    String title;

    @Option(names = "--category", description = "Document category, or category filter when searching")
    String category;

    @Option(names = "--subcategory", description = "Document subcategory")
    String subcategory;

    @Option(names = "--region", description = "Region tag; repeat for several when ingesting")
    List<String> regions;

    @Option(names = "--language", description = "Document language, or language filter when searching")
    String language;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return")
    Integer topK;

    @Option(names = "--alpha", description = "Semantic weight in [0, 1]")
    Double alpha;

    @Option(names = "--quick", description = "Use the quick preset (semantic-leaning, no re-rank)", defaultValue = "false")
    boolean quick;

    @Option(names = "--no-rerank", description = "Skip heuristic re-ranking", defaultValue = "false")
    boolean noRerank;

    @Option(names = "--validate", description = "Score results for quality and print the aggregate report", defaultValue = "false")
    boolean validate;

    @Option(names = "--strict", description = "Strict quality filtering (with --validate)", defaultValue = "false")
    boolean strict;

    @Option(names = "--full", description = "Scan every chunk in sync mode, not only when the index is behind", defaultValue = "false")
    boolean fullSync;

    @Option(names = "--discover", description = "Also list embedding models installed on the Ollama server", defaultValue = "false")
    boolean discover;

    enum Mode {
        ingest,
        search,
        sync,
        providers,
        health
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = ConfigLoader.load(configPath);
        log.info("Starting hydro-kb in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (HydroKb kb = HydroKb.open(config)) {
            if (provider != null && !provider.isBlank()) {
                try {
                    kb.providers().setActiveProvider(provider);
                } catch (UnknownProviderException e) {
                    log.error("{}", e.getMessage());
                    return 2;
                }
            }
            return switch (mode) {
                case ingest -> runIngest(kb);
                case search -> runSearch(kb);
                case sync -> runSync(kb);
                case providers -> runProviders(kb);
                case health -> runHealth(kb);
            };
        }
    }

    private int runIngest(HydroKb kb) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            log.error("--file must point to a readable file in ingest mode");
            return 2;
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String documentTitle = title == null || title.isBlank() ? file.getFileName().toString() : title;
        DocumentDraft draft = new DocumentDraft(category, subcategory, regions, documentTitle, content,
                DocumentMetadata.empty(language), null);
        try {
            String id = kb.retrieval().addDocument(draft, progress -> log.info("ingest.progress {}/{} {}",
                    progress.current(), progress.total(), progress.message()));
            kb.save();
            System.out.printf("Ingested document %s \"%s\"%n", id, documentTitle);
            return 0;
        } catch (IngestionException e) {
            log.error("Ingestion failed: {}", e.getMessage());
            return 1;
        }
    }

    private int runSearch(HydroKb kb) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        SearchOptions options = searchOptions(kb.retrieval().defaultOptions());
        if (validate) {
            ValidationOptions validation = HydroKb.validationOptions(kb.config().getQuality()).withStrictMode(strict);
            ValidationOutcome outcome = kb.retrieval().searchWithQuality(query, options, validation);
            List<AssessedResult> accepted = outcome.accepted();
            for (int i = 0; i < accepted.size(); i++) {
                printResult(i + 1, accepted.get(i).result());
                System.out.printf("    quality overall=%s issues=%d%n",
                        format(accepted.get(i).metrics().overall()), accepted.get(i).metrics().issues().size());
            }
            QualityReport report = kb.retrieval().qualityReport(outcome);
            System.out.printf("Quality: %s%n", report.summary());
            report.recommendations().forEach(recommendation -> System.out.println("  - " + recommendation));
            return 0;
        }
        List<SearchResult> results = kb.retrieval().search(query, options);
        if (results.isEmpty()) {
            System.out.printf("No results for \"%s\"%n", query);
        }
        for (int i = 0; i < results.size(); i++) {
            printResult(i + 1, results.get(i));
        }
        return 0;
    }

    SearchOptions searchOptions(SearchOptions defaults) {
        SearchOptions options = defaults;
        if (quick) {
            options = options.withAlpha(SearchOptions.QUICK_ALPHA).withRerank(false);
        }
        if (alpha != null) {
            options = options.withAlpha(alpha);
        }
        if (topK != null) {
            options = options.withTopK(topK);
        }
        if (noRerank) {
            options = options.withRerank(false);
        }
        String regionFilter = regions == null || regions.isEmpty() ? null : regions.get(0);
        return options.withFilters(category, regionFilter, language != null ? language : defaults.language());
    }

    private int runSync(HydroKb kb) throws IOException {
        SyncReport report = kb.sync().sync(fullSync ? SyncMode.FULL : SyncMode.INCREMENTAL);
        kb.save();
        System.out.printf("Sync epoch=%d outcome=%s collection=%s scanned=%d reembedded=%d upserted=%d failedBatches=%d skipped=%d%n",
                report.epoch(), report.outcome(), report.collectionState(), report.scanned(), report.reembedded(),
                report.upserted(), report.failedBatches(), report.skippedChunks());
        return switch (report.outcome()) {
            case FAILED -> 1;
            default -> report.failedBatches() > 0 ? 1 : 0;
        };
    }

    private int runProviders(HydroKb kb) {
        if (discover) {
            int added = EmbeddingProviders.discoverOllamaModels(kb.providers(), kb.config().getEmbedding(), kb.httpClient());
            System.out.printf("Discovered %d additional Ollama embedding models%n", added);
        }
        String active = kb.providers().activeDescriptor().id();
        for (ProviderDescriptor descriptor : kb.providers().listProviders()) {
            System.out.printf("%s %s kind=%s model=%s dimension=%d%n",
                    descriptor.id().equals(active) ? "*" : " ",
                    descriptor.id(),
                    descriptor.kind(),
                    descriptor.model(),
                    descriptor.dimension());
        }
        return 0;
    }

    private int runHealth(HydroKb kb) {
        KnowledgeBaseHealth health = kb.health().health();
        System.out.printf("Health status=%s documents=%d chunks=%d embeddingCoverage=%s%% indexed=%s%% avgChunks=%s indexRows=%d%n",
                health.status(), health.totalDocuments(), health.totalChunks(), health.embeddingCoverage(),
                health.indexedPercentage(), health.averageChunksPerDocument(), health.vectorIndexRows());
        health.issues().forEach(issue -> System.out.println("  ! " + issue));
        IndexingValidationReport validation = kb.health().validateIndexing();
        for (DocumentIndexReport document : validation.documents()) {
            System.out.printf("  %s %s chunks=%d embedded=%d corrupted=%d stale=%d title=\"%s\"%n",
                    document.status(), document.documentId(), document.totalChunks(), document.chunksWithEmbeddings(),
                    document.corruptedChunks(), document.staleChunks(), document.title());
        }
        return 0;
    }

    private static void printResult(int rank, SearchResult result) {
        System.out.printf("#%d score=%s method=%s title=\"%s\" chunk=%s%s%n",
                rank,
                format(result.score()),
                result.method(),
                result.source().title(),
                result.id(),
                result.degraded() ? " degraded=" + result.degradations() : "");
        result.highlights().forEach(highlight -> System.out.println("  > " + highlight));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
