package com.hydrokb;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingResult;
import com.hydrokb.ingest.Chunk;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentDraft;
import com.hydrokb.ingest.DocumentFilter;
import com.hydrokb.ingest.DocumentPatch;
import com.hydrokb.ingest.IngestionReport;
import com.hydrokb.ingest.IngestionService;
import com.hydrokb.ingest.KnowledgeStore;
import com.hydrokb.ingest.ProgressListener;
import com.hydrokb.quality.QualityReport;
import com.hydrokb.quality.QualityValidator;
import com.hydrokb.quality.ValidationOptions;
import com.hydrokb.quality.ValidationOutcome;
import com.hydrokb.search.Candidate;
import com.hydrokb.search.Degradation;
import com.hydrokb.search.HighlightExtractor;
import com.hydrokb.search.HybridRanker;
import com.hydrokb.search.LexicalScorer;
import com.hydrokb.search.ScoredChunk;
import com.hydrokb.search.SearchOptions;
import com.hydrokb.search.SearchResult;
import com.hydrokb.search.SemanticScorer;
import com.hydrokb.vector.FilterExpression;
import com.hydrokb.vector.VectorHit;
import com.hydrokb.vector.VectorIndex;
import com.hydrokb.vector.VectorIndexException;

/**
 * Entry point for queries and document writes.
 * <p>
 * A query never fails because of a collaborator: an unreachable vector index leaves a
 * lexical-only ranking, a failing lexical pass leaves a semantic-only one, a failing re-rank
 * keeps the fused order. Each such fallback is recorded on the returned results.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    static final String HYDRAULICS_CATEGORY = "hydraulics";
    static final String REGULATIONS_CATEGORY = "regulations";
    private static final int MIN_INDEX_CANDIDATES = 40;

    private final KnowledgeStore store;
    private final EmbeddingProviderRegistry providers;
    private final VectorIndex index;
    private final String collection;
    private final IngestionService ingestion;
    private final LexicalScorer lexicalScorer = new LexicalScorer();
    private final SemanticScorer semanticScorer = new SemanticScorer();
    private final HybridRanker ranker;
    private final QualityValidator validator;
    private final SearchOptions defaults;
    private final ValidationOptions automaticValidation;

    /**
     * @param automaticValidation quality filter applied to every {@link #search} result set, or
     *            null to return ranked results unfiltered
     */
    public RetrievalService(KnowledgeStore store,
            EmbeddingProviderRegistry providers,
            VectorIndex index,
            String collection,
            IngestionService ingestion,
            HybridRanker ranker,
            QualityValidator validator,
            SearchOptions defaults,
            ValidationOptions automaticValidation) {
        this.store = store;
        this.providers = providers;
        this.index = index;
        this.collection = collection;
        this.ingestion = ingestion;
        this.ranker = ranker;
        this.validator = validator;
        this.defaults = defaults;
        this.automaticValidation = automaticValidation;
    }

    public SearchOptions defaultOptions() {
        return defaults;
    }

    public List<SearchResult> search(String query) {
        return search(query, defaults);
    }

    public List<SearchResult> search(String query, SearchOptions options) {
        List<SearchResult> ranked = rank(query, options);
        if (automaticValidation == null || ranked.isEmpty()) {
            return ranked;
        }
        return validator.validate(query, ranked, automaticValidation).results();
    }

    /**
     * Semantic-leaning search without re-ranking.
     */
    public List<SearchResult> quickSearch(String query, String category, int topK) {
        return search(query, defaults.withAlpha(SearchOptions.QUICK_ALPHA)
                .withRerank(false)
                .withTopK(topK)
                .withFilters(category, null, defaults.language()));
    }

    /**
     * Balanced search with re-ranking.
     */
    public List<SearchResult> advancedSearch(String query, String category, String region, int topK) {
        return search(query, defaults.withAlpha(SearchOptions.DEFAULT_ALPHA)
                .withRerank(true)
                .withTopK(topK)
                .withFilters(category, region, defaults.language()));
    }

    /**
     * Ranks, then scores every result for quality, whatever the automatic validation setting.
     */
    public ValidationOutcome searchWithQuality(String query, SearchOptions options, ValidationOptions validation) {
        return validator.validate(query, rank(query, options), validation);
    }

    public QualityReport qualityReport(ValidationOutcome outcome) {
        return QualityReport.of(outcome.metrics());
    }

    public String addDocument(DocumentDraft draft, ProgressListener onProgress) {
        return ingestion.addDocument(draft, onProgress).documentId();
    }

    public IngestionReport updateDocument(String documentId, DocumentPatch patch) {
        return ingestion.updateDocument(documentId, patch, ProgressListener.NONE);
    }

    public boolean deleteDocument(String documentId) {
        return ingestion.deleteDocument(documentId);
    }

    /**
     * Formulas recorded on active documents. With a category, only hydraulics documents of that
     * subcategory are read.
     */
    public List<FormulaReference> getFormulas(String category) {
        boolean scoped = category != null && !category.isBlank();
        List<FormulaReference> formulas = new ArrayList<>();
        DocumentFilter filter = scoped ? new DocumentFilter(HYDRAULICS_CATEGORY, null, null) : DocumentFilter.any();
        for (Document document : store.findDocuments(filter)) {
            if (scoped && !category.equals(document.subcategory())) {
                continue;
            }
            for (String formula : document.metadata().formulas()) {
                formulas.add(new FormulaReference(document.id(), document.title(), document.category(),
                        document.subcategory(), formula));
            }
        }
        return formulas;
    }

    /**
     * Active regulation documents tagged with a region containing {@code region}.
     */
    public List<Document> getRegulations(String region) {
        return store.findDocuments(
                new DocumentFilter(REGULATIONS_CATEGORY, region, null, DocumentFilter.RegionMatch.CONTAINS));
    }

    List<SearchResult> rank(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);
        List<Candidate> candidates = candidates(options);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<ScoredChunk> lexical = lexicalStage(query, candidates, options, degradations);
        List<ScoredChunk> semantic = semanticStage(query, candidates, options, degradations);
        List<ScoredChunk> fused = ranker.fuse(lexical, semantic, options.alpha());

        List<ScoredChunk> ranked = fused;
        if (options.rerank() && fused.size() > options.topK()) {
            try {
                ranked = ranker.rerank(query, fused, options.topK());
            } catch (RuntimeException e) {
                degradations.add(Degradation.RERANK_FAILED);
                log.warn("search.rerank.failed query=\"{}\" cause={}", query, e.toString());
                ranked = fused;
            }
        }
        ranked = ranked.stream().filter(result -> passesScoreFloor(result, options)).toList();
        if (options.groupByDocument()) {
            ranked = ranker.collapseByDocument(ranked);
        }
        if (ranked.size() > options.topK()) {
            ranked = ranked.subList(0, options.topK());
        }

        List<SearchResult> results = new ArrayList<>(ranked.size());
        for (ScoredChunk scored : ranked) {
            results.add(SearchResult.of(scored, HighlightExtractor.extract(query, scored.content()), degradations));
        }
        log.info("search.completed query=\"{}\" candidates={} lexical={} semantic={} results={} degraded={}",
                query, candidates.size(), lexical.size(), semantic.size(), results.size(), degradations);
        return results;
    }

    private List<Candidate> candidates(SearchOptions options) {
        DocumentFilter filter = new DocumentFilter(options.category(), options.region(), options.language());
        List<Candidate> candidates = new ArrayList<>();
        for (Document document : store.findDocuments(filter)) {
            for (Chunk chunk : store.chunksOf(document.id())) {
                candidates.add(new Candidate(chunk, document));
            }
        }
        return candidates;
    }

    private List<ScoredChunk> lexicalStage(String query, List<Candidate> candidates, SearchOptions options,
            Set<Degradation> degradations) {
        try {
            return lexicalScorer.score(query, candidates).stream()
                    .limit(options.topK() * 2L)
                    .toList();
        } catch (RuntimeException e) {
            degradations.add(Degradation.LEXICAL_FAILED);
            log.warn("search.lexical.failed query=\"{}\" cause={}", query, e.toString());
            return List.of();
        }
    }

    private List<ScoredChunk> semanticStage(String query, List<Candidate> candidates, SearchOptions options,
            Set<Degradation> degradations) {
        EmbeddingResult queryEmbedding = providers.generateEmbedding(query);
        if (queryEmbedding.degraded()) {
            degradations.add(Degradation.QUERY_EMBEDDING_FALLBACK);
        }
        List<VectorHit> hits;
        try {
            FilterExpression filter = FilterExpression.of(options.category(), options.region(), options.language());
            int limit = Math.max(options.topK() * 4, MIN_INDEX_CANDIDATES);
            hits = index.search(collection, queryEmbedding.vector(), limit, filter);
        } catch (VectorIndexException e) {
            degradations.add(Degradation.INDEX_UNREACHABLE);
            log.warn("search.index.unreachable collection={} cause={}", collection, e.getMessage());
            return List.of();
        }

        Map<Long, Candidate> byChunkId = new LinkedHashMap<>();
        candidates.forEach(candidate -> byChunkId.put(candidate.chunk().id(), candidate));
        List<Candidate> matched = new ArrayList<>();
        for (VectorHit hit : hits) {
            Candidate candidate = byChunkId.remove(hit.chunkId());
            if (candidate != null) {
                matched.add(candidate);
            }
        }
        int wanted = options.topK() * 2;
        if (matched.size() < wanted && !byChunkId.isEmpty()) {
            // the index returned fewer usable hits than needed; score the remaining stored vectors
            log.debug("search.semantic.widened hits={} matched={} remaining={}", hits.size(), matched.size(), byChunkId.size());
            matched.addAll(byChunkId.values());
        }
        List<ScoredChunk> scored = options.groupByDocument()
                ? semanticScorer.scoreDocuments(queryEmbedding.vector(), matched)
                : semanticScorer.scoreChunks(queryEmbedding.vector(), matched);
        return scored.stream()
                .limit(wanted)
                .toList();
    }

    /**
     * Single-method results must clear their method's floor on the fused score; hybrid results
     * always pass.
     */
    static boolean passesScoreFloor(ScoredChunk result, SearchOptions options) {
        return switch (result.method()) {
            case SEMANTIC -> result.score() >= options.minSemanticScore();
            case LEXICAL -> result.score() >= options.minBm25Score();
            case HYBRID -> true;
        };
    }
}
