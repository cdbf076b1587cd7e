package com.hydrokb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.hydrokb.embedding.EmbeddingProvider;
import com.hydrokb.embedding.EmbeddingProviderRegistry;
import com.hydrokb.embedding.EmbeddingResult;
import com.hydrokb.embedding.ProviderDescriptor;
import com.hydrokb.embedding.ProviderKind;
import com.hydrokb.ingest.Chunker;
import com.hydrokb.ingest.Document;
import com.hydrokb.ingest.DocumentDraft;
import com.hydrokb.ingest.DocumentMetadata;
import com.hydrokb.ingest.DocumentPatch;
import com.hydrokb.ingest.IngestionProgress;
import com.hydrokb.ingest.IngestionService;
import com.hydrokb.ingest.LocalJsonKnowledgeStore;
import com.hydrokb.quality.QualityValidator;
import com.hydrokb.quality.ValidationOptions;
import com.hydrokb.quality.ValidationOutcome;
import com.hydrokb.search.Degradation;
import com.hydrokb.search.HybridRanker;
import com.hydrokb.search.SearchMethod;
import com.hydrokb.search.SearchOptions;
import com.hydrokb.search.SearchResult;
import com.hydrokb.vector.FilterExpression;
import com.hydrokb.vector.LocalJsonVectorIndex;
import com.hydrokb.vector.VectorHit;
import com.hydrokb.vector.VectorIndexException;
import com.hydrokb.vector.VectorIndexSync;

class RetrievalServiceTest {
    private static final String COLLECTION = "kb";
    private static final String QUERY = "pérdida de carga en tubería PVC";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private final LocalJsonKnowledgeStore store = new LocalJsonKnowledgeStore();
    private final FlakyIndex index = new FlakyIndex();
    private final EmbeddingProviderRegistry registry = EmbeddingProviderRegistry.of(new KeywordEmbeddingProvider());
    private IngestionService ingestion;
    private RetrievalService retrieval;
    private String pipesId;

    @BeforeEach
    void setUp() {
        VectorIndexSync sync = new VectorIndexSync(store, index, registry, COLLECTION, VectorIndexSync.Settings.defaults());
        ingestion = new IngestionService(store, registry, sync, new Chunker(1000, 200), 5000, CLOCK);
        retrieval = service(null);

        pipesId = retrieval.addDocument(draft("hydraulics", "pipes", List.of("spain"), "Pérdidas en conducciones",
                "La pérdida de carga en una tubería de PVC se calcula con la ecuación de Darcy-Weisbach. "
                        + "El factor de fricción depende de la rugosidad relativa.",
                List.of("hf = f (L/D) v^2/2g")), null);
        retrieval.addDocument(draft("hydraulics", "pumps", List.of("chile"), "Selección de bombas",
                "La bomba centrífuga debe vencer la presión de la red. La curva de la bomba fija el caudal.",
                List.of("P = rho g Q H / eta", "NPSH = Hatm - Hv - Hs")), null);
        retrieval.addDocument(draft("regulations", "water-supply", List.of("spain-madrid"), "Norma de abastecimiento",
                "La norma exige tubería homologada y presión mínima de servicio en la red.", List.of()), null);
        retrieval.addDocument(draft("regulations", "water-supply", List.of("chile"), "Norma chilena",
                "La norma regula la presión máxima en redes de distribución.", List.of()), null);
    }

    @AfterEach
    void tearDown() {
        ingestion.close();
    }

    @Test
    void shouldRankLexicalAndSemanticMatchesTogether() {
        List<SearchResult> results = retrieval.search(QUERY);

        assertFalse(results.isEmpty());
        SearchResult best = results.get(0);
        assertEquals(pipesId, best.source().documentId());
        assertEquals(SearchMethod.HYBRID, best.method());
        assertEquals(pipesId, best.metadata().get("documentId"));
        assertFalse(best.highlights().isEmpty());
        assertFalse(best.degraded());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
    }

    @Test
    void unreachableIndexShouldLeaveLexicalOnlyResults() {
        index.down = true;

        List<SearchResult> results = retrieval.search(QUERY);

        assertFalse(results.isEmpty());
        assertEquals(pipesId, results.get(0).source().documentId());
        results.forEach(result -> {
            assertEquals(SearchMethod.LEXICAL, result.method());
            assertTrue(result.degradations().contains(Degradation.INDEX_UNREACHABLE));
        });
    }

    @Test
    void filtersShouldRestrictCandidates() {
        List<SearchResult> regulations = retrieval.search("presión tubería",
                SearchOptions.defaults().withFilters("regulations", "SPAIN-MADRID", "es"));

        assertEquals(1, regulations.size());
        assertEquals("Norma de abastecimiento", regulations.get(0).source().title());
        assertTrue(retrieval.search("presión tubería", SearchOptions.defaults().withFilters(null, "madrid", "es")).isEmpty());
        assertTrue(retrieval.search(QUERY, SearchOptions.defaults().withFilters(null, null, "en")).isEmpty());
    }

    @Test
    void regionFilterShouldKeepSemanticMatchesBehindCrowdedRegions() {
        List<SearchResult> results = searchCrowdedRegions(new LocalJsonVectorIndex());

        assertEquals(1, results.size());
        assertEquals("Bombeo en Madrid", results.get(0).source().title());
        assertEquals(SearchMethod.SEMANTIC, results.get(0).method());
    }

    @Test
    void semanticStageShouldScoreStoredVectorsWhenIndexHitsFallOutsideCandidates() {
        List<SearchResult> results = searchCrowdedRegions(new RegionBlindIndex());

        assertEquals(1, results.size());
        assertEquals("Bombeo en Madrid", results.get(0).source().title());
        assertEquals(SearchMethod.SEMANTIC, results.get(0).method());
        assertFalse(results.get(0).degraded());
    }

    @Test
    void scoreFloorsShouldApplyToFusedScoresByMethod() {
        // "bombas" only matches the pumps chunk semantically: fused score 0.6
        assertEquals(1, retrieval.search("bombas").size());
        assertEquals(SearchMethod.SEMANTIC, retrieval.search("bombas").get(0).method());
        assertTrue(retrieval.search("bombas", SearchOptions.defaults().withMinScores(0.7, 0.1)).isEmpty());

        // "curva" only matches lexically: fused score 0.4
        assertEquals(SearchMethod.LEXICAL, retrieval.search("curva").get(0).method());
        assertEquals(1, retrieval.search("curva", SearchOptions.defaults().withMinScores(0.3, 0.35)).size());
        assertTrue(retrieval.search("curva", SearchOptions.defaults().withMinScores(0.3, 0.5)).isEmpty());

        // hybrid results pass whatever the floors
        List<SearchResult> hybrid = retrieval.search(QUERY, SearchOptions.defaults().withMinScores(1.0, 1.0));
        assertFalse(hybrid.isEmpty());
        hybrid.forEach(result -> assertEquals(SearchMethod.HYBRID, result.method()));
    }

    @Test
    void presetsShouldHonourTopKAndCategory() {
        List<SearchResult> quick = retrieval.quickSearch("presión bomba red", "hydraulics", 1);
        List<SearchResult> advanced = retrieval.advancedSearch("presión red", null, "chile", 5);

        assertEquals(1, quick.size());
        assertEquals("hydraulics", quick.get(0).source().category());
        advanced.forEach(result -> assertTrue(result.source().regions().contains("chile")));
        assertFalse(advanced.isEmpty());
    }

    @Test
    void groupingShouldReturnOnePassagePerDocument() {
        List<SearchResult> grouped = retrieval.search("presión red", SearchOptions.defaults().withGroupByDocument(true));

        assertEquals(grouped.size(), grouped.stream().map(result -> result.source().documentId()).distinct().count());
    }

    @Test
    void blankQueryShouldReturnNothing() {
        assertTrue(retrieval.search("   ").isEmpty());
    }

    @Test
    void formulasShouldBeScopedToHydraulicsSubcategory() {
        List<FormulaReference> pipes = retrieval.getFormulas("pipes");
        List<FormulaReference> all = retrieval.getFormulas(null);

        assertEquals(List.of("hf = f (L/D) v^2/2g"), pipes.stream().map(FormulaReference::formula).toList());
        assertEquals(3, all.size());
        assertTrue(retrieval.getFormulas("regulations").isEmpty());
    }

    @Test
    void regulationsShouldMatchRegionTags() {
        List<Document> spain = retrieval.getRegulations("spain");
        List<Document> chile = retrieval.getRegulations("CHILE");

        assertEquals(List.of("Norma de abastecimiento"), spain.stream().map(Document::title).toList());
        assertEquals(List.of("Norma chilena"), chile.stream().map(Document::title).toList());
        assertEquals(2, retrieval.getRegulations(null).size());
    }

    @Test
    void qualitySearchShouldEvaluateEveryRankedResult() {
        ValidationOutcome outcome = retrieval.searchWithQuality(QUERY, SearchOptions.defaults(),
                ValidationOptions.defaults().withMinQualityScore(0.99));

        assertFalse(outcome.evaluated().isEmpty());
        assertTrue(outcome.accepted().isEmpty());
        assertTrue(retrieval.qualityReport(outcome).summary().startsWith("Average quality:"));
    }

    @Test
    void automaticValidationShouldFilterSearchResults() {
        RetrievalService strict = service(new ValidationOptions(true, 0.99, 10, List.of()));

        assertTrue(strict.search(QUERY).isEmpty());
    }

    @Test
    void updatesAndDeletesShouldShowUpInSearch() {
        List<IngestionProgress> progress = new ArrayList<>();
        String id = retrieval.addDocument(draft("hydraulics", "valves", List.of("spain"), "Válvulas",
                "La válvula de compuerta regula el caudal.", List.of()), progress::add);
        assertEquals(1, progress.size());

        retrieval.updateDocument(id, DocumentPatch.content("La válvula de mariposa controla el golpe de ariete."));
        assertEquals(id, retrieval.search("golpe ariete").get(0).source().documentId());

        assertTrue(retrieval.deleteDocument(id));
        assertTrue(retrieval.search("golpe ariete").stream().noneMatch(result -> result.source().documentId().equals(id)));
    }

    private static List<SearchResult> searchCrowdedRegions(LocalJsonVectorIndex crowdedIndex) {
        LocalJsonKnowledgeStore crowdedStore = new LocalJsonKnowledgeStore();
        EmbeddingProviderRegistry providers = EmbeddingProviderRegistry.of(new KeywordEmbeddingProvider());
        VectorIndexSync sync = new VectorIndexSync(crowdedStore, crowdedIndex, providers, COLLECTION,
                VectorIndexSync.Settings.defaults());
        try (IngestionService crowdedIngestion = new IngestionService(crowdedStore, providers, sync,
                new Chunker(1000, 200), 5000, CLOCK)) {
            for (int i = 0; i < 45; i++) {
                crowdedIngestion.addDocument(draft("hydraulics", "pumps", List.of("chile"), "Bombeo " + i,
                        "La bomba impulsa el agua.", List.of()), null);
            }
            crowdedIngestion.addDocument(draft("hydraulics", "pumps", List.of("spain"), "Bombeo en Madrid",
                    "La bomba eleva agua por la tubería a presión.", List.of()), null);
            RetrievalService crowded = new RetrievalService(crowdedStore, providers, crowdedIndex, COLLECTION,
                    crowdedIngestion, new HybridRanker(), new QualityValidator(CLOCK), SearchOptions.defaults(), null);
            return crowded.search("bombas", SearchOptions.defaults().withFilters(null, "spain", "es"));
        }
    }

    private RetrievalService service(ValidationOptions automaticValidation) {
        return new RetrievalService(store, registry, index, COLLECTION, ingestion, new HybridRanker(),
                new QualityValidator(CLOCK), SearchOptions.defaults(), automaticValidation);
    }

    private static DocumentDraft draft(String category, String subcategory, List<String> regions, String title,
            String content, List<String> formulas) {
        DocumentMetadata metadata = new DocumentMetadata(List.of(), formulas, List.of(), List.of(), List.of(), List.of(), "es");
        return new DocumentDraft(category, subcategory, regions, title, content, metadata, "1");
    }

    /** One axis per domain keyword plus a constant axis, so related text points the same way. */
    private static final class KeywordEmbeddingProvider implements EmbeddingProvider {
        private static final List<String> AXES = List.of("tubería", "pérdida", "bomba", "presión", "norma", "válvula", "ariete");
        private final ProviderDescriptor descriptor =
                new ProviderDescriptor("keywords", "Keywords", "keywords", AXES.size() + 1, ProviderKind.OLLAMA);

        @Override
        public ProviderDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public EmbeddingResult embed(String text) {
            String lower = text.toLowerCase(Locale.ROOT);
            float[] vector = new float[AXES.size() + 1];
            for (int i = 0; i < AXES.size(); i++) {
                vector[i] = lower.contains(AXES.get(i)) ? 1f : 0f;
            }
            vector[AXES.size()] = 0.1f;
            return EmbeddingResult.of(vector, descriptor.id());
        }
    }

    /** Ignores metadata filters, as a backend whose records lack region fields would. */
    private static final class RegionBlindIndex extends LocalJsonVectorIndex {
        @Override
        public synchronized List<VectorHit> search(String collection, float[] vector, int topK, FilterExpression filter) {
            return super.search(collection, vector, topK, FilterExpression.none());
        }
    }

    private static final class FlakyIndex extends LocalJsonVectorIndex {
        volatile boolean down;

        @Override
        public synchronized List<VectorHit> search(String collection, float[] vector, int topK, FilterExpression filter) {
            if (down) {
                throw new VectorIndexException("connection refused");
            }
            return super.search(collection, vector, topK, filter);
        }
    }
}
