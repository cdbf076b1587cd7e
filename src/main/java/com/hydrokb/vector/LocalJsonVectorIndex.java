package com.hydrokb.vector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydrokb.search.SemanticScorer;

/**
 * In-process vector index persisted as one JSON file. Small collections are searched
 * exhaustively; large ones first look up sign-signature buckets and widen to a full scan when the
 * lookup finds too few candidates.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private static final int EXHAUSTIVE_LIMIT = 150;

    private final Map<String, StoredCollection> collections = new LinkedHashMap<>();
    private final Map<String, Map<Integer, List<String>>> annBuckets = new HashMap<>();
    private final Path path;

    public LocalJsonVectorIndex() {
        this(null);
    }

    private LocalJsonVectorIndex(Path path) {
        this.path = path;
    }

    @Override
    public synchronized Optional<CollectionDescription> describe(String collection) {
        StoredCollection stored = collections.get(collection);
        return stored == null ? Optional.empty() : Optional.of(new CollectionDescription(collection, stored.dimension()));
    }

    @Override
    public synchronized void createCollection(String collection, int dimension) {
        if (dimension <= 0) {
            throw new VectorIndexException("Collection dimension must be positive: " + dimension);
        }
        if (collections.containsKey(collection)) {
            throw new VectorIndexException("Collection already exists: " + collection);
        }
        collections.put(collection, new StoredCollection(dimension, new LinkedHashMap<>()));
        annBuckets.put(collection, new HashMap<>());
        persist();
    }

    @Override
    public synchronized void dropCollection(String collection) {
        collections.remove(collection);
        annBuckets.remove(collection);
        persist();
    }

    @Override
    public synchronized void insert(String collection, List<VectorRecord> records) {
        StoredCollection stored = require(collection);
        for (VectorRecord record : records) {
            if (record.dimension() != stored.dimension()) {
                throw new VectorIndexException("Vector of dimension " + record.dimension()
                        + " does not fit collection " + collection + " of dimension " + stored.dimension());
            }
        }
        for (VectorRecord record : records) {
            stored.records().put(record.id(), record);
        }
        rebuildAnnBuckets(collection);
        persist();
    }

    @Override
    public synchronized List<VectorHit> search(String collection, float[] vector, int topK, FilterExpression filter) {
        StoredCollection stored = require(collection);
        if (vector.length != stored.dimension() || topK <= 0) {
            return List.of();
        }
        FilterExpression effective = filter == null ? FilterExpression.none() : filter;
        return candidateIds(collection, stored, vector, topK).stream()
                .map(stored.records()::get)
                .filter(record -> record != null && effective.matches(record))
                .map(record -> new VectorHit(record.id(), SemanticScorer.cosineSimilarity(vector, record.vector()), record))
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed().thenComparing(VectorHit::id))
                .limit(topK)
                .toList();
    }

    @Override
    public synchronized void delete(String collection, List<String> ids) {
        StoredCollection stored = require(collection);
        boolean removed = false;
        for (String id : ids) {
            removed |= stored.records().remove(id) != null;
        }
        if (removed) {
            rebuildAnnBuckets(collection);
            persist();
        }
    }

    @Override
    public synchronized CollectionStatistics getStatistics(String collection) {
        return new CollectionStatistics(collection, require(collection).records().size());
    }

    public synchronized void save(Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        mapper().writerWithDefaultPrettyPrinter().writeValue(target.toFile(), collections);
    }

    /**
     * Opens the index stored at {@code path}; every later mutation is written back to it.
     */
    public static LocalJsonVectorIndex load(Path path) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(path);
        if (!Files.exists(path)) {
            return index;
        }
        Map<String, StoredCollection> loaded = mapper().readValue(path.toFile(),
                new TypeReference<LinkedHashMap<String, StoredCollection>>() {
                });
        for (Map.Entry<String, StoredCollection> entry : loaded.entrySet()) {
            StoredCollection collection = entry.getValue();
            index.collections.put(entry.getKey(),
                    new StoredCollection(collection.dimension(), new LinkedHashMap<>(collection.records())));
            index.rebuildAnnBuckets(entry.getKey());
        }
        return index;
    }

    private StoredCollection require(String collection) {
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            throw new VectorIndexException("Unknown collection: " + collection);
        }
        return stored;
    }

    private void persist() {
        if (path == null) {
            return;
        }
        try {
            save(path);
        } catch (IOException e) {
            throw new VectorIndexException("Could not write vector index " + path, e);
        }
    }

    private Set<String> candidateIds(String collection, StoredCollection stored, float[] vector, int topK) {
        if (stored.records().size() <= Math.max(EXHAUSTIVE_LIMIT, topK * 20)) {
            return new HashSet<>(stored.records().keySet());
        }
        Map<Integer, List<String>> buckets = annBuckets.getOrDefault(collection, Map.of());
        Set<String> candidates = new HashSet<>();
        int querySignature = signature(vector);
        for (int bucketKey : List.of(querySignature, querySignature ^ 0x00FF, querySignature ^ 0xFF00, querySignature ^ 0x0F0F)) {
            candidates.addAll(buckets.getOrDefault(bucketKey, List.of()));
        }
        if (candidates.size() < topK * 5) {
            candidates.addAll(stored.records().keySet());
        }
        return candidates;
    }

    private void rebuildAnnBuckets(String collection) {
        Map<Integer, List<String>> buckets = new HashMap<>();
        for (VectorRecord record : collections.get(collection).records().values()) {
            buckets.computeIfAbsent(signature(record.vector()), unused -> new ArrayList<>()).add(record.id());
        }
        annBuckets.put(collection, buckets);
    }

    private static int signature(float[] vector) {
        int signature = 0;
        for (int i = 0; i < Math.min(16, vector.length); i++) {
            if (vector[i] >= 0f) {
                signature |= (1 << i);
            }
        }
        return signature;
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public record StoredCollection(int dimension, Map<String, VectorRecord> records) {
        public StoredCollection {
            records = records == null ? new LinkedHashMap<>() : records;
        }
    }
}
