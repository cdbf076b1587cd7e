package com.hydrokb.vector;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * External vector index. Every method may throw {@link VectorIndexException} when the backend
 * cannot be reached or rejects the request.
 */
public interface VectorIndex {

    Optional<CollectionDescription> describe(String collection);

    void createCollection(String collection, int dimension);

    void dropCollection(String collection);

    /**
     * Writes the records, replacing any with the same id. Every vector must have the
     * collection's dimension.
     */
    void insert(String collection, List<VectorRecord> records);

    List<VectorHit> search(String collection, float[] vector, int topK, FilterExpression filter);

    void delete(String collection, List<String> ids);

    CollectionStatistics getStatistics(String collection);

    /**
     * Makes sure the collection exists with the given dimension. A collection created for a
     * different dimension is dropped and recreated empty.
     */
    default CollectionState ensureCollection(String collection, int dimension) {
        Optional<CollectionDescription> current = describe(collection);
        if (current.isEmpty()) {
            createCollection(collection, dimension);
            return CollectionState.CREATED;
        }
        if (current.get().dimension() == dimension) {
            return CollectionState.EXISTING;
        }
        Logger log = LoggerFactory.getLogger(VectorIndex.class);
        log.warn("index.collection.dimension-mismatch collection={} current={} expected={} action=recreate",
                collection, current.get().dimension(), dimension);
        dropCollection(collection);
        createCollection(collection, dimension);
        return CollectionState.RECREATED;
    }
}
