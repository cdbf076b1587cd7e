package com.hydrokb.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * In-process knowledge store with a JSON snapshot on disk.
 */
public class LocalJsonKnowledgeStore implements KnowledgeStore {
    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final NavigableMap<Long, Chunk> chunks = new TreeMap<>();
    private long lastChunkId;

    @Override
    public synchronized StoredDocument insert(Document document, List<Chunk> newChunks) {
        String id = document.id() == null || document.id().isBlank() ? UUID.randomUUID().toString() : document.id();
        if (documents.containsKey(id)) {
            throw new IllegalArgumentException("Document already exists: " + id);
        }
        Document stored = document.withId(id);
        documents.put(id, stored);
        return new StoredDocument(stored, storeChunks(id, newChunks));
    }

    @Override
    public synchronized Optional<Document> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public synchronized List<Document> findDocuments(DocumentFilter filter) {
        return documents.values().stream()
                .filter(filter::matches)
                .toList();
    }

    @Override
    public synchronized void updateDocument(Document document) {
        if (!documents.containsKey(document.id())) {
            throw new IllegalArgumentException("Unknown document: " + document.id());
        }
        documents.put(document.id(), document);
    }

    @Override
    public synchronized List<Chunk> replaceChunks(String documentId, List<Chunk> newChunks) {
        if (!documents.containsKey(documentId)) {
            throw new IllegalArgumentException("Unknown document: " + documentId);
        }
        chunks.values().removeIf(chunk -> chunk.documentId().equals(documentId));
        return storeChunks(documentId, newChunks);
    }

    @Override
    public synchronized List<Chunk> chunksOf(String documentId) {
        return chunks.values().stream()
                .filter(chunk -> chunk.documentId().equals(documentId))
                .sorted(Comparator.comparingInt(Chunk::chunkIndex))
                .toList();
    }

    @Override
    public synchronized List<Chunk> findChunks(Collection<Long> chunkIds) {
        return chunkIds.stream()
                .distinct()
                .sorted()
                .map(chunks::get)
                .filter(chunk -> chunk != null)
                .toList();
    }

    @Override
    public synchronized List<Chunk> deleteDocument(String documentId) {
        if (documents.remove(documentId) == null) {
            return List.of();
        }
        List<Chunk> removed = chunksOf(documentId);
        removed.forEach(chunk -> chunks.remove(chunk.id()));
        return removed;
    }

    @Override
    public synchronized long countChunks() {
        return chunks.size();
    }

    @Override
    public synchronized long countDocuments() {
        return documents.size();
    }

    @Override
    public synchronized List<Chunk> listChunksAfter(long afterId, int pageSize) {
        return chunks.tailMap(afterId, false).values().stream()
                .limit(pageSize)
                .toList();
    }

    @Override
    public synchronized void updateEmbedding(long chunkId, StoredEmbedding embedding) {
        Chunk chunk = chunks.get(chunkId);
        if (chunk == null) {
            throw new IllegalArgumentException("Unknown chunk: " + chunkId);
        }
        chunks.put(chunkId, chunk.withEmbedding(embedding));
    }

    public synchronized void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Snapshot snapshot = new Snapshot(new ArrayList<>(documents.values()), new ArrayList<>(chunks.values()), lastChunkId);
        mapper().writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    }

    public static LocalJsonKnowledgeStore load(Path path) throws IOException {
        LocalJsonKnowledgeStore store = new LocalJsonKnowledgeStore();
        if (!Files.exists(path)) {
            return store;
        }
        Snapshot snapshot = mapper().readValue(path.toFile(), Snapshot.class);
        for (Document document : snapshot.documents()) {
            store.documents.put(document.id(), document);
        }
        long highest = snapshot.lastChunkId();
        for (Chunk chunk : snapshot.chunks()) {
            store.chunks.put(chunk.id(), chunk);
            highest = Math.max(highest, chunk.id());
        }
        store.lastChunkId = highest;
        return store;
    }

    private List<Chunk> storeChunks(String documentId, List<Chunk> newChunks) {
        List<Chunk> stored = new ArrayList<>(newChunks.size());
        for (Chunk chunk : newChunks) {
            Chunk assigned = chunk.withId(++lastChunkId, documentId);
            chunks.put(assigned.id(), assigned);
            stored.add(assigned);
        }
        return stored;
    }

    static ObjectMapper mapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public record Snapshot(List<Document> documents, List<Chunk> chunks, long lastChunkId) {
        public Snapshot {
            documents = documents == null ? List.of() : documents;
            chunks = chunks == null ? List.of() : chunks;
        }
    }
}
