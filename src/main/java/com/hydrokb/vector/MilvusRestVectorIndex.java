package com.hydrokb.vector;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Milvus through its RESTful v2 API. Records live in a collection with a VarChar primary key, a
 * float vector, the chunk content, a JSON metadata field and an insertion timestamp; search uses
 * cosine distance.
 */
public class MilvusRestVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(MilvusRestVectorIndex.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_CONTENT_LENGTH = 65535;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String token;

    public MilvusRestVectorIndex(OkHttpClient httpClient, String baseUrl, String token) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
    }

    @Override
    public Optional<CollectionDescription> describe(String collection) {
        JsonNode has = call("collections/has", Map.of("collectionName", collection));
        if (!has.path("has").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode description = call("collections/describe", Map.of("collectionName", collection));
        for (JsonNode field : description.path("fields")) {
            if (!"vector".equals(field.path("name").asText())) {
                continue;
            }
            for (JsonNode param : field.path("params")) {
                if ("dim".equals(param.path("key").asText())) {
                    return Optional.of(new CollectionDescription(collection, param.path("value").asInt(0)));
                }
            }
        }
        log.warn("index.describe.no-dimension collection={}", collection);
        return Optional.of(new CollectionDescription(collection, 0));
    }

    @Override
    public void createCollection(String collection, int dimension) {
        List<Map<String, Object>> fields = List.of(
                field("id", "VarChar", true, Map.of("max_length", 64)),
                field("vector", "FloatVector", false, Map.of("dim", dimension)),
                field("content", "VarChar", false, Map.of("max_length", MAX_CONTENT_LENGTH)),
                field("metadata", "JSON", false, Map.of()),
                field("timestamp", "Int64", false, Map.of()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collectionName", collection);
        body.put("schema", Map.of("autoId", false, "enableDynamicField", false, "fields", fields));
        body.put("indexParams", List.of(Map.of(
                "fieldName", "vector",
                "indexName", "vector",
                "indexType", "FLAT",
                "metricType", "COSINE")));
        call("collections/create", body);
        log.info("index.collection.created collection={} dimension={}", collection, dimension);
    }

    @Override
    public void dropCollection(String collection) {
        call("collections/drop", Map.of("collectionName", collection));
        log.info("index.collection.dropped collection={}", collection);
    }

    @Override
    public void insert(String collection, List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", record.id());
            row.put("vector", record.vector());
            row.put("content", truncate(record.content()));
            row.put("metadata", metadata(record));
            row.put("timestamp", record.timestamp());
            rows.add(row);
        }
        call("entities/upsert", Map.of("collectionName", collection, "data", rows));
    }

    @Override
    public List<VectorHit> search(String collection, float[] vector, int topK, FilterExpression filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collectionName", collection);
        body.put("data", List.of(vector));
        body.put("annsField", "vector");
        body.put("limit", topK);
        body.put("outputFields", List.of("content", "metadata", "timestamp"));
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter.toMilvus());
        }
        JsonNode data = call("entities/search", body);
        List<VectorHit> hits = new ArrayList<>();
        for (JsonNode hit : data) {
            String id = hit.path("id").asText();
            JsonNode metadata = hit.path("metadata");
            List<String> regions = new ArrayList<>();
            metadata.path("regions").forEach(region -> regions.add(region.asText()));
            VectorRecord record = new VectorRecord(
                    id,
                    null,
                    hit.path("content").asText(""),
                    metadata.path("documentId").asText(null),
                    metadata.path("title").asText(null),
                    metadata.path("category").asText(null),
                    regions,
                    metadata.path("language").asText(null),
                    hit.path("timestamp").asLong(0L));
            hits.add(new VectorHit(id, hit.path("distance").asDouble(0.0), record));
        }
        return hits;
    }

    @Override
    public void delete(String collection, List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        String filter = ids.stream().map(FilterExpression::quote).collect(Collectors.joining(",", "id in [", "]"));
        call("entities/delete", Map.of("collectionName", collection, "filter", filter));
    }

    @Override
    public CollectionStatistics getStatistics(String collection) {
        JsonNode data = call("collections/get_stats", Map.of("collectionName", collection));
        return new CollectionStatistics(collection, data.path("rowCount").asLong(0L));
    }

    private JsonNode call(String operation, Object body) {
        Request.Builder request = new Request.Builder().url(baseUrl + "/v2/vectordb/" + operation);
        if (token != null && !token.isBlank()) {
            request.header("Authorization", "Bearer " + token);
        }
        try {
            request.post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            try (Response response = httpClient.newCall(request.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new VectorIndexException("Milvus " + operation + " failed with HTTP " + response.code());
                }
                JsonNode root = mapper.readTree(response.body().string());
                int code = root.path("code").asInt(0);
                if (code != 0) {
                    throw new VectorIndexException("Milvus " + operation + " failed with code " + code + ": "
                            + root.path("message").asText(""));
                }
                return root.path("data");
            }
        } catch (IOException e) {
            throw new VectorIndexException("Milvus unreachable at " + baseUrl + " during " + operation, e);
        }
    }

    private static Map<String, Object> field(String name, String type, boolean primary, Map<String, Object> params) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("fieldName", name);
        field.put("dataType", type);
        if (primary) {
            field.put("isPrimary", true);
        }
        if (!params.isEmpty()) {
            field.put("elementTypeParams", params);
        }
        return field;
    }

    private static Map<String, Object> metadata(VectorRecord record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("documentId", record.documentId());
        metadata.put("title", record.documentTitle());
        metadata.put("category", record.category());
        metadata.put("regions", record.regions());
        metadata.put("language", record.language());
        return metadata;
    }

    private static String truncate(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > MAX_CONTENT_LENGTH ? content.substring(0, MAX_CONTENT_LENGTH) : content;
    }
}
