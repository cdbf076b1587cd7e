package com.hydrokb.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.hydrokb.FakeHttpInterceptor;

class MilvusRestVectorIndexTest {
    private static final String COLLECTION = "hydraulic_knowledge";

    @Test
    void shouldReadDimensionFromCollectionSchema() {
        FakeHttpInterceptor http = new FakeHttpInterceptor()
                .on("/v2/vectordb/collections/has", "{\"code\":0,\"data\":{\"has\":true}}")
                .on("/v2/vectordb/collections/describe", """
                        {"code":0,"data":{"fields":[
                          {"name":"id","type":"VarChar","params":[{"key":"max_length","value":"64"}]},
                          {"name":"vector","type":"FloatVector","params":[{"key":"dim","value":"768"}]}]}}
                        """);
        MilvusRestVectorIndex index = new MilvusRestVectorIndex(http.client(), "http://milvus:19530/", "secret");

        CollectionDescription description = index.describe(COLLECTION).orElseThrow();

        assertEquals(768, description.dimension());
        assertEquals("Bearer secret", http.requests().get(0).authorization());
        assertTrue(http.requests().get(0).body().contains("\"collectionName\":\"hydraulic_knowledge\""));
    }

    @Test
    void missingCollectionShouldDescribeAsEmpty() {
        FakeHttpInterceptor http = new FakeHttpInterceptor()
                .on("/collections/has", "{\"code\":0,\"data\":{\"has\":false}}");

        assertTrue(new MilvusRestVectorIndex(http.client(), "http://milvus:19530", null).describe(COLLECTION).isEmpty());
        assertEquals(1, http.requests().size());
    }

    @Test
    void shouldSendFilterAndMapHits() {
        FakeHttpInterceptor http = new FakeHttpInterceptor().on("/entities/search", """
                {"code":0,"data":[
                  {"id":"42","distance":0.91,"content":"Pérdida de carga","timestamp":1700000000000,
                   "metadata":{"documentId":"doc-1","title":"Manual","category":"hydraulics",
                               "regions":["spain","madrid"],"language":"es"}}]}
                """);
        MilvusRestVectorIndex index = new MilvusRestVectorIndex(http.client(), "http://milvus:19530", null);

        List<VectorHit> hits = index.search(COLLECTION, new float[] {0.1f, 0.2f}, 5,
                FilterExpression.of("hydraulics", "spain", null));

        assertEquals(1, hits.size());
        VectorHit hit = hits.get(0);
        assertEquals(42L, hit.chunkId());
        assertEquals(0.91, hit.score(), 1e-9);
        assertEquals("doc-1", hit.record().documentId());
        assertEquals(List.of("spain", "madrid"), hit.record().regions());
        String body = http.requestsTo("/entities/search").get(0).body();
        assertTrue(body.contains("\"limit\":5"));
        assertTrue(body.contains("json_contains(metadata[\\\"regions\\\"], \\\"spain\\\")"), body);
    }

    @Test
    void shouldUpsertRowsWithMetadataAndSkipEmptyBatches() {
        FakeHttpInterceptor http = new FakeHttpInterceptor().on("/entities/upsert", "{\"code\":0,\"data\":{}}");
        MilvusRestVectorIndex index = new MilvusRestVectorIndex(http.client(), "http://milvus:19530", null);

        index.insert(COLLECTION, List.of());
        index.insert(COLLECTION, List.of(new VectorRecord("7", new float[] {1f, 0f}, "texto", "doc-1", "Manual",
                "hydraulics", List.of("spain"), "es", 5L)));

        assertEquals(1, http.requests().size());
        String body = http.requests().get(0).body();
        assertTrue(body.contains("\"id\":\"7\""));
        assertTrue(body.contains("\"documentId\":\"doc-1\""));
    }

    @Test
    void shouldDeleteByIdList() {
        FakeHttpInterceptor http = new FakeHttpInterceptor().on("/entities/delete", "{\"code\":0,\"data\":{}}");

        new MilvusRestVectorIndex(http.client(), "http://milvus:19530", null).delete(COLLECTION, List.of("1", "2"));

        assertTrue(http.requests().get(0).body().contains("id in [\\\"1\\\",\\\"2\\\"]"));
    }

    @Test
    void shouldRaiseOnErrorCodeStatusOrConnectionFailure() {
        FakeHttpInterceptor rejecting = new FakeHttpInterceptor()
                .on("/collections/get_stats", "{\"code\":100,\"message\":\"collection not found\"}");
        FakeHttpInterceptor failing = new FakeHttpInterceptor().on("/collections/get_stats", 503, "{}");
        FakeHttpInterceptor unreachable = new FakeHttpInterceptor().failWith(new ConnectException("refused"));

        VectorIndexException rejected = assertThrows(VectorIndexException.class,
                () -> new MilvusRestVectorIndex(rejecting.client(), "http://milvus:19530", null).getStatistics(COLLECTION));
        assertTrue(rejected.getMessage().contains("collection not found"));
        assertThrows(VectorIndexException.class,
                () -> new MilvusRestVectorIndex(failing.client(), "http://milvus:19530", null).getStatistics(COLLECTION));
        assertThrows(VectorIndexException.class,
                () -> new MilvusRestVectorIndex(unreachable.client(), "http://milvus:19530", null).getStatistics(COLLECTION));
    }

    @Test
    void shouldReadRowCount() {
        FakeHttpInterceptor http = new FakeHttpInterceptor()
                .on("/collections/get_stats", "{\"code\":0,\"data\":{\"rowCount\":12}}");

        assertEquals(12L, new MilvusRestVectorIndex(http.client(), "http://milvus:19530", null)
                .getStatistics(COLLECTION).rowCount());
    }
}
