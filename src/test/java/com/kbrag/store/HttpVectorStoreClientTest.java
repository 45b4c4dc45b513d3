package com.kbrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.kbrag.CannedHttpClient;

class HttpVectorStoreClientTest {

    private static final String BASE_URL = "http://store.test/api/v1";

    @Test
    void shouldSendCreateIndexPayloadWithToken() throws Exception {
        CannedHttpClient http = new CannedHttpClient().respond(200, "{}");
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "token-123");

        client.createIndex(IndexDescriptor.of("rag_documents", 384));

        CannedHttpClient.RecordedRequest request = http.lastRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/v1/index/create", request.path());
        assertEquals("token-123", request.authorization());
        assertTrue(request.body().contains("\"index_name\":\"rag_documents\""));
        assertTrue(request.body().contains("\"dim\":384"));
        assertTrue(request.body().contains("\"space_type\":\"cosine\""));
        assertTrue(request.body().contains("\"precision\":\"INT8D\""));
        assertTrue(request.body().contains("\"M\":16"));
        assertTrue(request.body().contains("\"ef_con\":128"));
    }

    @Test
    void shouldTranslateAlreadyExistsIntoConflict() {
        CannedHttpClient http = new CannedHttpClient()
                .respond(409, "{}")
                .respond(400, "{\"error\": \"Index Already Exists\"}");
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "");

        assertThrows(IndexConflictException.class, () -> client.createIndex(IndexDescriptor.of("docs", 4)));
        assertThrows(IndexConflictException.class, () -> client.createIndex(IndexDescriptor.of("docs", 4)));
    }

    @Test
    void shouldDescribeIndexFromInfoResponse() throws Exception {
        CannedHttpClient http = new CannedHttpClient()
                .respond(200, "{\"dimension\": 384, \"space_type\": \"ip\", \"precision\": \"FLOAT32\", \"M\": 32, \"ef_con\": 200}");
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "");

        IndexDescriptor descriptor = client.describeIndex("docs");

        assertEquals("/api/v1/index/docs/info", http.lastRequest().path());
        assertEquals(384, descriptor.dimension());
        assertEquals(SpaceType.INNER_PRODUCT, descriptor.spaceType());
        assertEquals(Precision.FLOAT32, descriptor.precision());
        assertEquals(32, descriptor.m());
        assertEquals(200, descriptor.efConstruction());
    }

    @Test
    void shouldParseQueryResultsInEveryScoreShape() throws Exception {
        CannedHttpClient http = new CannedHttpClient().respond(200, """
                {"results": [
                  {"id": "a", "similarity": 0.9, "meta": {"text": "alpha", "source": "a.txt", "chunk_index": 0}},
                  {"id": "b", "distance": 0.25, "meta": "{\\"text\\": \\"beta\\", \\"chunk_index\\": \\"2\\"}"},
                  {"id": "c", "score": 0.1}
                ]}
                """);
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "");

        List<QueryMatch> matches = client.query("docs", new float[] { 1f, 0f }, 3, 64, Map.of("source", "a.txt"));

        assertEquals("/api/v1/index/docs/search", http.lastRequest().path());
        assertTrue(http.lastRequest().body().contains("\"k\":3"));
        assertTrue(http.lastRequest().body().contains("\"ef\":64"));
        assertTrue(http.lastRequest().body().contains("\"filter\":{\"source\":\"a.txt\"}"));
        assertEquals(3, matches.size());
        assertEquals(0.9, matches.get(0).similarity(), 1e-9);
        assertEquals("alpha", matches.get(0).metaString("text", ""));
        assertEquals(0.75, matches.get(1).similarity(), 1e-9);
        assertEquals(2, matches.get(1).metaInt("chunk_index", -1));
        assertEquals(0.1, matches.get(2).similarity(), 1e-9);
        assertTrue(matches.get(2).meta().isEmpty());
    }

    @Test
    void shouldMapStatusCodesToStoreFailures() {
        CannedHttpClient http = new CannedHttpClient()
                .respond(404, "{}")
                .respond(503, "{}")
                .respond(401, "{}")
                .failTransport()
                .respond(422, "{}");
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "");

        IndexNotFoundException notFound = assertThrows(IndexNotFoundException.class, () -> client.describeIndex("gone"));
        StoreUnavailableException unavailable = assertThrows(StoreUnavailableException.class, () -> client.listIndexes());
        StoreUnavailableException unauthorized = assertThrows(StoreUnavailableException.class, () -> client.listIndexes());
        StoreUnavailableException unreachable = assertThrows(StoreUnavailableException.class, () -> client.listIndexes());
        VectorStoreException rejected = assertThrows(VectorStoreException.class,
                () -> client.upsert("docs", List.of(new VectorItem("x", new float[] { 1f }, Map.of()))));

        assertEquals("gone", notFound.indexName());
        assertTrue(unavailable.isTransient());
        assertFalse(unauthorized.isTransient());
        assertTrue(unreachable.isTransient());
        assertFalse(rejected.isTransient());
    }

    @Test
    void shouldDeleteByFilterAndIndex() throws Exception {
        CannedHttpClient http = new CannedHttpClient().respond(200, "{}").respond(200, "");
        HttpVectorStoreClient client = new HttpVectorStoreClient(http.client(), BASE_URL, "");

        client.deleteByFilter("docs", Map.of("source", "old.txt"));
        client.deleteIndex("docs");

        assertEquals("/api/v1/index/docs/vector/delete", http.requests().get(0).path());
        assertTrue(http.requests().get(0).body().contains("\"source\":\"old.txt\""));
        assertEquals("DELETE", http.requests().get(1).method());
        assertEquals("/api/v1/index/docs/delete", http.requests().get(1).path());
    }
}
