package com.kbrag.store;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

public interface VectorStoreClient {
    /**
     * @throws IndexConflictException when an index with the same name already exists
     */
    void createIndex(IndexDescriptor descriptor) throws IOException;

    /**
     * @throws IndexNotFoundException when the index does not exist
     */
    IndexDescriptor describeIndex(String name) throws IOException;

    /**
     * Raw listing as returned by the backend. Only {@link IndexManager} interprets it.
     */
    JsonNode listIndexes() throws IOException;

    /**
     * @throws IndexNotFoundException when the index does not exist
     */
    void deleteIndex(String name) throws IOException;

    void upsert(String indexName, List<VectorItem> items) throws IOException;

    List<QueryMatch> query(String indexName, float[] vector, int topK, int ef, Map<String, Object> filter) throws IOException;

    void deleteByFilter(String indexName, Map<String, Object> filter) throws IOException;
}
