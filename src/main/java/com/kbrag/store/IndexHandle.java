package com.kbrag.store;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class IndexHandle {
    private final IndexDescriptor descriptor;
    private final VectorStoreClient client;

    IndexHandle(IndexDescriptor descriptor, VectorStoreClient client) {
        this.descriptor = descriptor;
        this.client = client;
    }

    public String name() {
        return descriptor.name();
    }

    public int dimension() {
        return descriptor.dimension();
    }

    public IndexDescriptor descriptor() {
        return descriptor;
    }

    public void upsert(List<VectorItem> items) throws IOException {
        client.upsert(descriptor.name(), items);
    }

    public List<QueryMatch> query(float[] vector, int topK, int ef, Map<String, Object> filter) throws IOException {
        return client.query(descriptor.name(), vector, topK, ef, filter == null ? Map.of() : filter);
    }

    public void deleteByFilter(Map<String, Object> filter) throws IOException {
        client.deleteByFilter(descriptor.name(), filter);
    }

    @Override
    public String toString() {
        return "IndexHandle{" + descriptor + '}';
    }
}
