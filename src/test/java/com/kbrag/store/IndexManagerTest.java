package com.kbrag.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.RetryPolicy;

class IndexManagerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO);

    @Test
    void shouldCreateExactlyOneIndexUnderConcurrentEnsure() throws Exception {
        StaleListingStore store = new StaleListingStore();
        IndexManager manager = new IndexManager(store, retryPolicy);
        IndexDescriptor descriptor = IndexDescriptor.of("shared", 8);
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<IndexHandle>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return manager.ensureIndex(descriptor);
                }));
            }
            start.countDown();
            for (Future<IndexHandle> future : futures) {
                IndexHandle handle = future.get(10, TimeUnit.SECONDS);
                assertEquals("shared", handle.name());
                assertEquals(8, handle.dimension());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(callers, store.createCalls.get());
        assertEquals(1, store.realIndexCount());
    }

    @Test
    void shouldReuseExistingIndexWithoutCreating() throws IOException {
        StaleListingStore store = new StaleListingStore();
        store.createIndex(IndexDescriptor.of("docs", 8));
        store.listingIsStale = false;
        IndexManager manager = new IndexManager(store, retryPolicy);

        IndexHandle handle = manager.ensureIndex(IndexDescriptor.of("docs", 8));

        assertEquals("docs", handle.name());
        assertEquals(1, store.createCalls.get());
    }

    @Test
    void shouldRejectDimensionMismatchWithExistingIndex() throws IOException {
        LocalVectorStoreClient store = new LocalVectorStoreClient();
        store.createIndex(IndexDescriptor.of("docs", 4));
        IndexManager manager = new IndexManager(store, retryPolicy);

        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> manager.ensureIndex(IndexDescriptor.of("docs", 8)));
        assertTrue(error.getMessage().contains("dimension 4"));
    }

    @Test
    void shouldDeleteIdempotently() throws IOException {
        LocalVectorStoreClient store = new LocalVectorStoreClient();
        IndexManager manager = new IndexManager(store, retryPolicy);
        manager.ensureIndex(IndexDescriptor.of("docs", 4));

        assertTrue(manager.deleteIndex("docs"));
        assertFalse(manager.deleteIndex("docs"));
        assertTrue(manager.findIndex("docs").isEmpty());
        assertEquals(List.of(), manager.listIndexes());
    }

    @Test
    void shouldRetryTransientListingFailure() throws IOException {
        LocalVectorStoreClient store = new LocalVectorStoreClient();
        VectorStoreClient flaky = new DelegatingStore(store) {
            private boolean failed;

            @Override
            public JsonNode listIndexes() throws IOException {
                if (!failed) {
                    failed = true;
                    throw new StoreUnavailableException("HTTP 503", true, null);
                }
                return super.listIndexes();
            }
        };
        store.createIndex(IndexDescriptor.of("alpha", 4));

        assertEquals(List.of("alpha"), new IndexManager(flaky, retryPolicy).listIndexes());
    }

    @Test
    void shouldNormalizeEveryListingShape() throws IOException {
        assertEquals(List.of("a", "b"), normalize("[\"a\", \"b\"]"));
        assertEquals(List.of("a", "b", "c", "d"),
                normalize("[{\"name\": \"a\"}, {\"index_name\": \"b\"}, {\"indexName\": \"c\"}, {\"id\": \"d\"}]"));
        assertEquals(List.of("a"), normalize("{\"indexes\": [\"a\"]}"));
        assertEquals(List.of("a"), normalize("{\"indices\": [{\"name\": \"a\"}]}"));
        assertEquals(List.of("a", "b"), normalize("{\"data\": [\"a\", \"b\", \"a\"]}"));
        assertEquals(List.of("a"), normalize("{\"results\": [{\"name\": \"a\", \"dim\": 4}]}"));
        assertEquals(List.of("x", "y"), normalize("{\"indexes\": {\"x\": {\"dim\": 4}, \"y\": {\"dim\": 8}}}"));
        assertEquals(List.of(), normalize("{\"unexpected\": true}"));
        assertEquals(List.of(), normalize("null"));
        assertEquals(List.of(), normalize("[]"));
    }

    private List<String> normalize(String json) throws IOException {
        return IndexManager.normalizeIndexNames(mapper.readTree(json));
    }

    private static class StaleListingStore extends LocalVectorStoreClient {
        private final AtomicInteger createCalls = new AtomicInteger();
        private volatile boolean listingIsStale = true;

        @Override
        public JsonNode listIndexes() {
            return listingIsStale ? new ObjectMapper().createArrayNode() : super.listIndexes();
        }

        @Override
        public void createIndex(IndexDescriptor descriptor) throws IOException {
            createCalls.incrementAndGet();
            super.createIndex(descriptor);
        }

        int realIndexCount() {
            return super.listIndexes().size();
        }
    }

    private static class DelegatingStore implements VectorStoreClient {
        private final VectorStoreClient delegate;

        DelegatingStore(VectorStoreClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public void createIndex(IndexDescriptor descriptor) throws IOException {
            delegate.createIndex(descriptor);
        }

        @Override
        public IndexDescriptor describeIndex(String name) throws IOException {
            return delegate.describeIndex(name);
        }

        @Override
        public JsonNode listIndexes() throws IOException {
            return delegate.listIndexes();
        }

        @Override
        public void deleteIndex(String name) throws IOException {
            delegate.deleteIndex(name);
        }

        @Override
        public void upsert(String indexName, List<VectorItem> items) throws IOException {
            delegate.upsert(indexName, items);
        }

        @Override
        public List<QueryMatch> query(String indexName, float[] vector, int topK, int ef, Map<String, Object> filter)
                throws IOException {
            return delegate.query(indexName, vector, topK, ef, filter);
        }

        @Override
        public void deleteByFilter(String indexName, Map<String, Object> filter) throws IOException {
            delegate.deleteByFilter(indexName, filter);
        }
    }
}
