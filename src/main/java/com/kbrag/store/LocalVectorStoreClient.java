package com.kbrag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * In-process store with exact (brute force) search. When constructed with a path, every
 * mutation is written back as JSON so separate CLI runs share one knowledge base.
 */
public class LocalVectorStoreClient implements VectorStoreClient {
    private final Map<String, LocalIndex> indexes = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path path;

    public LocalVectorStoreClient() {
        this.path = null;
    }

    private LocalVectorStoreClient(Path path) {
        this.path = path;
    }

    public static LocalVectorStoreClient load(Path path) throws IOException {
        LocalVectorStoreClient store = new LocalVectorStoreClient(path);
        if (!Files.exists(path)) {
            return store;
        }
        List<StoredIndex> loaded = store.objectMapper.readValue(path.toFile(), new TypeReference<List<StoredIndex>>() {
        });
        for (StoredIndex entry : loaded) {
            LocalIndex index = new LocalIndex(entry.descriptor());
            entry.items().forEach(item -> index.items.put(item.id(), item));
            store.indexes.put(entry.descriptor().name(), index);
        }
        return store;
    }

    @Override
    public void createIndex(IndexDescriptor descriptor) throws IOException {
        LocalIndex previous = indexes.putIfAbsent(descriptor.name(), new LocalIndex(descriptor));
        if (previous != null) {
            throw new IndexConflictException(descriptor.name(), "Index '" + descriptor.name() + "' already exists");
        }
        save();
    }

    @Override
    public IndexDescriptor describeIndex(String name) throws IOException {
        return require(name).descriptor;
    }

    @Override
    public JsonNode listIndexes() {
        ArrayNode names = objectMapper.createArrayNode();
        indexes.keySet().stream().sorted().forEach(names::add);
        return names;
    }

    @Override
    public void deleteIndex(String name) throws IOException {
        if (indexes.remove(name) == null) {
            throw new IndexNotFoundException(name);
        }
        save();
    }

    @Override
    public void upsert(String indexName, List<VectorItem> items) throws IOException {
        LocalIndex index = require(indexName);
        for (VectorItem item : items) {
            if (item.vector().length != index.descriptor.dimension()) {
                throw new VectorStoreException("Vector " + item.id() + " has dimension " + item.vector().length
                        + " but index '" + indexName + "' expects " + index.descriptor.dimension(), false, null);
            }
        }
        items.forEach(item -> index.items.put(item.id(), item));
        save();
    }

    @Override
    public List<QueryMatch> query(String indexName, float[] vector, int topK, int ef, Map<String, Object> filter) throws IOException {
        LocalIndex index = require(indexName);
        SpaceType space = index.descriptor.spaceType();
        return index.items.values().stream()
                .filter(item -> matches(item, filter))
                .map(item -> new QueryMatch(item.id(), similarity(space, vector, item.vector()), item.meta()))
                .sorted(Comparator.comparingDouble(QueryMatch::similarity).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public void deleteByFilter(String indexName, Map<String, Object> filter) throws IOException {
        LocalIndex index = require(indexName);
        List<String> toRemove = index.items.values().stream()
                .filter(item -> matches(item, filter))
                .map(VectorItem::id)
                .toList();
        toRemove.forEach(index.items::remove);
        if (!toRemove.isEmpty()) {
            save();
        }
    }

    public int size(String indexName) throws IOException {
        return require(indexName).items.size();
    }

    private LocalIndex require(String name) throws IndexNotFoundException {
        LocalIndex index = indexes.get(name);
        if (index == null) {
            throw new IndexNotFoundException(name);
        }
        return index;
    }

    private static boolean matches(VectorItem item, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            Object actual = item.meta().get(entry.getKey());
            if (actual == null || !Objects.equals(actual.toString(), String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private synchronized void save() throws IOException {
        if (path == null) {
            return;
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<StoredIndex> snapshot = new ArrayList<>();
        for (LocalIndex index : indexes.values()) {
            snapshot.add(new StoredIndex(index.descriptor, new ArrayList<>(index.items.values())));
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    }

    static double similarity(SpaceType space, float[] a, float[] b) {
        return switch (space) {
            case COSINE -> cosine(a, b);
            case INNER_PRODUCT -> dot(a, b);
            case L2 -> 1.0 / (1.0 + Math.sqrt(squaredDistance(a, b)));
        };
    }

    private static double cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0d;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double squaredDistance(float[] a, float[] b) {
        double sum = 0d;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    private static final class LocalIndex {
        private final IndexDescriptor descriptor;
        private final Map<String, VectorItem> items = new ConcurrentHashMap<>();

        private LocalIndex(IndexDescriptor descriptor) {
            this.descriptor = descriptor;
        }
    }

    public record StoredIndex(IndexDescriptor descriptor, List<VectorItem> items) {
    }
}
