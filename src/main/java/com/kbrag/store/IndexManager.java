package com.kbrag.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.RetryPolicy;

/**
 * Lifecycle of named vector indexes. Creation is idempotent and tolerates a concurrent
 * creator winning the race between the existence check and the create call.
 */
public class IndexManager {
    private static final Logger log = LoggerFactory.getLogger(IndexManager.class);
    private static final List<String> WRAPPER_FIELDS = List.of("indexes", "indices", "data", "results", "items");
    private static final List<String> NAME_FIELDS = List.of("name", "index_name", "indexName", "id");

    private final VectorStoreClient client;
    private final RetryPolicy retryPolicy;

    public IndexManager(VectorStoreClient client, RetryPolicy retryPolicy) {
        this.client = client;
        this.retryPolicy = retryPolicy;
    }

    public IndexHandle ensureIndex(IndexDescriptor descriptor) throws IOException {
        if (listIndexes().contains(descriptor.name())) {
            log.debug("index.exists name={}", descriptor.name());
            return verifiedHandle(descriptor);
        }
        try {
            retryPolicy.execute("index.create", attempt -> {
                client.createIndex(descriptor);
                return null;
            });
            log.info("index.created name={} dimension={} space={} precision={} m={} efConstruction={}",
                    descriptor.name(),
                    descriptor.dimension(),
                    descriptor.spaceType().wireName(),
                    descriptor.precision(),
                    descriptor.m(),
                    descriptor.efConstruction());
        } catch (IndexConflictException e) {
            log.warn("index.create.conflict name={} reason=created-concurrently", descriptor.name());
        }
        return verifiedHandle(descriptor);
    }

    public Optional<IndexHandle> findIndex(String name) throws IOException {
        try {
            IndexDescriptor existing = describe(name);
            return Optional.of(new IndexHandle(existing, client));
        } catch (IndexNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean deleteIndex(String name) throws IOException {
        try {
            retryPolicy.execute("index.delete", attempt -> {
                client.deleteIndex(name);
                return null;
            });
            log.info("index.deleted name={}", name);
            return true;
        } catch (IndexNotFoundException e) {
            log.info("index.delete.skipped name={} reason=absent", name);
            return false;
        }
    }

    public List<String> listIndexes() throws IOException {
        JsonNode raw = retryPolicy.execute("index.list", attempt -> client.listIndexes());
        return normalizeIndexNames(raw);
    }

    /**
     * Accepts a bare array of names, an array of objects carrying a name field, or an object
     * wrapping either under a well-known key. Anything else yields an empty list.
     */
    static List<String> normalizeIndexNames(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return List.of();
        }
        JsonNode entries = raw;
        if (raw.isObject()) {
            entries = null;
            for (String field : WRAPPER_FIELDS) {
                if (raw.has(field)) {
                    entries = raw.get(field);
                    break;
                }
            }
            if (entries == null) {
                return List.of();
            }
            if (entries.isObject()) {
                List<String> keys = new ArrayList<>();
                entries.fieldNames().forEachRemaining(keys::add);
                return keys;
            }
        }
        if (!entries.isArray()) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode entry : entries) {
            String name = nameOf(entry);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return List.copyOf(names);
    }

    private static String nameOf(JsonNode entry) {
        if (entry.isTextual()) {
            return entry.asText();
        }
        if (entry.isObject()) {
            for (String field : NAME_FIELDS) {
                JsonNode value = entry.get(field);
                if (value != null && value.isValueNode()) {
                    return value.asText();
                }
            }
        }
        return null;
    }

    private IndexHandle verifiedHandle(IndexDescriptor requested) throws IOException {
        IndexDescriptor existing = describe(requested.name());
        if (existing.dimension() != requested.dimension()) {
            throw new ConfigurationException("Index '" + requested.name() + "' has dimension " + existing.dimension()
                    + " but " + requested.dimension() + " was requested; delete and recreate it to change dimension");
        }
        if (existing.spaceType() != requested.spaceType()) {
            throw new ConfigurationException("Index '" + requested.name() + "' uses space " + existing.spaceType().wireName()
                    + " but " + requested.spaceType().wireName() + " was requested");
        }
        return new IndexHandle(existing, client);
    }

    private IndexDescriptor describe(String name) throws IOException {
        return retryPolicy.execute("index.describe", attempt -> client.describeIndex(name));
    }
}
