package com.kbrag.retrieval;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.ingest.EmbeddingClient;
import com.kbrag.ingest.EmbeddingProviderException;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;
import com.kbrag.store.IndexHandle;
import com.kbrag.store.IndexManager;
import com.kbrag.store.QueryMatch;
import com.kbrag.store.VectorItem;
import com.kbrag.store.VectorStoreException;

public class Retriever {
    private static final Logger log = LoggerFactory.getLogger(Retriever.class);
    static final Comparator<RetrievedChunk> RANKING = Comparator.comparingDouble(RetrievedChunk::score).reversed()
            .thenComparing(RetrievedChunk::id);

    private final EmbeddingClient embeddingClient;
    private final IndexManager indexManager;
    private final String indexName;

    public Retriever(EmbeddingClient embeddingClient, IndexManager indexManager, String indexName) {
        this.embeddingClient = embeddingClient;
        this.indexManager = indexManager;
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }

    public List<RetrievedChunk> retrieve(String query, int topK) throws EmbeddingProviderException, InterruptedIOException {
        return retrieve(RetrievalRequest.of(query, topK));
    }

    /**
     * Results are capped at {@code topK} and ordered by descending score, ties by id. A missing
     * index or an unreachable store yields an empty list.
     */
    public List<RetrievedChunk> retrieve(RetrievalRequest request) throws EmbeddingProviderException, InterruptedIOException {
        return retrieve(request, Deadline.none());
    }

    /**
     * As {@link #retrieve(RetrievalRequest)}, giving up with an {@link InterruptedIOException}
     * once {@code deadline} has passed.
     */
    public List<RetrievedChunk> retrieve(RetrievalRequest request, Deadline deadline)
            throws EmbeddingProviderException, InterruptedIOException {
        if (request.query().isBlank()) {
            return List.of();
        }
        Optional<IndexHandle> index;
        try {
            index = indexManager.findIndex(indexName);
        } catch (InterruptedIOException e) {
            throw e;
        } catch (IOException e) {
            log.warn("retrieve.store.unavailable index={} reason={}", indexName, e.getMessage());
            return List.of();
        }
        if (index.isEmpty()) {
            log.info("retrieve.index.absent index={}", indexName);
            return List.of();
        }
        IndexHandle handle = index.get();
        if (handle.dimension() != embeddingClient.dimension()) {
            throw new ConfigurationException("Index '" + indexName + "' has dimension " + handle.dimension()
                    + " but embedding provider " + embeddingClient.providerName() + " produces " + embeddingClient.dimension());
        }

        float[] queryVector = embeddingClient.embed(request.query(), deadline);
        if (deadline.isExpired()) {
            log.warn("retrieve.deadline.exceeded index={} stage=query", indexName);
            throw new InterruptedIOException("Retrieval deadline exceeded before querying index '" + indexName + "'");
        }
        Map<String, Object> filter = request.source() == null ? Map.of() : Map.of(VectorItem.META_SOURCE, request.source());
        List<QueryMatch> matches;
        try {
            matches = handle.query(queryVector, request.topK(), request.ef(), filter);
        } catch (InterruptedIOException e) {
            throw e;
        } catch (VectorStoreException e) {
            log.warn("retrieve.query.failed index={} transient={} reason={}", indexName, e.isTransient(), e.getMessage());
            return List.of();
        } catch (IOException e) {
            log.warn("retrieve.query.failed index={} reason={}", indexName, e.getMessage());
            return List.of();
        }

        List<RetrievedChunk> results = matches.stream()
                .map(Retriever::toRetrievedChunk)
                .filter(chunk -> chunk.score() >= request.minScore())
                .sorted(RANKING)
                .limit(request.topK())
                .toList();
        log.debug("retrieve.complete index={} topK={} ef={} matches={} returned={}",
                indexName, request.topK(), request.ef(), matches.size(), results.size());
        return results;
    }

    private static RetrievedChunk toRetrievedChunk(QueryMatch match) {
        return new RetrievedChunk(
                match.id(),
                match.metaString(VectorItem.META_TEXT, ""),
                match.metaString(VectorItem.META_SOURCE, "unknown"),
                match.metaInt(VectorItem.META_CHUNK_INDEX, -1),
                match.similarity());
    }
}
