package com.kbrag;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.inference.Answer;
import com.kbrag.inference.AnswerGenerator;
import com.kbrag.inference.CompletionProviders;
import com.kbrag.ingest.BatchUpserter;
import com.kbrag.ingest.Chunker;
import com.kbrag.ingest.Document;
import com.kbrag.ingest.DocumentLoader;
import com.kbrag.ingest.EmbeddingClient;
import com.kbrag.ingest.EmbeddingProviders;
import com.kbrag.ingest.IngestedDocument;
import com.kbrag.ingest.IngestionReport;
import com.kbrag.ingest.IngestionService;
import com.kbrag.retrieval.RetrievalRequest;
import com.kbrag.retrieval.RetrievedChunk;
import com.kbrag.retrieval.Retriever;
import com.kbrag.runtime.AppConfig;
import com.kbrag.runtime.ConfigurationException;
import com.kbrag.runtime.Deadline;
import com.kbrag.runtime.RetryPolicy;
import com.kbrag.store.IndexDescriptor;
import com.kbrag.store.IndexHandle;
import com.kbrag.store.IndexManager;
import com.kbrag.store.QueryMatch;
import com.kbrag.store.VectorItem;
import com.kbrag.store.VectorStoreClient;
import com.kbrag.store.VectorStoreClients;

import okhttp3.OkHttpClient;

/**
 * Caller-facing operations over one named index. Ingestion creates the index on demand;
 * the query side never does.
 */
public class KnowledgeBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);
    public static final int DEFAULT_SUMMARY_TOP_K = 10;
    public static final int DEFAULT_SUMMARY_MAX_WORDS = 500;
    public static final int DEFAULT_DOCUMENT_LIMIT = 100;
    static final int MAX_LISTING_FETCH = 512;

    private final IndexDescriptor descriptor;
    private final IndexManager indexManager;
    private final EmbeddingClient embeddingClient;
    private final BatchUpserter upserter;
    private final IngestionService ingestionService;
    private final Retriever retriever;
    private final AnswerGenerator answerGenerator;
    private final RetryPolicy retryPolicy;
    private final DocumentLoader documentLoader = new DocumentLoader();
    private final int defaultEf;
    private final double relevanceFloor;

    public KnowledgeBase(
            IndexDescriptor descriptor,
            VectorStoreClient storeClient,
            Chunker chunker,
            EmbeddingClient embeddingClient,
            BatchUpserter upserter,
            AnswerGenerator answerGenerator,
            RetryPolicy retryPolicy,
            int defaultEf,
            double relevanceFloor) {
        if (embeddingClient.dimension() != descriptor.dimension()) {
            throw new ConfigurationException("Embedding provider " + embeddingClient.providerName() + " produces dimension "
                    + embeddingClient.dimension() + " but index '" + descriptor.name() + "' is configured for " + descriptor.dimension());
        }
        this.descriptor = descriptor;
        this.indexManager = new IndexManager(storeClient, retryPolicy);
        this.embeddingClient = embeddingClient;
        this.upserter = upserter;
        this.ingestionService = new IngestionService(chunker, embeddingClient, upserter);
        this.retriever = new Retriever(embeddingClient, indexManager, descriptor.name());
        this.answerGenerator = answerGenerator;
        this.retryPolicy = retryPolicy;
        this.defaultEf = defaultEf;
        this.relevanceFloor = relevanceFloor;
    }

    public static KnowledgeBase fromConfig(AppConfig config, OkHttpClient httpClient) throws IOException {
        RetryPolicy retryPolicy = RetryPolicy.fromConfig(config.getRetry());
        AppConfig.StoreConfig store = config.getStore();
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.GenerationConfig generation = config.getGeneration();
        long generationTimeoutMs = generation.getProviders().stream()
                .mapToLong(AppConfig.ProviderConfig::getTimeoutMs)
                .max()
                .orElse(30_000L);
        return new KnowledgeBase(
                IndexDescriptor.fromConfig(store),
                VectorStoreClients.fromConfig(store, httpClient),
                new Chunker(config.getChunking().getSize(), config.getChunking().getOverlap()),
                new EmbeddingClient(
                        EmbeddingProviders.fromConfig(embedding, httpClient),
                        embedding.getMaxBatchSize(),
                        embedding.getMaxConcurrency(),
                        retryPolicy),
                new BatchUpserter(store.getMaxUpsertBatch(), store.getUpsertConcurrency(), retryPolicy),
                new AnswerGenerator(
                        CompletionProviders.fromConfig(generation, httpClient),
                        Duration.ofMillis(generationTimeoutMs + 5_000L)),
                retryPolicy,
                config.getRetrieval().getEf(),
                config.getRetrieval().getRelevanceFloor());
    }

    public String indexName() {
        return descriptor.name();
    }

    public IngestionReport ingest(List<Document> documents) throws IOException {
        return ingest(documents, Deadline.none());
    }

    /**
     * Once {@code deadline} passes, pending embedding and upsert work is abandoned and shows up
     * as failed chunks in the report.
     */
    public IngestionReport ingest(List<Document> documents, Deadline deadline) throws IOException {
        IndexHandle index = indexManager.ensureIndex(descriptor);
        return ingestionService.ingest(index, documents, deadline);
    }

    public IngestionReport ingestDirectory(Path directory) throws IOException {
        return ingestDirectory(directory, Deadline.none());
    }

    public IngestionReport ingestDirectory(Path directory, Deadline deadline) throws IOException {
        return ingest(documentLoader.load(directory), deadline);
    }

    /**
     * Answers from the chunks scoring at least the relevance floor. Returns a
     * {@link Answer.Status#NO_CONTEXT} answer when nothing qualifies.
     */
    public Answer query(String question, int topK) throws IOException {
        return query(question, topK, Deadline.none());
    }

    public Answer query(String question, int topK, Deadline deadline) throws IOException {
        RetrievalRequest request = new RetrievalRequest(question, topK, defaultEf, relevanceFloor, null);
        List<RetrievedChunk> context = retriever.retrieve(request, deadline);
        log.info("query.retrieved index={} topK={} chunks={}", descriptor.name(), topK, context.size());
        return answerGenerator.generate(question, context, deadline);
    }

    public List<RetrievedChunk> search(String query, int topK, double threshold, String source) throws IOException {
        return search(query, topK, threshold, source, Deadline.none());
    }

    public List<RetrievedChunk> search(String query, int topK, double threshold, String source, Deadline deadline)
            throws IOException {
        return retriever.retrieve(new RetrievalRequest(query, topK, defaultEf, threshold, source), deadline);
    }

    public Answer summarize(String topic, int topK, int maxWords) throws IOException {
        return summarize(topic, topK, maxWords, Deadline.none());
    }

    public Answer summarize(String topic, int topK, int maxWords, Deadline deadline) throws IOException {
        RetrievalRequest request = new RetrievalRequest(topic, topK, defaultEf, Double.NEGATIVE_INFINITY, null);
        List<RetrievedChunk> context = retriever.retrieve(request, deadline);
        return answerGenerator.summarize(topic, context, maxWords, deadline);
    }

    public boolean deleteKnowledgeBase(String name) throws IOException {
        return indexManager.deleteIndex(name);
    }

    public boolean deleteDocument(String source) throws IOException {
        Optional<IndexHandle> index = indexManager.findIndex(descriptor.name());
        if (index.isEmpty()) {
            log.info("document.delete.skipped index={} source={} reason=index-absent", descriptor.name(), source);
            return false;
        }
        Map<String, Object> filter = Map.of(VectorItem.META_SOURCE, source);
        retryPolicy.execute("document.delete", attempt -> {
            index.get().deleteByFilter(filter);
            return null;
        });
        log.info("document.deleted index={} source={}", descriptor.name(), source);
        return true;
    }

    /**
     * Sources in the index with their chunk counts, ordered by source. The store has no
     * listing call, so this runs one unranked query of at most {@value #MAX_LISTING_FETCH}
     * chunks; counts for larger indexes are lower bounds.
     */
    public List<IngestedDocument> listDocuments(int limit) throws IOException {
        if (limit <= 0) {
            throw new ConfigurationException("limit must be > 0 but was " + limit);
        }
        Optional<IndexHandle> index = indexManager.findIndex(descriptor.name());
        if (index.isEmpty()) {
            return List.of();
        }
        int fetch = (int) Math.min((long) limit * 10, MAX_LISTING_FETCH);
        float[] origin = new float[index.get().dimension()];
        List<QueryMatch> matches = retryPolicy.execute("documents.list",
                attempt -> index.get().query(origin, fetch, Math.max(defaultEf, fetch), Map.of()));
        Map<String, Integer> counts = new TreeMap<>();
        for (QueryMatch match : matches) {
            counts.merge(match.metaString(VectorItem.META_SOURCE, "unknown"), 1, Integer::sum);
        }
        List<IngestedDocument> documents = counts.entrySet().stream()
                .limit(limit)
                .map(entry -> new IngestedDocument(entry.getKey(), entry.getValue()))
                .toList();
        log.info("documents.listed index={} documents={} chunksSeen={}", descriptor.name(), documents.size(), matches.size());
        return documents;
    }

    public List<String> listKnowledgeBases() throws IOException {
        return indexManager.listIndexes();
    }

    @Override
    public void close() {
        embeddingClient.close();
        upserter.close();
        answerGenerator.close();
    }
}
