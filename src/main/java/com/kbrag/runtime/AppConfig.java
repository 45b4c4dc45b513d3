package com.kbrag.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private GenerationConfig generation = new GenerationConfig();
    private RetryConfig retry = new RetryConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation == null ? new GenerationConfig() : generation;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry == null ? new RetryConfig() : retry;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String type = "http";
        private String baseUrl = "http://localhost:8080/api/v1";
        private String authToken = "";
        private String localPath = ".kbrag/local-store.json";
        private String indexName = "rag_documents";
        private int dimension = 384;
        private String spaceType = "cosine";
        private String precision = "INT8D";
        private int m = 16;
        private int efConstruction = 128;
        private int maxUpsertBatch = 1000;
        private int upsertConcurrency = 1;
        private int timeoutMs = 30000;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }

        public String getIndexName() {
            return indexName;
        }

        public void setIndexName(String indexName) {
            this.indexName = indexName;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public String getSpaceType() {
            return spaceType;
        }

        public void setSpaceType(String spaceType) {
            this.spaceType = spaceType;
        }

        public String getPrecision() {
            return precision;
        }

        public void setPrecision(String precision) {
            this.precision = precision;
        }

        public int getM() {
            return m;
        }

        public void setM(int m) {
            this.m = m;
        }

        public int getEfConstruction() {
            return efConstruction;
        }

        public void setEfConstruction(int efConstruction) {
            this.efConstruction = efConstruction;
        }

        public int getMaxUpsertBatch() {
            return maxUpsertBatch;
        }

        public void setMaxUpsertBatch(int maxUpsertBatch) {
            this.maxUpsertBatch = maxUpsertBatch;
        }

        public int getUpsertConcurrency() {
            return upsertConcurrency;
        }

        public void setUpsertConcurrency(int upsertConcurrency) {
            this.upsertConcurrency = upsertConcurrency;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "hashing";
        private String endpoint = "";
        private String apiKey = "";
        private String model = "sentence-transformers/all-MiniLM-L6-v2";
        private int dimension = 384;
        private int maxBatchSize = 1000;
        private int maxConcurrency = 4;
        private int timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int size = 512;
        private int overlap = 50;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int topK = 5;
        private int ef = 128;
        private double relevanceFloor = 0.5;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getEf() {
            return ef;
        }

        public void setEf(int ef) {
            this.ef = ef;
        }

        public double getRelevanceFloor() {
            return relevanceFloor;
        }

        public void setRelevanceFloor(double relevanceFloor) {
            this.relevanceFloor = relevanceFloor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationConfig {
        private List<ProviderConfig> providers = defaultProviders();

        public List<ProviderConfig> getProviders() {
            return providers;
        }

        public void setProviders(List<ProviderConfig> providers) {
            this.providers = providers == null ? defaultProviders() : providers;
        }

        private static List<ProviderConfig> defaultProviders() {
            List<ProviderConfig> chain = new ArrayList<>();
            chain.add(ProviderConfig.of("openai", "openai", "https://api.openai.com/v1", "gpt-3.5-turbo", "OPENAI_API_KEY"));
            chain.add(ProviderConfig.of("groq", "openai", "https://api.groq.com/openai/v1", "llama-3.3-70b-versatile", "GROQ_API_KEY"));
            chain.add(ProviderConfig.of("local", "local", "", "extractive", ""));
            return chain;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String name;
        private String type = "openai";
        private String baseUrl;
        private String model;
        private String apiKey = "";
        private String apiKeyEnv = "";
        private double temperature = 0.7;
        private int maxTokens = 500;
        private int timeoutMs = 30000;

        static ProviderConfig of(String name, String type, String baseUrl, String model, String apiKeyEnv) {
            ProviderConfig config = new ProviderConfig();
            config.setName(name);
            config.setType(type);
            config.setBaseUrl(baseUrl);
            config.setModel(model);
            config.setApiKeyEnv(apiKeyEnv);
            return config;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 8000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }
}
