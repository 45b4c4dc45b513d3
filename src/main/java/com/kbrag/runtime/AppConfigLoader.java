package com.kbrag.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);
    private static final Set<String> STORE_TYPES = Set.of("http", "local");
    private static final Set<String> EMBEDDING_PROVIDERS = Set.of("http", "hashing");
    private static final Set<String> GENERATION_TYPES = Set.of("openai", "local");

    private final Map<String, String> environment;

    public AppConfigLoader() {
        this(System.getenv());
    }

    public AppConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path config) throws IOException {
        AppConfig appConfig;
        if (config == null || !Files.exists(config)) {
            log.info("config.defaults reason=missing-file path={}", config);
            appConfig = new AppConfig();
        } else {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            appConfig = mapper.readValue(config.toFile(), AppConfig.class);
        }
        applyEnvironment(appConfig);
        validate(appConfig);
        return appConfig;
    }

    void applyEnvironment(AppConfig config) {
        String storeToken = environment.get("RAGKB_STORE_TOKEN");
        if (storeToken != null && !storeToken.isBlank()) {
            config.getStore().setAuthToken(storeToken);
        }
        String storeUrl = environment.get("RAGKB_STORE_URL");
        if (storeUrl != null && !storeUrl.isBlank()) {
            config.getStore().setBaseUrl(storeUrl);
        }
        String embeddingUrl = environment.get("RAGKB_EMBEDDING_URL");
        if (embeddingUrl != null && !embeddingUrl.isBlank()) {
            config.getEmbedding().setEndpoint(embeddingUrl);
        }
        String embeddingKey = environment.get("RAGKB_EMBEDDING_API_KEY");
        if (embeddingKey != null && !embeddingKey.isBlank()) {
            config.getEmbedding().setApiKey(embeddingKey);
        }
        for (AppConfig.ProviderConfig provider : config.getGeneration().getProviders()) {
            String envName = provider.getApiKeyEnv();
            if ((provider.getApiKey() == null || provider.getApiKey().isBlank())
                    && envName != null && !envName.isBlank()) {
                provider.setApiKey(environment.getOrDefault(envName, ""));
            }
        }
    }

    public static void validate(AppConfig config) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        if (chunking.getSize() <= 0) {
            throw new ConfigurationException("chunking.size must be > 0 but was " + chunking.getSize());
        }
        if (chunking.getOverlap() < 0 || chunking.getOverlap() >= chunking.getSize()) {
            throw new ConfigurationException("chunking.overlap must be >= 0 and < chunking.size ("
                    + chunking.getSize() + ") but was " + chunking.getOverlap());
        }
        AppConfig.StoreConfig store = config.getStore();
        requireOneOf("store.type", store.getType(), STORE_TYPES);
        if (store.getDimension() <= 0) {
            throw new ConfigurationException("store.dimension must be > 0 but was " + store.getDimension());
        }
        if (store.getMaxUpsertBatch() <= 0 || store.getUpsertConcurrency() <= 0) {
            throw new ConfigurationException("store.maxUpsertBatch and store.upsertConcurrency must be > 0");
        }
        if (store.getIndexName() == null || store.getIndexName().isBlank()) {
            throw new ConfigurationException("store.indexName must not be blank");
        }
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        requireOneOf("embedding.provider", embedding.getProvider(), EMBEDDING_PROVIDERS);
        if ("http".equals(embedding.getProvider()) && (embedding.getEndpoint() == null || embedding.getEndpoint().isBlank())) {
            throw new ConfigurationException("embedding.endpoint (or RAGKB_EMBEDDING_URL) is required when embedding.provider is http");
        }
        if (embedding.getDimension() != store.getDimension()) {
            throw new ConfigurationException("embedding.dimension (" + embedding.getDimension()
                    + ") must equal store.dimension (" + store.getDimension() + ")");
        }
        if (embedding.getMaxBatchSize() <= 0 || embedding.getMaxConcurrency() <= 0) {
            throw new ConfigurationException("embedding.maxBatchSize and embedding.maxConcurrency must be > 0");
        }
        for (AppConfig.ProviderConfig provider : config.getGeneration().getProviders()) {
            if (provider.getName() == null || provider.getName().isBlank()) {
                throw new ConfigurationException("generation.providers[].name must not be blank");
            }
            requireOneOf("generation.providers[" + provider.getName() + "].type", provider.getType(), GENERATION_TYPES);
        }
        if (config.getRetrieval().getTopK() <= 0) {
            throw new ConfigurationException("retrieval.topK must be > 0");
        }
    }

    private static void requireOneOf(String key, String value, Set<String> allowed) {
        if (value == null || !allowed.contains(value)) {
            throw new ConfigurationException("Unknown " + key + ": " + value + " (expected one of " + allowed + ")");
        }
    }
}
