package com.kbrag.ingest;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.runtime.AppConfig;
import com.kbrag.runtime.ConfigurationException;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviders.class);

    private EmbeddingProviders() {
    }

    /**
     * Vectors from different models are not comparable, so an {@code http} provider without
     * an endpoint is rejected rather than replaced by the hashing provider.
     */
    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        if ("hashing".equals(config.getProvider())) {
            log.info("embedding.provider name=hashing dimension={}", config.getDimension());
            return new HashingEmbeddingProvider(config.getDimension());
        }
        if (!"http".equals(config.getProvider())) {
            throw new ConfigurationException("Unknown embedding.provider: " + config.getProvider());
        }
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("embedding.provider is http but no embedding.endpoint is configured for model "
                    + config.getModel());
        }
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        log.info("embedding.provider name=http model={} dimension={}", config.getModel(), config.getDimension());
        return new HttpEmbeddingProvider(client, endpoint, config.getModel(), config.getApiKey(), config.getDimension());
    }
}
