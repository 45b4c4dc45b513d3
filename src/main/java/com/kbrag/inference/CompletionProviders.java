package com.kbrag.inference;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class CompletionProviders {
    private static final Logger log = LoggerFactory.getLogger(CompletionProviders.class);

    private CompletionProviders() {
    }

    /**
     * Builds the chain in configured order. Remote tiers without an API key are left out and a
     * local tier is appended when the configuration has none.
     */
    public static List<TextCompletionProvider> fromConfig(AppConfig.GenerationConfig config, OkHttpClient httpClient) {
        List<TextCompletionProvider> chain = new ArrayList<>();
        boolean hasLocal = false;
        for (AppConfig.ProviderConfig provider : config.getProviders()) {
            if ("local".equals(provider.getType())) {
                chain.add(new LocalCompletionProvider(provider.getName(), provider.getMaxTokens()));
                hasLocal = true;
                continue;
            }
            if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
                log.warn("generation.provider.skipped provider={} reason=missing-api-key env={}",
                        provider.getName(), provider.getApiKeyEnv());
                continue;
            }
            chain.add(new OpenAiCompatibleCompletionProvider(
                    provider.getName(),
                    httpClient,
                    provider.getBaseUrl(),
                    provider.getApiKey(),
                    provider.getModel(),
                    provider.getTemperature(),
                    provider.getMaxTokens(),
                    Duration.ofMillis(provider.getTimeoutMs())));
        }
        if (!hasLocal) {
            chain.add(new LocalCompletionProvider());
        }
        log.info("generation.chain providers={}", chain.stream().map(TextCompletionProvider::name).toList());
        return chain;
    }
}
