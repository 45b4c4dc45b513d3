package com.kbrag.store;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import com.kbrag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class VectorStoreClients {
    private VectorStoreClients() {
    }

    public static VectorStoreClient fromConfig(AppConfig.StoreConfig config, OkHttpClient httpClient) throws IOException {
        if ("local".equals(config.getType())) {
            return LocalVectorStoreClient.load(Path.of(config.getLocalPath()));
        }
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        return new HttpVectorStoreClient(client, config.getBaseUrl(), config.getAuthToken());
    }
}
