package com.kbrag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls an OpenAI-style embeddings endpoint: {@code {"model": ..., "input": [texts]}}.
 * Accepts {@code data[].embedding} (ordered by {@code data[].index} when present) or a
 * bare {@code embeddings} array of arrays.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpEmbeddingProvider(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) throws EmbeddingProviderException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", texts);
        try {
            String payload = mapper.writeValueAsString(body);
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful()) {
                    int code = response.code();
                    boolean transientFailure = code == 408 || code == 429 || code >= 500;
                    throw new EmbeddingProviderException(name(), "HTTP " + code + " from " + endpoint, transientFailure, null);
                }
                if (response.body() == null) {
                    throw new EmbeddingProviderException(name(), "Empty response body from " + endpoint, true, null);
                }
                return parse(mapper.readTree(response.body().string()), texts.size());
            }
        } catch (EmbeddingProviderException e) {
            throw e;
        } catch (IOException e) {
            throw new EmbeddingProviderException(name(), "Transport failure calling " + endpoint + ": " + e.getMessage(), true, e);
        }
    }

    List<float[]> parse(JsonNode root, int expected) throws EmbeddingProviderException {
        List<float[]> vectors = new ArrayList<>();
        JsonNode data = root.path("data");
        if (data.isArray()) {
            float[][] ordered = new float[data.size()][];
            for (int i = 0; i < data.size(); i++) {
                JsonNode item = data.get(i);
                int position = item.has("index") ? item.get("index").asInt() : i;
                if (position < 0 || position >= ordered.length) {
                    throw new EmbeddingProviderException(name(), "Response index out of range: " + position, false, null);
                }
                ordered[position] = toVector(item.path("embedding"));
            }
            for (int i = 0; i < ordered.length; i++) {
                if (ordered[i] == null) {
                    throw new EmbeddingProviderException(name(), "Response carries no embedding for input " + i, false, null);
                }
                vectors.add(ordered[i]);
            }
        } else if (root.path("embeddings").isArray()) {
            for (JsonNode node : root.path("embeddings")) {
                vectors.add(toVector(node));
            }
        } else {
            throw new EmbeddingProviderException(name(), "Unrecognised embedding response shape", false, null);
        }
        if (vectors.size() != expected) {
            throw new EmbeddingProviderException(name(),
                    "Expected " + expected + " embeddings but received " + vectors.size(), false, null);
        }
        return vectors;
    }

    private float[] toVector(JsonNode vectorNode) throws EmbeddingProviderException {
        if (!vectorNode.isArray()) {
            throw new EmbeddingProviderException(name(), "Embedding is not an array", false, null);
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "http:" + model;
    }
}
