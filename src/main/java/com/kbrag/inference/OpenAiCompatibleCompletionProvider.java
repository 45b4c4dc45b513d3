package com.kbrag.inference;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbrag.inference.GenerationProviderException.Kind;
import com.kbrag.runtime.ConfigurationException;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Chat-completions client for OpenAI and API-compatible hosts such as Groq.
 */
public class OpenAiCompatibleCompletionProvider implements TextCompletionProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleCompletionProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String SYSTEM_MESSAGE =
            "You are a helpful assistant that answers questions based on the provided context. Be concise and accurate.";

    private final String name;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl completionsUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiCompatibleCompletionProvider(
            String name,
            OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String model,
            double temperature,
            int maxTokens,
            Duration timeout) {
        HttpUrl parsed = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new ConfigurationException("Invalid baseUrl for generation provider " + name + ": " + baseUrl);
        }
        this.name = name;
        this.httpClient = httpClient.newBuilder().callTimeout(timeout).build();
        this.completionsUrl = parsed.newBuilder().addPathSegment("chat").addPathSegment("completions").build();
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String prompt) throws GenerationProviderException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_MESSAGE),
                Map.of("role", "user", "content", prompt)));
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);

        Request request;
        try {
            request = new Request.Builder()
                    .url(completionsUrl)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                    .build();
        } catch (IOException e) {
            throw new GenerationProviderException(name, Kind.INVALID_RESPONSE, "Could not encode request: " + e.getMessage(), e);
        }

        log.debug("generation.request provider={} model={} promptChars={}", name, model, prompt.length());
        try (Response response = httpClient.newCall(request).execute()) {
            String payload = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw failureFor(response.code());
            }
            return parseContent(payload);
        } catch (GenerationProviderException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new GenerationProviderException(name, Kind.TIMEOUT, "No response within the call timeout", e);
        } catch (IOException e) {
            throw new GenerationProviderException(name, Kind.NETWORK, e.getMessage(), e);
        }
    }

    String parseContent(String payload) throws GenerationProviderException {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new GenerationProviderException(name, Kind.INVALID_RESPONSE, "Response is not JSON", e);
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new GenerationProviderException(name, Kind.INVALID_RESPONSE, "Response carries no choices[0].message.content");
        }
        return content.asText().strip();
    }

    private GenerationProviderException failureFor(int code) {
        String detail = "HTTP " + code + " from " + completionsUrl.host();
        if (code == 401 || code == 403) {
            return new GenerationProviderException(name, Kind.AUTHENTICATION, detail);
        }
        if (code == 429) {
            return new GenerationProviderException(name, Kind.RATE_LIMIT, detail);
        }
        if (code == 408 || code == 504) {
            return new GenerationProviderException(name, Kind.TIMEOUT, detail);
        }
        if (code >= 500) {
            return new GenerationProviderException(name, Kind.SERVER, detail);
        }
        return new GenerationProviderException(name, Kind.INVALID_RESPONSE, "Request rejected with " + detail);
    }
}
