package com.kbrag.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbrag.runtime.ConfigurationException;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * REST client for the vector index server.
 *
 * <pre>
 * POST   /index/create                {index_name, dim, space_type, precision, M, ef_con}
 * GET    /index/list
 * GET    /index/{name}/info
 * DELETE /index/{name}/delete
 * POST   /index/{name}/vector/insert  [{id, vector, meta}]
 * POST   /index/{name}/search         {vector, k, ef, filter}
 * POST   /index/{name}/vector/delete  {filter}
 * </pre>
 */
public class HttpVectorStoreClient implements VectorStoreClient {
    private static final Logger log = LoggerFactory.getLogger(HttpVectorStoreClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> META_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;
    private final String authToken;

    public HttpVectorStoreClient(OkHttpClient httpClient, String baseUrl, String authToken) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new ConfigurationException("Invalid store.baseUrl: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.authToken = authToken;
    }

    @Override
    public void createIndex(IndexDescriptor descriptor) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("index_name", descriptor.name());
        body.put("dim", descriptor.dimension());
        body.put("space_type", descriptor.spaceType().wireName());
        body.put("precision", descriptor.precision().name());
        body.put("M", descriptor.m());
        body.put("ef_con", descriptor.efConstruction());
        Call call = new Call("create-index", descriptor.name(), post(url("index", "create"), body));
        try (Response response = execute(call)) {
            if (response.code() == 409 || (response.code() == 400 && mentionsAlreadyExists(response))) {
                throw new IndexConflictException(descriptor.name(), "Index '" + descriptor.name() + "' already exists");
            }
            ensureSuccess(call, response);
        }
    }

    @Override
    public IndexDescriptor describeIndex(String name) throws IOException {
        Call call = new Call("describe-index", name, new Request.Builder().url(url("index", name, "info")).get());
        JsonNode info = readJson(call);
        JsonNode root = info.has("index") ? info.get("index") : info;
        int dimension = firstInt(root, 0, "dimension", "dim");
        String space = firstText(root, "cosine", "space_type", "spaceType", "space");
        String precision = firstText(root, "INT8D", "precision");
        int m = firstInt(root, IndexDescriptor.DEFAULT_M, "M", "m");
        int efConstruction = firstInt(root, IndexDescriptor.DEFAULT_EF_CONSTRUCTION, "ef_con", "efConstruction");
        if (dimension <= 0) {
            throw new VectorStoreException("Index info for '" + name + "' carries no dimension", false, null);
        }
        return new IndexDescriptor(name, dimension, SpaceType.parse(space), Precision.parse(precision), m, efConstruction);
    }

    @Override
    public JsonNode listIndexes() throws IOException {
        Call call = new Call("list-indexes", "", new Request.Builder().url(url("index", "list")).get());
        return readJson(call);
    }

    @Override
    public void deleteIndex(String name) throws IOException {
        Call call = new Call("delete-index", name, new Request.Builder().url(url("index", name, "delete")).delete());
        try (Response response = execute(call)) {
            ensureSuccess(call, response);
        }
    }

    @Override
    public void upsert(String indexName, List<VectorItem> items) throws IOException {
        List<Map<String, Object>> body = new ArrayList<>(items.size());
        for (VectorItem item : items) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", item.id());
            entry.put("vector", item.vector());
            entry.put("meta", item.meta());
            body.add(entry);
        }
        Call call = new Call("upsert", indexName, post(url("index", indexName, "vector", "insert"), body));
        try (Response response = execute(call)) {
            ensureSuccess(call, response);
        }
    }

    @Override
    public List<QueryMatch> query(String indexName, float[] vector, int topK, int ef, Map<String, Object> filter) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("k", topK);
        body.put("ef", ef);
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter);
        }
        Call call = new Call("query", indexName, post(url("index", indexName, "search"), body));
        JsonNode root = readJson(call);
        JsonNode results = root.isArray() ? root : root.path("results");
        List<QueryMatch> matches = new ArrayList<>();
        if (!results.isArray()) {
            return matches;
        }
        for (JsonNode result : results) {
            matches.add(toMatch(result));
        }
        return matches;
    }

    @Override
    public void deleteByFilter(String indexName, Map<String, Object> filter) throws IOException {
        Call call = new Call("delete-by-filter", indexName,
                post(url("index", indexName, "vector", "delete"), Map.of("filter", filter)));
        try (Response response = execute(call)) {
            ensureSuccess(call, response);
        }
    }

    private QueryMatch toMatch(JsonNode result) throws IOException {
        double similarity;
        if (result.has("similarity")) {
            similarity = result.get("similarity").asDouble();
        } else if (result.has("score")) {
            similarity = result.get("score").asDouble();
        } else {
            similarity = 1.0 - result.path("distance").asDouble(1.0);
        }
        JsonNode metaNode = result.path("meta");
        Map<String, Object> meta;
        if (metaNode.isTextual()) {
            meta = mapper.readValue(metaNode.asText(), META_TYPE);
        } else if (metaNode.isObject()) {
            meta = mapper.convertValue(metaNode, META_TYPE);
        } else {
            meta = Map.of();
        }
        return new QueryMatch(result.path("id").asText(), similarity, meta);
    }

    private JsonNode readJson(Call call) throws IOException {
        try (Response response = execute(call)) {
            ensureSuccess(call, response);
            if (response.body() == null) {
                return mapper.createObjectNode();
            }
            String body = response.body().string();
            return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        }
    }

    private Response execute(Call call) throws StoreUnavailableException {
        if (authToken != null && !authToken.isBlank()) {
            call.request.header("Authorization", authToken);
        }
        try {
            return httpClient.newCall(call.request.build()).execute();
        } catch (IOException e) {
            log.warn("store.request.failed operation={} target={} reason={}", call.operation, call.target, e.getMessage());
            throw new StoreUnavailableException("Vector store unreachable during " + call.operation + ": " + e.getMessage(), true, e);
        }
    }

    private void ensureSuccess(Call call, Response response) throws IOException {
        if (response.isSuccessful()) {
            return;
        }
        int code = response.code();
        String detail = call.operation + " " + call.target + " returned HTTP " + code;
        if (code == 404) {
            throw new IndexNotFoundException(call.target);
        }
        if (code == 401 || code == 403) {
            throw new StoreUnavailableException("Vector store rejected credentials: " + detail, false, null);
        }
        if (code == 408 || code == 429 || code >= 500) {
            throw new StoreUnavailableException(detail, true, null);
        }
        throw new VectorStoreException(detail, false, null);
    }

    private boolean mentionsAlreadyExists(Response response) throws IOException {
        if (response.body() == null) {
            return false;
        }
        return response.peekBody(4096).string().toLowerCase(Locale.ROOT).contains("already exists");
    }

    private Request.Builder post(HttpUrl url, Object body) throws IOException {
        return new Request.Builder().url(url).post(RequestBody.create(mapper.writeValueAsString(body), JSON));
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private static int firstInt(JsonNode node, int fallback, String... fields) {
        for (String field : fields) {
            if (node.has(field) && node.get(field).canConvertToInt()) {
                return node.get(field).asInt();
            }
        }
        return fallback;
    }

    private static String firstText(JsonNode node, String fallback, String... fields) {
        for (String field : fields) {
            if (node.has(field) && node.get(field).isValueNode()) {
                return node.get(field).asText();
            }
        }
        return fallback;
    }

    private record Call(String operation, String target, Request.Builder request) {
    }
}
