package com.kbrag;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * OkHttp client whose interceptor answers from a queue of canned responses and records
 * every request it sees. An entry with status -1 simulates a transport failure.
 */
public final class CannedHttpClient implements Interceptor {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final Deque<Canned> responses = new ArrayDeque<>();
    private final List<RecordedRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public CannedHttpClient respond(int code, String body) {
        responses.add(new Canned(code, body));
        return this;
    }

    public CannedHttpClient failTransport() {
        responses.add(new Canned(-1, ""));
        return this;
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public synchronized Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String body = "";
        if (request.body() != null) {
            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            body = buffer.readUtf8();
        }
        requests.add(new RecordedRequest(request.method(), request.url().encodedPath(), request.header("Authorization"), body));
        Canned canned = responses.poll();
        if (canned == null) {
            throw new IllegalStateException("No canned response left for " + request.method() + " " + request.url());
        }
        if (canned.code() < 0) {
            throw new IOException("connection refused");
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(canned.code())
                .message("canned")
                .body(ResponseBody.create(canned.body(), JSON))
                .build();
    }

    public record RecordedRequest(String method, String path, String authorization, String body) {
    }

    private record Canned(int code, String body) {
    }
}
