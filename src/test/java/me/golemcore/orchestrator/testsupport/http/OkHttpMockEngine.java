package me.golemcore.orchestrator.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OkHttp interceptor that answers tool provider calls from a queue of planned
 * replies instead of the network, recording every request it sees.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final Deque<Object> planned = new ConcurrentLinkedDeque<>();
    private final Deque<CapturedRequest> captured = new ConcurrentLinkedDeque<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public void enqueueJson(int code, String body) {
        enqueueText(code, body, "application/json");
    }

    public void enqueueText(int code, String body, String contentType) {
        planned.add(new PlannedReply(code, body != null ? body : "", contentType));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(failure);
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, bodyOf(request)));
        requestCount.incrementAndGet();

        Object next = planned.poll();
        if (next == null) {
            throw new IOException("Nothing planned for " + request.method() + " " + request.url());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        PlannedReply reply = (PlannedReply) next;
        MediaType mediaType = reply.contentType() != null ? MediaType.parse(reply.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), mediaType))
                .build();
    }

    private static String bodyOf(Request request) throws IOException {
        if (request.body() == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record PlannedReply(int code, String body, String contentType) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String target() {
            String query = request.url().encodedQuery();
            String path = request.url().encodedPath();
            return query == null || query.isBlank() ? path : path + "?" + query;
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
