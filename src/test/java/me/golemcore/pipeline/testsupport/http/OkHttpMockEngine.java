package me.golemcore.pipeline.testsupport.http;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Scripted OkHttp interceptor for source tests. Nothing goes over the
 * network: each request consumes the next planned reply (a status with a JSON
 * body, or an I/O failure) and is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<PlannedReply> planned = new ConcurrentLinkedQueue<>();
    private final List<Request> captured = new ArrayList<>();

    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .build();
    }

    public void enqueueJson(int code, String body) {
        planned.add(new PlannedReply(code, body != null ? body : "", null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new PlannedReply(0, "", failure));
    }

    public synchronized List<Request> requests() {
        return List.copyOf(captured);
    }

    public synchronized HttpUrl url(int index) {
        return captured.get(index).url();
    }

    public synchronized int getRequestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        synchronized (this) {
            captured.add(request);
        }
        PlannedReply reply = planned.poll();
        if (reply == null) {
            throw new IOException("No planned reply for " + request.method() + " " + request.url());
        }
        if (reply.failure() != null) {
            throw reply.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(reply.code())
                .message("mock")
                .body(ResponseBody.create(reply.body(), JSON))
                .build();
    }

    private record PlannedReply(int code, String body, IOException failure) {
    }
}
