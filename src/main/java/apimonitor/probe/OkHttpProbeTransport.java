package apimonitor.probe;

import apimonitor.endpoint.Endpoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于 OkHttp 的探测传输，所有探测共享一个连接池，并发数由 Dispatcher 限制
 */
@Slf4j
public class OkHttpProbeTransport implements ProbeTransport, AutoCloseable {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;

    public OkHttpProbeTransport(int maxConcurrentChecks, ObjectMapper objectMapper) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(maxConcurrentChecks);
        dispatcher.setMaxRequestsPerHost(maxConcurrentChecks);
        this.client = new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(maxConcurrentChecks, 5, TimeUnit.MINUTES))
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<ProbeResponse> send(Endpoint endpoint) {
        Request request;
        try {
            request = buildRequest(endpoint);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new ProbeFailureException(ErrorCategory.CLIENT_ERROR, "Client error: " + e.getMessage(), e));
        }

        // newBuilder 共享连接池和 Dispatcher，只覆盖本次调用的超时
        OkHttpClient callClient = client.newBuilder()
                .callTimeout(endpoint.getTimeout())
                .build();
        Call call = callClient.newCall(request);
        CompletableFuture<ProbeResponse> future = new CompletableFuture<>();
        long started = System.nanoTime();

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.debug("探测请求失败: {} {}", endpoint.getUrl(), e.toString());
                future.completeExceptionally(classify(e, endpoint));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    ResponseBody body = response.body();
                    if (body != null) {
                        body.bytes();
                    }
                    Duration latency = Duration.ofNanos(System.nanoTime() - started);
                    future.complete(new ProbeResponse(response.code(), latency));
                } catch (IOException e) {
                    future.completeExceptionally(classify(e, endpoint));
                }
            }
        });

        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        return future;
    }

    Request buildRequest(Endpoint endpoint) throws JsonProcessingException {
        String method = endpoint.getMethod() == null ? "GET" : endpoint.getMethod().toUpperCase();
        Request.Builder builder = new Request.Builder().url(endpoint.getUrl());

        Map<String, String> headers = endpoint.getHeaders();
        if (headers != null && !headers.isEmpty()) {
            builder.headers(Headers.of(headers));
        }

        switch (method) {
            case "POST":
            case "PUT":
            case "PATCH":
                builder.method(method, jsonBody(endpoint.getBody()));
                break;
            case "DELETE":
                builder.delete(endpoint.getBody() == null ? null : jsonBody(endpoint.getBody()));
                break;
            case "HEAD":
                builder.head();
                break;
            default:
                builder.get();
        }
        return builder.build();
    }

    private RequestBody jsonBody(Object body) throws JsonProcessingException {
        if (body == null) {
            return RequestBody.create(new byte[0], null);
        }
        String json = body instanceof String ? (String) body : objectMapper.writeValueAsString(body);
        return RequestBody.create(json, JSON);
    }

    static ProbeFailureException classify(IOException e, Endpoint endpoint) {
        if (e instanceof ConnectException || e instanceof UnknownHostException || e instanceof NoRouteToHostException) {
            return new ProbeFailureException(ErrorCategory.CONNECTION_ERROR, "Connection error: " + e.getMessage(), e);
        }
        if (e instanceof InterruptedIOException) {
            return new ProbeFailureException(ErrorCategory.TIMEOUT,
                    "Request timed out after " + endpoint.getTimeout().toSeconds() + "s", e);
        }
        return new ProbeFailureException(ErrorCategory.CLIENT_ERROR, "Client error: " + e.getMessage(), e);
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
