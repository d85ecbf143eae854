// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static io.omni.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.omni.core.DebugLogger;
import io.omni.core.LogFormatter;
import io.omni.core.error.RpcException;
import io.omni.rpc.internal.RpcUtils;

/**
 * Conventional JSON-RPC 2.0 over HTTP POST, used for chains whose
 * transactions are broadcast through a public node rather than the validator
 * network.
 *
 * <p>
 * Failures surface as {@link RpcException}:
 * <ul>
 * <li>HTTP status outside 2xx: kind {@code TRANSPORT}, code {@code -32001}, body as data</li>
 * <li>unparseable body or unserializable request: kind {@code TRANSPORT}, code {@code -32700}</li>
 * <li>I/O failure: kind {@code TRANSPORT}, code {@code -32000}</li>
 * <li>JSON-RPC error object: kind {@code REMOTE_ERROR} with the node's code and
 * the innermost string of its {@code data}</li>
 * </ul>
 *
 * <pre>{@code
 * HttpJsonRpcProvider polygon = HttpJsonRpcProvider.builder("https://polygon-rpc.com")
 *         .readTimeout(Duration.ofSeconds(15))
 *         .build();
 * String txHash = polygon.send("eth_sendRawTransaction", List.of(signedTx)).resultAsString();
 * }</pre>
 */
public final class HttpJsonRpcProvider {

    private final URI url;
    private final Duration readTimeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpJsonRpcProvider(final Builder builder) {
        this.url = URI.create(builder.url);
        this.readTimeout = builder.readTimeout;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public URI url() {
        return url;
    }

    /**
     * Sends a request and blocks until the response arrives.
     *
     * @throws RpcException on any HTTP, parse or JSON-RPC failure
     */
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        try {
            return sendAsync(method, params).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException(RpcException.Kind.TRANSPORT, "JSON-RPC call failed", null, e.getCause());
        }
    }

    /**
     * Sends a request without blocking. The future fails with
     * {@link RpcException}.
     */
    public CompletableFuture<JsonRpcResponse> sendAsync(final String method, final List<?> params) {
        Objects.requireNonNull(method, "method");
        final List<?> safeParams = params == null ? List.of() : params;
        final String requestId = String.valueOf(ids.getAndIncrement());
        final JsonRpcRequest request = new JsonRpcRequest("2.0", method, safeParams, requestId);

        final String payload;
        try {
            payload = MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new RpcException(
                    RpcException.Kind.TRANSPORT, -32700,
                    "Unable to serialize JSON-RPC request for " + method, null, requestId, e));
        }

        final long start = System.nanoTime();
        return httpClient.sendAsync(buildRequest(payload), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    final long durationMicros = (System.nanoTime() - start) / 1_000L;
                    if (error != null) {
                        final Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        throw new CompletionException(new RpcException(
                                RpcException.Kind.TRANSPORT, -32000,
                                "Network error during JSON-RPC call " + method, null, requestId, cause));
                    }
                    return toResponse(method, requestId, response, durationMicros);
                });
    }

    private JsonRpcResponse toResponse(
            final String method, final String requestId, final HttpResponse<String> response,
            final long durationMicros) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw new CompletionException(new RpcException(
                    RpcException.Kind.TRANSPORT, -32001,
                    "HTTP error for method " + method + ": " + response.statusCode(),
                    response.body(), requestId, null));
        }

        final JsonRpcResponse rpcResponse;
        try {
            rpcResponse = MAPPER.readValue(response.body(), JsonRpcResponse.class);
        } catch (IOException e) {
            throw new CompletionException(new RpcException(
                    RpcException.Kind.TRANSPORT, -32700,
                    "Unable to parse JSON-RPC response for method " + method,
                    response.body(), requestId, e));
        }

        final JsonRpcError err = rpcResponse.error();
        if (err != null) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new CompletionException(RpcException.remote(
                    err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId));
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .header("Content-Type", "application/json")
                .timeout(readTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : headers.entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpJsonRpcProvider build() {
            final String scheme = URI.create(url).getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("URL must use http:// or https://, got: " + url);
            }
            return new HttpJsonRpcProvider(this);
        }
    }
}
