// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static io.omni.rpc.internal.RpcUtils.MAPPER;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omni.core.DebugLogger;
import io.omni.core.LogFormatter;
import io.omni.core.error.RpcException;
import io.omni.rpc.internal.RpcUtils;
import io.omni.rpc.transport.NettyWebSocketTransport;
import io.omni.rpc.transport.Transport;

/**
 * Authenticated client for one chain of the validator network.
 *
 * <p>
 * Many callers may issue calls concurrently; all of them are multiplexed
 * over a single WebSocket. Each call gets a fresh 128-bit random id and an
 * HMAC-signed envelope, and completes exactly once: with the validator's
 * result, with its error ({@link RpcException.Kind#REMOTE_ERROR}), or with a
 * client-side failure ({@code NOT_CONNECTED}, {@code SEND_FAILED},
 * {@code TIMEOUT}, {@code CONNECTION_LOST}, {@code DISCONNECTED}). Calls are
 * never retried; only the socket is.
 *
 * <pre>{@code
 * try (OmniClient client = new OmniClient(config)) {
 *     BigInteger wei = client.getBalance("0xabc...").join();
 *     Object status = client.send("omni_getValidatorStatus", Map.of());
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> this class is thread-safe. Futures are completed on
 * the Netty I/O thread or the {@code omni-scheduler} thread; dependent stages
 * that block should use an async variant with their own executor.
 */
public final class OmniClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OmniClient.class);

    private static final int MAX_ID_ATTEMPTS = 3;
    private static final String LATEST = "latest";

    private final ClientConfig config;
    private final Transport transport;
    private final boolean ownsTransport;
    private final ScheduledThreadPoolExecutor scheduler;
    private final PendingCallRegistry registry;
    private final Authenticator authenticator;
    private final Connection connection;
    private final OmniMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a client with its own Netty transport, released on {@link #close()}.
     */
    public OmniClient(final ClientConfig config) {
        this(config, new NettyWebSocketTransport(config.connectTimeout(), config.ioThreads()), true);
    }

    /**
     * Creates a client on a shared transport. The caller keeps ownership of
     * {@code transport}.
     */
    public OmniClient(final ClientConfig config, final Transport transport) {
        this(config, transport, false);
    }

    OmniClient(final ClientConfig config, final Transport transport, final boolean ownsTransport) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ownsTransport = ownsTransport;
        this.metrics = config.metrics();

        final ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "omni-scheduler");
            t.setDaemon(true);
            return t;
        };
        this.scheduler = new ScheduledThreadPoolExecutor(1, threadFactory);
        this.scheduler.setRemoveOnCancelPolicy(true);

        this.registry = new PendingCallRegistry();
        this.authenticator = new Authenticator(config.identity());
        this.connection = new Connection(
                new EndpointSelector(config.endpoints()),
                transport,
                config.reconnectPolicy(),
                scheduler,
                registry,
                metrics);
    }

    // ==================== Generic calls ====================

    /**
     * Sends a call with the configured default timeout.
     *
     * @see #sendCall(String, Object, Duration)
     */
    public CompletableFuture<Object> sendCall(final String method, final @Nullable Object params) {
        return sendCall(method, params, config.callTimeout());
    }

    /**
     * Sends a signed call and returns its eventual result.
     *
     * <p>
     * If the socket is not open, a connect is triggered when no attempt is
     * in flight or scheduled (a {@code FAILED} client retries with a fresh
     * reconnect budget) and the call waits up to the configured connect grace period;
     * if the socket is still not open it fails with
     * {@link RpcException.Kind#NOT_CONNECTED} without being sent. Once sent,
     * the call fails with {@link RpcException.Kind#TIMEOUT} if no response
     * arrives within {@code timeout}. Cancelling the returned future drops
     * the pending call.
     *
     * @param method  the method name
     * @param params  any JSON-serializable value; usually a list or a map
     * @param timeout per-call deadline, measured from registration
     * @return the decoded {@code result}: String, Number, Boolean, List, Map or null
     */
    public CompletableFuture<Object> sendCall(
            final String method, final @Nullable Object params, final Duration timeout) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timeout, "timeout");
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new RpcException(RpcException.Kind.NOT_CONNECTED, "Client is closed", null));
        }
        if (connection.state() == ConnectionState.OPEN) {
            return dispatch(method, params, timeout);
        }
        connection.connectIfIdle();
        return connection.whenOpen(config.connectGrace())
                .thenCompose(ignored -> dispatch(method, params, timeout));
    }

    /**
     * Blocking variant of {@link #sendCall(String, Object)}.
     *
     * @throws RpcException if the call fails for any reason
     */
    public @Nullable Object send(final String method, final @Nullable Object params) throws RpcException {
        try {
            return sendCall(method, params).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(RpcException.Kind.NOT_CONNECTED, "Interrupted while waiting for " + method, null, e);
        } catch (ExecutionException e) {
            throw toRpcException(method, e.getCause());
        }
    }

    private CompletableFuture<Object> dispatch(
            final String method, final @Nullable Object params, final Duration timeout) {
        final long timeoutMs = Math.max(1L, timeout.toMillis());
        final long deadline = registry.now() + timeoutMs;

        String id = null;
        CompletableFuture<Object> future = null;
        for (int i = 0; i < MAX_ID_ATTEMPTS && future == null; i++) {
            final String candidate = RpcUtils.newCallId();
            try {
                future = registry.register(candidate, method, deadline);
                id = candidate;
            } catch (RpcException e) {
                log.warn("Call id collision on {}, regenerating", candidate);
            }
        }
        if (future == null) {
            return CompletableFuture.failedFuture(new RpcException(
                    RpcException.Kind.DUPLICATE_ID, "Could not allocate a unique call id", null));
        }
        final String callId = id;
        final long start = System.nanoTime();
        metrics.onRequestStarted(method);
        future.whenComplete((result, error) -> onCallComplete(callId, method, start, error));

        final String frame;
        try {
            frame = MAPPER.writeValueAsString(
                    new Envelope(callId, method, params, authenticator.authenticate(method)));
        } catch (JsonProcessingException e) {
            registry.reject(callId, new RpcException(
                    RpcException.Kind.SEND_FAILED, "Unable to serialize call " + method, callId, e));
            return future;
        }
        DebugLogger.logRpc(LogFormatter.formatRpcRequest(method, frame));

        try {
            final ScheduledFuture<?> timer = scheduler.schedule(
                    () -> registry.expire(registry.now()), timeoutMs, TimeUnit.MILLISECONDS);
            future.whenComplete((result, error) -> timer.cancel(false));
        } catch (RejectedExecutionException e) {
            registry.reject(callId, new RpcException(RpcException.Kind.NOT_CONNECTED, "Client is closed", callId));
            return future;
        }

        connection.send(frame).whenComplete((ignored, error) -> {
            if (error != null) {
                registry.reject(callId, new RpcException(
                        RpcException.Kind.SEND_FAILED, "Failed to send " + method, callId, unwrap(error)));
            }
        });
        return future;
    }

    private void onCallComplete(
            final String callId, final String method, final long startNanos, final @Nullable Throwable error) {
        final long durationMicros = (System.nanoTime() - startNanos) / 1_000L;
        if (error == null) {
            DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
            metrics.onRequestCompleted(method, Duration.ofNanos(durationMicros * 1_000L));
            return;
        }
        if (error instanceof CancellationException) {
            registry.reject(callId, error);
        }
        if (error instanceof RpcException rpc) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, rpc.code(), rpc.getMessage(), durationMicros));
            if (rpc.kind() == RpcException.Kind.TIMEOUT) {
                metrics.onRequestTimeout(method);
                return;
            }
        }
        metrics.onRequestFailed(method, error);
    }

    private static Throwable unwrap(final Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static RpcException toRpcException(final String method, final Throwable error) {
        final Throwable cause = unwrap(error);
        if (cause instanceof RpcException rpc) {
            return rpc;
        }
        return new RpcException(RpcException.Kind.TRANSPORT, "Call " + method + " failed", null, cause);
    }

    // ==================== Standard calls ====================

    public CompletableFuture<BigInteger> getBalance(final String address) {
        return getBalance(address, LATEST);
    }

    /**
     * Native balance in wei ({@code eth_getBalance}).
     */
    public CompletableFuture<BigInteger> getBalance(final String address, final String blockTag) {
        return sendCall("eth_getBalance", List.of(address, blockTag, config.chainId()))
                .thenApply(RpcUtils::decodeQuantity);
    }

    public CompletableFuture<Long> getTransactionCount(final String address) {
        return getTransactionCount(address, LATEST);
    }

    /**
     * Account nonce ({@code eth_getTransactionCount}).
     */
    public CompletableFuture<Long> getTransactionCount(final String address, final String blockTag) {
        return sendCall("eth_getTransactionCount", List.of(address, blockTag, config.chainId()))
                .thenApply(result -> RpcUtils.decodeQuantity(result).longValueExact());
    }

    public CompletableFuture<String> call(final Map<String, ?> transaction) {
        return call(transaction, LATEST);
    }

    /**
     * Read-only contract call ({@code eth_call}); returns the hex return data.
     */
    public CompletableFuture<String> call(final Map<String, ?> transaction, final String blockTag) {
        return sendCall("eth_call", List.of(transaction, blockTag, config.chainId()))
                .thenApply(OmniClient::asString);
    }

    /**
     * Gas estimate ({@code eth_estimateGas}).
     */
    public CompletableFuture<BigInteger> estimateGas(final Map<String, ?> transaction) {
        return sendCall("eth_estimateGas", List.of(transaction, config.chainId()))
                .thenApply(RpcUtils::decodeQuantity);
    }

    /**
     * Relays a transaction signed elsewhere and returns its hash.
     *
     * <p>
     * When a broadcast provider is configured for this chain the transaction
     * goes to that JSON-RPC node over HTTP; otherwise it is sent through the
     * validator network as {@code eth_sendRawTransaction}.
     *
     * @param signedRawTx the {@code 0x}-prefixed signed transaction
     */
    public CompletableFuture<String> broadcastTransaction(final String signedRawTx) {
        Objects.requireNonNull(signedRawTx, "signedRawTx");
        final long start = System.nanoTime();
        final HttpJsonRpcProvider http = config.broadcastProvider();
        final CompletableFuture<String> hash;
        final String route;
        if (http != null) {
            route = "http";
            hash = http.sendAsync("eth_sendRawTransaction", List.of(signedRawTx))
                    .thenApply(JsonRpcResponse::resultAsString);
        } else {
            route = "validator";
            hash = sendCall("eth_sendRawTransaction", List.of(signedRawTx, config.chainId()))
                    .thenApply(OmniClient::asString);
        }
        return hash.whenComplete((txHash, error) -> {
            if (txHash != null) {
                DebugLogger.logRpc(LogFormatter.formatBroadcast(
                        txHash, route, (System.nanoTime() - start) / 1_000L));
            }
        });
    }

    // ==================== Validator calls ====================

    /**
     * NFTs owned by {@code address}, served from the validators' cache
     * ({@code omni_getNFTs}).
     */
    public CompletableFuture<List<Object>> getNfts(final String address) {
        return sendCall("omni_getNFTs", chainParams("address", address)).thenApply(OmniClient::asList);
    }

    /**
     * Metadata of one token ({@code omni_getNFTMetadata}).
     */
    public CompletableFuture<Map<String, Object>> getNftMetadata(final String contract, final String tokenId) {
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("contract", contract);
        params.put("tokenId", tokenId);
        params.put("chainId", config.chainId());
        return sendCall("omni_getNFTMetadata", params).thenApply(OmniClient::asMap);
    }

    public CompletableFuture<List<Object>> getCollections(final String address) {
        return sendCall("omni_getCollections", chainParams("address", address)).thenApply(OmniClient::asList);
    }

    /**
     * Marketplace listings matching {@code filter} ({@code omni_getMarketplaceListings}).
     * The client's chain id is added unless the filter names one.
     */
    public CompletableFuture<List<Object>> getMarketplaceListings(final Map<String, ?> filter) {
        final Map<String, Object> params = new LinkedHashMap<>(filter);
        params.putIfAbsent("chainId", config.chainId());
        return sendCall("omni_getMarketplaceListings", params).thenApply(OmniClient::asList);
    }

    /**
     * Prices for {@code tokens} from the validators' oracle ({@code omni_getPriceOracle}).
     */
    public CompletableFuture<Map<String, Object>> getPriceOracle(final List<String> tokens) {
        return sendCall("omni_getPriceOracle", Map.of("tokens", List.copyOf(tokens))).thenApply(OmniClient::asMap);
    }

    public CompletableFuture<Map<String, Object>> getValidatorStatus() {
        return sendCall("omni_getValidatorStatus", Map.of()).thenApply(OmniClient::asMap);
    }

    private Map<String, Object> chainParams(final String key, final Object value) {
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put(key, value);
        params.put("chainId", config.chainId());
        return params;
    }

    private static @Nullable String asString(final @Nullable Object result) {
        return result != null ? result.toString() : null;
    }

    private static List<Object> asList(final @Nullable Object result) {
        if (result == null) {
            return List.of();
        }
        return MAPPER.convertValue(result, new TypeReference<List<Object>>() {});
    }

    private static Map<String, Object> asMap(final @Nullable Object result) {
        if (result == null) {
            return Map.of();
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }

    // ==================== Lifecycle ====================

    /**
     * Starts connecting without waiting. Leaves {@code FAILED} or a previous
     * {@link #disconnect()} with a fresh reconnect budget.
     */
    public void connect() {
        if (closed.get()) {
            throw new IllegalStateException("Client is closed");
        }
        connection.connect();
    }

    /**
     * Closes the socket without reconnecting and fails every pending call
     * with {@link RpcException.Kind#DISCONNECTED}.
     */
    public void disconnect() {
        connection.disconnect();
    }

    public ConnectionState getConnectionState() {
        return connection.state();
    }

    public int getPendingCallCount() {
        return registry.size();
    }

    public long chainId() {
        return config.chainId();
    }

    public String clientId() {
        return config.identity().clientId();
    }

    /**
     * Disconnects, stops the scheduler and releases the transport if this
     * client created it. A closed client cannot be reused.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connection.disconnect();
        scheduler.shutdownNow();
        if (ownsTransport) {
            transport.close();
        }
    }
}
