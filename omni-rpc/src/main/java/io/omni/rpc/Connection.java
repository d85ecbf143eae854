// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static io.omni.rpc.internal.RpcUtils.MAPPER;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omni.core.DebugLogger;
import io.omni.core.LogFormatter;
import io.omni.core.error.RpcException;
import io.omni.rpc.transport.Transport;
import io.omni.rpc.transport.TransportListener;
import io.omni.rpc.transport.TransportSession;

/**
 * Owns the single socket of a client, reconnects it with backoff, and feeds
 * inbound response frames to the {@link PendingCallRegistry}.
 *
 * <p>
 * State transitions happen under this object's monitor. No lock is held
 * while waiting for I/O, and futures are completed outside the monitor.
 * Every socket is tagged with a generation number; callbacks from a socket
 * whose generation is no longer current (it was replaced, or the connection
 * was explicitly disconnected) are ignored.
 *
 * <p>
 * <b>Reconnection:</b> each unexpected close or failed connect increments
 * the attempt counter. Below {@link ReconnectPolicy#maxAttempts()} a
 * reconnect to the next endpoint is scheduled after
 * {@link ReconnectPolicy#delayFor(int)}; on reaching it the connection
 * enters {@link ConnectionState#FAILED} and rejects every pending call with
 * {@link RpcException.Kind#CONNECTION_LOST}. A successful open resets the
 * counter. So does leaving {@code FAILED} through {@link #connect()} or a
 * new call, and an explicit {@link #connect()} after {@link #disconnect()}.
 */
public final class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private final EndpointSelector endpoints;
    private final Transport transport;
    private final ReconnectPolicy reconnectPolicy;
    private final ScheduledExecutorService scheduler;
    private final PendingCallRegistry registry;
    private final OmniMetrics metrics;

    // guarded by this
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempts;
    private long generation;
    private boolean disconnectedByCaller;
    private @Nullable TransportSession session;
    private @Nullable URI currentEndpoint;
    private @Nullable ScheduledFuture<?> reconnectTask;
    private final List<CompletableFuture<Void>> openWaiters = new ArrayList<>();

    public Connection(
            final EndpointSelector endpoints,
            final Transport transport,
            final ReconnectPolicy reconnectPolicy,
            final ScheduledExecutorService scheduler,
            final PendingCallRegistry registry,
            final OmniMetrics metrics) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Opens a socket to the next endpoint.
     *
     * <p>
     * No-op while {@code OPEN} or {@code CONNECTING}. From {@code FAILED}, or
     * after {@link #disconnect()}, the attempt counter is reset. A pending
     * scheduled reconnect is replaced by this attempt.
     */
    public void connect() {
        final URI endpoint;
        final long gen;
        synchronized (this) {
            if (state == ConnectionState.OPEN || state == ConnectionState.CONNECTING) {
                return;
            }
            if (state == ConnectionState.FAILED || disconnectedByCaller) {
                attempts = 0;
                disconnectedByCaller = false;
            }
            cancelReconnect();
            endpoint = beginConnect();
            gen = generation;
        }
        open(endpoint, gen);
    }

    /**
     * Connects only if nothing is in progress: {@code DISCONNECTED} with no
     * reconnect scheduled, or {@code FAILED}. Leaving {@code FAILED} starts a
     * fresh reconnect budget. A scheduled reconnect is left to run, so callers
     * never cut a backoff delay short.
     */
    void connectIfIdle() {
        final URI endpoint;
        final long gen;
        synchronized (this) {
            if (state == ConnectionState.FAILED) {
                attempts = 0;
            } else if (state != ConnectionState.DISCONNECTED || reconnectTask != null) {
                return;
            }
            if (disconnectedByCaller) {
                attempts = 0;
                disconnectedByCaller = false;
            }
            endpoint = beginConnect();
            gen = generation;
        }
        open(endpoint, gen);
    }

    // caller holds the monitor
    private URI beginConnect() {
        generation++;
        state = ConnectionState.CONNECTING;
        currentEndpoint = endpoints.next();
        return currentEndpoint;
    }

    private void open(final URI endpoint, final long gen) {
        final int attempt = attempts() + 1;
        log.info("Connecting to {} (attempt {})", endpoint, attempt);
        DebugLogger.logConnection(LogFormatter.formatConnect(endpoint.toString(), attempt));
        CompletableFuture<TransportSession> opening;
        try {
            opening = transport.open(endpoint, new SessionListener(gen));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((session, error) -> {
            if (error != null) {
                log.warn("Connection attempt to {} failed: {}", endpoint, error.toString());
                onUnexpectedClose(gen, error);
            } else {
                onOpen(gen, endpoint, session);
            }
        });
    }

    private void onOpen(final long gen, final URI endpoint, final TransportSession opened) {
        final List<CompletableFuture<Void>> waiters;
        synchronized (this) {
            if (gen != generation || state != ConnectionState.CONNECTING) {
                waiters = null;
            } else {
                session = opened;
                state = ConnectionState.OPEN;
                attempts = 0;
                waiters = new ArrayList<>(openWaiters);
                openWaiters.clear();
            }
        }
        if (waiters == null) {
            log.debug("Closing superseded socket to {}", endpoint);
            opened.close();
            return;
        }
        log.info("Connected to {}", endpoint);
        metrics.onConnectionOpened(endpoint);
        for (CompletableFuture<Void> waiter : waiters) {
            waiter.complete(null);
        }
    }

    private void onUnexpectedClose(final long gen, final @Nullable Throwable cause) {
        final boolean exhausted;
        final int attempt;
        final Duration delay;
        final List<CompletableFuture<Void>> waiters;
        synchronized (this) {
            if (gen != generation
                    || (state != ConnectionState.OPEN && state != ConnectionState.CONNECTING)) {
                return;
            }
            session = null;
            attempts++;
            attempt = attempts;
            exhausted = attempts >= reconnectPolicy.maxAttempts();
            if (exhausted) {
                state = ConnectionState.FAILED;
                delay = null;
                waiters = new ArrayList<>(openWaiters);
                openWaiters.clear();
            } else {
                state = ConnectionState.DISCONNECTED;
                delay = reconnectPolicy.delayFor(attempts);
                waiters = List.of();
                try {
                    reconnectTask = scheduler.schedule(
                            () -> reconnect(gen), delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    // scheduler shut down by close()
                    log.debug("Reconnect not scheduled, scheduler is shut down");
                    return;
                }
            }
        }

        if (exhausted) {
            log.error("Reconnect budget of {} attempts exhausted, giving up", reconnectPolicy.maxAttempts(), cause);
            metrics.onConnectionLost();
            final RpcException notConnected = new RpcException(
                    RpcException.Kind.NOT_CONNECTED, "Connection failed after " + attempt + " attempts", null);
            for (CompletableFuture<Void> waiter : waiters) {
                waiter.completeExceptionally(notConnected);
            }
            registry.rejectAll(RpcException.Kind.CONNECTION_LOST,
                    "Connection lost after " + attempt + " reconnect attempts");
        } else {
            log.warn("Connection lost ({}), reconnect attempt {} in {} ms",
                    cause == null ? "closed" : cause.toString(), attempt, delay.toMillis());
            metrics.onReconnectScheduled(attempt, delay);
        }
    }

    private void reconnect(final long closedGen) {
        final URI endpoint;
        final long gen;
        synchronized (this) {
            if (closedGen != generation || state != ConnectionState.DISCONNECTED || disconnectedByCaller) {
                return;
            }
            reconnectTask = null;
            endpoint = beginConnect();
            gen = generation;
        }
        open(endpoint, gen);
    }

    /**
     * Closes the socket without reconnecting and rejects every pending call
     * with {@link RpcException.Kind#DISCONNECTED}. The connection stays
     * {@code DISCONNECTED} until {@link #connect()} is called.
     */
    public void disconnect() {
        final TransportSession toClose;
        final List<CompletableFuture<Void>> waiters;
        synchronized (this) {
            generation++;
            cancelReconnect();
            disconnectedByCaller = true;
            state = ConnectionState.CLOSING;
            toClose = session;
            session = null;
            waiters = new ArrayList<>(openWaiters);
            openWaiters.clear();
        }
        if (toClose != null) {
            try {
                toClose.close();
            } catch (RuntimeException e) {
                log.warn("Error closing socket", e);
            }
        }
        synchronized (this) {
            if (state == ConnectionState.CLOSING) {
                state = ConnectionState.DISCONNECTED;
            }
        }
        final RpcException disconnected = new RpcException(
                RpcException.Kind.DISCONNECTED, "Client disconnected", null);
        for (CompletableFuture<Void> waiter : waiters) {
            waiter.completeExceptionally(disconnected);
        }
        final int rejected = registry.rejectAll(RpcException.Kind.DISCONNECTED, "Client disconnected");
        log.info("Disconnected, {} pending calls rejected", rejected);
    }

    // caller holds the monitor
    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    /**
     * Returns a future that completes when the connection is {@code OPEN}, or
     * fails with {@link RpcException.Kind#NOT_CONNECTED} after {@code grace}.
     * Fails immediately when the connection is {@code FAILED}.
     */
    public CompletableFuture<Void> whenOpen(final Duration grace) {
        final CompletableFuture<Void> waiter = new CompletableFuture<>();
        synchronized (this) {
            if (state == ConnectionState.OPEN) {
                return CompletableFuture.completedFuture(null);
            }
            if (state == ConnectionState.FAILED) {
                return CompletableFuture.failedFuture(new RpcException(
                        RpcException.Kind.NOT_CONNECTED, "Connection failed, call connect() to retry", null));
            }
            openWaiters.add(waiter);
        }
        final ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(
                    () -> waiter.completeExceptionally(new RpcException(
                            RpcException.Kind.NOT_CONNECTED,
                            "Not connected within " + grace.toMillis() + " ms",
                            null)),
                    grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            waiter.completeExceptionally(new RpcException(RpcException.Kind.NOT_CONNECTED, "Client is closed", null));
            return waiter;
        }
        waiter.whenComplete((ignored, error) -> {
            timer.cancel(false);
            synchronized (this) {
                openWaiters.remove(waiter);
            }
        });
        return waiter;
    }

    /**
     * Writes one frame on the current socket.
     *
     * @return fails if the connection is not open or the write fails
     */
    public CompletableFuture<Void> send(final String frame) {
        final TransportSession current;
        synchronized (this) {
            current = state == ConnectionState.OPEN ? session : null;
        }
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Connection is not open"));
        }
        try {
            return current.send(frame);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public synchronized ConnectionState state() {
        return state;
    }

    public synchronized int attempts() {
        return attempts;
    }

    public synchronized @Nullable URI currentEndpoint() {
        return currentEndpoint;
    }

    void handleFrame(final String frame) {
        final RpcResponse response;
        try {
            response = RpcResponse.fromNode(parse(frame));
        } catch (RpcResponse.MalformedFrameException e) {
            log.warn("Discarding malformed frame: {}", e.getMessage());
            metrics.onMalformedFrame(e.getMessage());
            return;
        }

        final PendingCallRegistry.PendingCall call = registry.take(response.id());
        if (call == null) {
            log.debug("Orphaned response for call {} dropped", response.id());
            metrics.onOrphanedResponse(response.id());
            return;
        }
        if (response.cached()) {
            DebugLogger.logRpc(LogFormatter.formatRpcCached(call.method(), response.servedBy()));
        }
        final RpcError error = response.error();
        if (error != null) {
            call.future().completeExceptionally(
                    RpcException.remote(error.code(), error.message(), error.data(), call.id()));
        } else {
            call.future().complete(response.result());
        }
    }

    private static @Nullable JsonNode parse(final String frame) throws RpcResponse.MalformedFrameException {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new RpcResponse.MalformedFrameException("unparseable JSON: " + e.getOriginalMessage());
        }
    }

    private final class SessionListener implements TransportListener {
        private final long gen;

        SessionListener(final long gen) {
            this.gen = gen;
        }

        @Override
        public void onMessage(final String frame) {
            if (!isCurrent()) {
                return;
            }
            handleFrame(frame);
        }

        @Override
        public void onClose(final @Nullable Throwable cause) {
            onUnexpectedClose(gen, cause);
        }

        private boolean isCurrent() {
            synchronized (Connection.this) {
                return gen == generation;
            }
        }
    }
}
