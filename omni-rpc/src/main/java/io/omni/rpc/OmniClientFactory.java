// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.omni.core.chain.KnownChains;
import io.omni.rpc.transport.NettyWebSocketTransport;
import io.omni.rpc.transport.Transport;

/**
 * Creates and caches one {@link OmniClient} per chain id.
 *
 * <p>
 * All clients share one {@link Identity}, so every chain connection
 * authenticates as the same wallet, and one {@link Transport}. A client stays
 * cached until {@link #disconnectAll()} or {@link #close()}.
 *
 * <pre>{@code
 * try (OmniClientFactory factory = OmniClientFactory.builder()
 *         .sharedSecret(secret)
 *         .defaultEndpoints(List.of(URI.create("wss://validator1.example:8546"),
 *                                   URI.create("wss://validator2.example:8546")))
 *         .build()) {
 *     OmniClient polygon = factory.get(137);
 *     BigInteger balance = polygon.getBalance(address).join();
 * }
 * }</pre>
 */
public final class OmniClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OmniClientFactory.class);

    private final Identity identity;
    private final List<URI> defaultEndpoints;
    private final Map<Long, List<URI>> chainEndpoints;
    private final Map<Long, HttpJsonRpcProvider> broadcastProviders;
    private final Duration callTimeout;
    private final Duration connectGrace;
    private final ReconnectPolicy reconnectPolicy;
    private final OmniMetrics metrics;
    private final Transport transport;
    private final boolean ownsTransport;
    private final ConcurrentHashMap<Long, OmniClient> clients = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private OmniClientFactory(final Builder builder, final Identity identity, final Transport transport,
            final boolean ownsTransport) {
        this.identity = identity;
        this.defaultEndpoints = List.copyOf(builder.defaultEndpoints);
        this.chainEndpoints = Map.copyOf(builder.chainEndpoints);
        this.broadcastProviders = Map.copyOf(builder.broadcastProviders);
        this.callTimeout = builder.callTimeout;
        this.connectGrace = builder.connectGrace;
        this.reconnectPolicy = builder.reconnectPolicy;
        this.metrics = builder.metrics;
        this.transport = transport;
        this.ownsTransport = ownsTransport;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the client for {@code chainId}, creating and connecting it on
     * first use.
     *
     * @throws IllegalStateException if the factory is closed
     */
    public OmniClient get(final long chainId) {
        ensureOpen();
        final OmniClient client = clients.computeIfAbsent(chainId, id -> {
            ensureOpen();
            return createClient(id);
        });
        // close() may have run between the checks and the insert
        if (closed.get()) {
            if (clients.remove(chainId, client)) {
                client.close();
            }
            throw new IllegalStateException("Factory is closed");
        }
        return client;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Factory is closed");
        }
    }

    /**
     * Maps a legacy RPC URL to a chain by keyword and returns that chain's
     * client. The URL itself is never contacted.
     *
     * @see KnownChains#fromRpcUrl(String)
     */
    public OmniClient forRpcUrl(final String rpcUrl) {
        final long chainId = KnownChains.fromRpcUrl(rpcUrl);
        log.info("RPC URL {} requested, using validator network for chain {}", rpcUrl, chainId);
        return get(chainId);
    }

    /**
     * Returns a snapshot of the cached clients.
     */
    public List<OmniClient> getAll() {
        return new ArrayList<>(clients.values());
    }

    /**
     * Disconnects and releases every cached client, then clears the cache.
     * Later {@link #get} calls create fresh clients.
     */
    public void disconnectAll() {
        for (Long chainId : new ArrayList<>(clients.keySet())) {
            final OmniClient client = clients.remove(chainId);
            if (client != null) {
                try {
                    client.close();
                } catch (RuntimeException e) {
                    log.warn("Error closing client for chain {}", chainId, e);
                }
            }
        }
    }

    public Identity identity() {
        return identity;
    }

    /**
     * Disconnects all clients and releases the shared transport if the
     * factory created it.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        disconnectAll();
        if (ownsTransport) {
            transport.close();
        }
    }

    private OmniClient createClient(final Long chainId) {
        final ClientConfig config = ClientConfig.builder()
                .endpoints(chainEndpoints.getOrDefault(chainId, defaultEndpoints))
                .identity(identity)
                .chainId(chainId)
                .callTimeout(callTimeout)
                .connectGrace(connectGrace)
                .reconnectPolicy(reconnectPolicy)
                .broadcastProvider(broadcastProviders.get(chainId))
                .metrics(metrics)
                .build();
        final OmniClient client = new OmniClient(config, transport);
        log.info("Created client {} for chain {}", identity.clientId(), chainId);
        client.connect();
        return client;
    }

    /**
     * Builder for {@link OmniClientFactory}.
     */
    public static final class Builder {
        private final List<URI> defaultEndpoints = new ArrayList<>();
        private final Map<Long, List<URI>> chainEndpoints = new HashMap<>();
        private final Map<Long, HttpJsonRpcProvider> broadcastProviders = new HashMap<>();
        private String sharedSecret;
        private String clientId;
        private String protocolVersion = Identity.DEFAULT_PROTOCOL_VERSION;
        private Duration callTimeout = ClientConfig.DEFAULT_CALL_TIMEOUT;
        private Duration connectGrace = ClientConfig.DEFAULT_CONNECT_GRACE;
        private Duration connectTimeout = ClientConfig.DEFAULT_CONNECT_TIMEOUT;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.DEFAULT;
        private OmniMetrics metrics = OmniMetrics.noop();
        private @Nullable Transport transport;

        private Builder() {
        }

        /**
         * Endpoints used for every chain without its own list.
         */
        public Builder defaultEndpoints(final List<URI> endpoints) {
            this.defaultEndpoints.clear();
            this.defaultEndpoints.addAll(endpoints);
            return this;
        }

        public Builder chainEndpoints(final long chainId, final List<URI> endpoints) {
            this.chainEndpoints.put(chainId, List.copyOf(endpoints));
            return this;
        }

        public Builder sharedSecret(final String sharedSecret) {
            this.sharedSecret = sharedSecret;
            return this;
        }

        /**
         * Fixes the client id; one is generated when not set.
         */
        public Builder clientId(final String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder protocolVersion(final String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder callTimeout(final Duration callTimeout) {
            this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
            return this;
        }

        public Builder connectGrace(final Duration connectGrace) {
            this.connectGrace = Objects.requireNonNull(connectGrace, "connectGrace");
            return this;
        }

        /**
         * Connect timeout of the Netty transport the factory creates. Ignored
         * when a transport is supplied.
         */
        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder reconnectPolicy(final ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
            return this;
        }

        /**
         * Broadcasts transactions for {@code chainId} through a conventional
         * JSON-RPC node.
         */
        public Builder broadcastProvider(final long chainId, final HttpJsonRpcProvider provider) {
            this.broadcastProviders.put(chainId, Objects.requireNonNull(provider, "provider"));
            return this;
        }

        public Builder metrics(final OmniMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        /**
         * Shares a caller-owned transport; the factory will not close it.
         */
        public Builder transport(final Transport transport) {
            this.transport = transport;
            return this;
        }

        public OmniClientFactory build() {
            if (defaultEndpoints.isEmpty() && chainEndpoints.isEmpty()) {
                throw new IllegalStateException("At least one endpoint is required");
            }
            Objects.requireNonNull(sharedSecret, "sharedSecret");
            final Identity identity = new Identity(
                    clientId != null ? clientId : Identity.generateClientId(), sharedSecret, protocolVersion);
            if (transport != null) {
                return new OmniClientFactory(this, identity, transport, false);
            }
            return new OmniClientFactory(this, identity, new NettyWebSocketTransport(connectTimeout, 1), true);
        }
    }
}
