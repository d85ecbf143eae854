// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.omni.core.chain.KnownChains;

/**
 * Configuration for an {@link OmniClient}.
 *
 * <p>
 * Zero or null values fall back to defaults in the compact constructor:
 * <ul>
 * <li>{@code chainId}: 1 (Ethereum)</li>
 * <li>{@code callTimeout}: 30 seconds</li>
 * <li>{@code connectGrace}: 1 second, how long {@code sendCall} waits for a
 * socket before failing with {@code NOT_CONNECTED}</li>
 * <li>{@code reconnectPolicy}: {@link ReconnectPolicy#DEFAULT}</li>
 * <li>{@code connectTimeout}: 10 seconds, TCP connect plus WebSocket handshake</li>
 * <li>{@code ioThreads}: 1</li>
 * <li>{@code metrics}: {@link OmniMetrics#noop()}</li>
 * </ul>
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *         .endpoints(List.of(URI.create("wss://validator1.example:8546")))
 *         .identity(Identity.generate(sharedSecret))
 *         .chainId(137)
 *         .callTimeout(Duration.ofSeconds(10))
 *         .build();
 * }</pre>
 */
public record ClientConfig(
        List<URI> endpoints,
        Identity identity,
        long chainId,
        Duration callTimeout,
        Duration connectGrace,
        ReconnectPolicy reconnectPolicy,
        Duration connectTimeout,
        int ioThreads,
        @Nullable HttpJsonRpcProvider broadcastProvider,
        OmniMetrics metrics) {

    static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_CONNECT_GRACE = Duration.ofSeconds(1);
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_IO_THREADS = 1;

    public ClientConfig {
        Objects.requireNonNull(endpoints, "endpoints");
        Objects.requireNonNull(identity, "identity");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint is required");
        }
        endpoints = List.copyOf(endpoints);

        if (chainId <= 0)
            chainId = KnownChains.ETHEREUM;
        if (callTimeout == null)
            callTimeout = DEFAULT_CALL_TIMEOUT;
        if (connectGrace == null)
            connectGrace = DEFAULT_CONNECT_GRACE;
        if (reconnectPolicy == null)
            reconnectPolicy = ReconnectPolicy.DEFAULT;
        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (metrics == null)
            metrics = OmniMetrics.noop();

        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be positive, got: " + callTimeout);
        }
        if (connectGrace.isNegative()) {
            throw new IllegalArgumentException("connectGrace must not be negative, got: " + connectGrace);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ClientConfig}.
     */
    public static final class Builder {
        private final List<URI> endpoints = new ArrayList<>();
        private Identity identity;
        private long chainId = 0;
        private Duration callTimeout = null;
        private Duration connectGrace = null;
        private ReconnectPolicy reconnectPolicy = null;
        private Duration connectTimeout = null;
        private int ioThreads = 0;
        private HttpJsonRpcProvider broadcastProvider = null;
        private OmniMetrics metrics = null;

        private Builder() {
        }

        public Builder endpoints(List<URI> endpoints) {
            this.endpoints.clear();
            this.endpoints.addAll(endpoints);
            return this;
        }

        public Builder endpoint(String url) {
            this.endpoints.add(URI.create(url));
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        /**
         * Default per-call timeout used when {@code sendCall} is given none.
         */
        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        /**
         * How long a call waits for the socket to open before failing.
         */
        public Builder connectGrace(Duration connectGrace) {
            this.connectGrace = connectGrace;
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Routes {@code broadcastTransaction} through a conventional JSON-RPC
         * node instead of the validator network.
         */
        public Builder broadcastProvider(HttpJsonRpcProvider broadcastProvider) {
            this.broadcastProvider = broadcastProvider;
            return this;
        }

        public Builder metrics(OmniMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(endpoints, identity, chainId, callTimeout, connectGrace,
                    reconnectPolicy, connectTimeout, ioThreads, broadcastProvider, metrics);
        }
    }
}
