// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.transport;

import java.net.URI;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.net.ssl.SSLException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket {@link Transport} on Netty NIO.
 *
 * <p>
 * Each {@link #open} builds a fresh pipeline: TLS for {@code wss://}
 * ({@link SslContextBuilder#forClient()}), {@link HttpClientCodec},
 * {@link HttpObjectAggregator}, a {@link WebSocketFrameAggregator} for
 * fragmented messages, and a per-socket handler that drives the RFC 6455
 * handshake. The handshake must finish within the connect timeout.
 *
 * <p>
 * <b>Resource ownership:</b> when constructed without an
 * {@link EventLoopGroup}, the transport creates one with daemon threads named
 * {@code omni-netty-io} and shuts it down on {@link #close()}. A supplied
 * group is never shut down by this class.
 */
public final class NettyWebSocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_FRAME_SIZE = 64 * 1024;

    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;
    private final Duration connectTimeout;
    private final int maxFrameSize;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile @Nullable SslContext sslContext;

    public NettyWebSocketTransport() {
        this(DEFAULT_CONNECT_TIMEOUT, 1);
    }

    public NettyWebSocketTransport(final Duration connectTimeout, final int ioThreads) {
        this(newEventLoopGroup(ioThreads), true, connectTimeout, DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Uses an externally managed event loop group. The caller is responsible
     * for shutting it down.
     */
    public NettyWebSocketTransport(final EventLoopGroup group, final Duration connectTimeout) {
        this(group, false, connectTimeout, DEFAULT_MAX_FRAME_SIZE);
    }

    private NettyWebSocketTransport(
            final EventLoopGroup group,
            final boolean ownsEventLoopGroup,
            final Duration connectTimeout,
            final int maxFrameSize) {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsEventLoopGroup = ownsEventLoopGroup;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.maxFrameSize = maxFrameSize;
    }

    private static EventLoopGroup newEventLoopGroup(final int ioThreads) {
        final ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "omni-netty-io");
            t.setDaemon(true);
            return t;
        };
        return new NioEventLoopGroup(Math.max(1, ioThreads), threadFactory);
    }

    @Override
    public CompletableFuture<TransportSession> open(final URI endpoint, final TransportListener listener) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(listener, "listener");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport is closed"));
        }

        final boolean secure = "wss".equalsIgnoreCase(endpoint.getScheme());
        final SslContext ssl;
        try {
            ssl = secure ? sslContext() : null;
        } catch (SSLException e) {
            return CompletableFuture.failedFuture(e);
        }
        final String host = endpoint.getHost();
        final int port = endpoint.getPort() != -1 ? endpoint.getPort() : (secure ? 443 : 80);

        final CompletableFuture<TransportSession> opened = new CompletableFuture<>();
        // Fresh handler per socket: the handshaker keeps per-connection state.
        final WebSocketClientHandler handler = new WebSocketClientHandler(
                WebSocketClientHandshakerFactory.newHandshaker(
                        endpoint, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), maxFrameSize),
                listener,
                opened);

        final Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (ssl != null) {
                            p.addLast(ssl.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketFrameAggregator(maxFrameSize));
                        p.addLast(handler);
                    }
                });

        try {
            b.connect(host, port).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    opened.completeExceptionally(f.cause());
                }
            });
        } catch (RuntimeException e) {
            // event loop already shut down
            opened.completeExceptionally(e);
        }
        return opened;
    }

    private SslContext sslContext() throws SSLException {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    ctx = SslContextBuilder.forClient().build();
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }

    /**
     * Shuts down the event loop group if this transport created it.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsEventLoopGroup) {
            try {
                group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            } catch (Exception e) {
                log.warn("Error shutting down EventLoopGroup", e);
            }
        }
    }

    private final class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private final TransportListener listener;
        private final CompletableFuture<TransportSession> opened;
        // confined to the channel's event loop
        private @Nullable Throwable failure;
        private boolean closeNotified;

        WebSocketClientHandler(
                final WebSocketClientHandshaker handshaker,
                final TransportListener listener,
                final CompletableFuture<TransportSession> opened) {
            this.handshaker = handshaker;
            this.listener = listener;
            this.opened = opened;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
            ctx.executor().schedule(() -> {
                if (opened.completeExceptionally(new WebSocketHandshakeException(
                        "Handshake with " + handshaker.uri() + " timed out after " + connectTimeout.toMillis() + " ms"))) {
                    ctx.close();
                }
            }, connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!opened.isDone()) {
                opened.completeExceptionally(failure != null ? failure : new ClosedChannelException());
                return;
            }
            if (opened.isCompletedExceptionally() || closeNotified) {
                return;
            }
            closeNotified = true;
            listener.onClose(failure);
        }

        @Override
        public void channelRead0(ChannelHandlerContext ctx, Object msg) {
            final Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                        if (!opened.complete(new NettySession(ch))) {
                            // handshake timer fired first
                            ch.close();
                        }
                    } catch (WebSocketHandshakeException e) {
                        opened.completeExceptionally(e);
                        ch.close();
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException(
                        "Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof TextWebSocketFrame textFrame) {
                try {
                    listener.onMessage(textFrame.text());
                } catch (RuntimeException e) {
                    // an escaping exception would close the socket and every call on it
                    log.error("Frame listener failed", e);
                }
            } else if (msg instanceof PingWebSocketFrame ping) {
                ch.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            } else if (msg instanceof CloseWebSocketFrame) {
                ch.close();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Channel exception on {}: {}", handshaker.uri(), cause.toString());
            failure = cause;
            opened.completeExceptionally(cause);
            ctx.close();
        }
    }

    private static final class NettySession implements TransportSession {
        private final Channel channel;

        NettySession(final Channel channel) {
            this.channel = channel;
        }

        @Override
        public CompletableFuture<Void> send(final String frame) {
            final CompletableFuture<Void> written = new CompletableFuture<>();
            if (!channel.isActive()) {
                written.completeExceptionally(new ClosedChannelException());
                return written;
            }
            channel.writeAndFlush(new TextWebSocketFrame(frame)).addListener((ChannelFutureListener) f -> {
                if (f.isSuccess()) {
                    written.complete(null);
                } else {
                    written.completeExceptionally(f.cause());
                }
            });
            return written;
        }

        @Override
        public void close() {
            if (channel.isActive()) {
                channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
            } else {
                channel.close();
            }
        }

        @Override
        public boolean isOpen() {
            return channel.isActive();
        }
    }
}
