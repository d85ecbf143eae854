// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.transport;

import static io.omni.rpc.internal.RpcUtils.MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.omni.rpc.ClientConfig;
import io.omni.rpc.ConnectionState;
import io.omni.rpc.Identity;
import io.omni.rpc.OmniClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the transport against a loopback Netty WebSocket server.
 */
class NettyWebSocketTransportTest {

    private static final String CLOSE_COMMAND = "close-me";

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private int port;
    private volatile Function<String, String> reply = frame -> frame;
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();

    private NettyWebSocketTransport transport;

    @BeforeEach
    void startServer() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler("/ws"));
                        ch.pipeline().addLast(new ServerFrameHandler());
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        transport = new NettyWebSocketTransport(Duration.ofSeconds(5), 1);
    }

    @AfterEach
    void stopServer() {
        transport.close();
        serverChannel.close().syncUninterruptibly();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private URI endpoint() {
        return URI.create("ws://127.0.0.1:" + port + "/ws");
    }

    @Test
    void echoesTextFrames() throws Exception {
        RecordingListener listener = new RecordingListener();
        TransportSession session = transport.open(endpoint(), listener).get(5, TimeUnit.SECONDS);

        assertTrue(session.isOpen());
        session.send("{\"id\":\"a\"}").get(5, TimeUnit.SECONDS);

        assertEquals("{\"id\":\"a\"}", received.poll(5, TimeUnit.SECONDS));
        assertEquals("{\"id\":\"a\"}", listener.messages.poll(5, TimeUnit.SECONDS));
        session.close();
    }

    @Test
    void reportsServerInitiatedClose() throws Exception {
        RecordingListener listener = new RecordingListener();
        TransportSession session = transport.open(endpoint(), listener).get(5, TimeUnit.SECONDS);

        session.send(CLOSE_COMMAND);

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertNull(listener.closeCause.get());
        assertFalse(session.isOpen());
    }

    @Test
    void failsToOpenWhenNothingListens() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> transport.open(URI.create("ws://127.0.0.1:" + unusedPort + "/ws"), new RecordingListener())
                        .get(10, TimeUnit.SECONDS));
        assertTrue(ex.getCause() instanceof java.net.ConnectException, ex.getCause().toString());
    }

    @Test
    void rejectsOpenAfterClose() {
        transport.close();

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> transport.open(endpoint(), new RecordingListener()).get(1, TimeUnit.SECONDS));
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void clientRoundTripOverRealSocket() throws Exception {
        reply = frame -> {
            try {
                JsonNode request = MAPPER.readTree(frame);
                ObjectNode response = MAPPER.createObjectNode();
                response.put("id", request.get("id").asText());
                response.put("result", "0x10");
                return response.toString();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
        ClientConfig config = ClientConfig.builder()
                .endpoint(endpoint().toString())
                .identity(Identity.generate("omni-test-secret"))
                .chainId(137)
                .connectGrace(Duration.ofSeconds(5))
                .build();

        try (OmniClient client = new OmniClient(config, transport)) {
            BigInteger balance = client.getBalance("0x00000000000000000000000000000000000000aa")
                    .get(10, TimeUnit.SECONDS);

            assertEquals(BigInteger.valueOf(16), balance);
            assertEquals(ConnectionState.OPEN, client.getConnectionState());

            JsonNode sent = MAPPER.readTree(received.poll(5, TimeUnit.SECONDS));
            assertEquals("eth_getBalance", sent.get("method").asText());
            assertEquals(137, sent.get("params").get(2).asLong());
            assertEquals(config.identity().clientId(), sent.get("auth").get("clientId").asText());
        }
    }

    private final class ServerFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            String text = frame.text();
            received.add(text);
            if (CLOSE_COMMAND.equals(text)) {
                ctx.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
                return;
            }
            String response = reply.apply(text);
            if (response != null) {
                ctx.writeAndFlush(new TextWebSocketFrame(response));
            }
        }
    }

    private static final class RecordingListener implements TransportListener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final CountDownLatch closed = new CountDownLatch(1);
        final AtomicReference<Throwable> closeCause = new AtomicReference<>();

        @Override
        public void onMessage(String frame) {
            messages.add(frame);
        }

        @Override
        public void onClose(Throwable cause) {
            closeCause.set(cause);
            closed.countDown();
        }
    }
}
