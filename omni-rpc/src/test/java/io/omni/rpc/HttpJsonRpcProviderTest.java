// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import io.omni.core.OmniDebug;
import io.omni.core.error.RpcException;

class HttpJsonRpcProviderTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("io.omni.debug");

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        OmniDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
        server.stop(0);
    }

    @Test
    void returnsResult() {
        reply(200, """
                {"jsonrpc":"2.0","result":"0xabc","id":"1"}
                """);
        HttpJsonRpcProvider provider = HttpJsonRpcProvider.builder(baseUrl).build();

        JsonRpcResponse response = provider.send("eth_sendRawTransaction", List.of("0x02f8"));

        assertEquals("0xabc", response.resultAsString());
        assertTrue(lastRequest.get().contains("\"method\":\"eth_sendRawTransaction\""));
        assertTrue(lastRequest.get().contains("\"jsonrpc\":\"2.0\""));
    }

    @Test
    void jsonRpcErrorBecomesRemoteError() {
        reply(200, """
                {"jsonrpc":"2.0","error":{"code":-32000,"message":"nonce too low","data":{"inner":["0x1234"]}},"id":"1"}
                """);
        HttpJsonRpcProvider provider = HttpJsonRpcProvider.builder(baseUrl).build();

        RpcException ex = assertThrows(RpcException.class,
                () -> provider.send("eth_sendRawTransaction", List.of("0x02f8")));

        assertEquals(RpcException.Kind.REMOTE_ERROR, ex.kind());
        assertEquals(-32000, ex.code());
        assertEquals("0x1234", ex.data());
        assertTrue(ex.getMessage().contains("nonce too low"));
    }

    @Test
    void httpErrorStatusMapsToTransportError() {
        reply(503, "upstream unavailable");
        HttpJsonRpcProvider provider = HttpJsonRpcProvider.builder(baseUrl).build();

        RpcException ex = assertThrows(RpcException.class, () -> provider.send("eth_chainId", List.of()));

        assertEquals(RpcException.Kind.TRANSPORT, ex.kind());
        assertEquals(-32001, ex.code());
        assertEquals("upstream unavailable", ex.data());
    }

    @Test
    void unparseableBodyMapsToParseError() {
        reply(200, "<html>not json</html>");
        HttpJsonRpcProvider provider = HttpJsonRpcProvider.builder(baseUrl).build();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> provider.sendAsync("eth_chainId", List.of()).join());

        RpcException cause = assertInstanceOf(RpcException.class, ex.getCause());
        assertEquals(-32700, cause.code());
    }

    @Test
    void rejectsNonHttpUrl() {
        assertThrows(IllegalArgumentException.class, () -> HttpJsonRpcProvider.builder("wss://x").build());
    }

    @Test
    void logsCallsWhenRpcLoggingEnabled() {
        reply(200, """
                {"jsonrpc":"2.0","result":"0x1","id":"1"}
                """);
        OmniDebug.setRpcLogging(true);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);

        HttpJsonRpcProvider.builder(baseUrl).build().send("eth_chainId", List.of());

        assertFalse(appender.list.isEmpty());
        assertTrue(appender.list.get(0).getFormattedMessage().startsWith("[RPC] method=eth_chainId"));
    }

    @Test
    void broadcastPolicyRoutesThroughHttpProvider() throws Exception {
        reply(200, """
                {"jsonrpc":"2.0","result":"0xfeed","id":"1"}
                """);
        FakeTransport transport = new FakeTransport();
        ClientConfig config = ClientConfig.builder()
                .endpoint("wss://x")
                .identity(Identity.generate("s"))
                .chainId(137)
                .broadcastProvider(HttpJsonRpcProvider.builder(baseUrl).build())
                .build();

        try (OmniClient client = new OmniClient(config, transport)) {
            assertEquals("0xfeed", client.broadcastTransaction("0x02f8").get(5, TimeUnit.SECONDS));
        }

        assertTrue(transport.opened.isEmpty());
        assertTrue(lastRequest.get().contains("[\"0x02f8\"]"));
    }

    private void reply(int status, String body) {
        server.createContext("/", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, status, body);
        });
    }

    private static void respond(HttpExchange exchange, int statusCode, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
