package com.flagship.ledger_resolver.connector;

import com.flagship.ledger_resolver.pool.LedgerPoolConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Gateway connector against an in-process HTTP server.
 */
class HttpLedgerConnectorTest {

    private HttpServer server;
    private final AtomicReference<String> lastSubmitted = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/status", exchange -> respond(exchange, 200, "{\"status\":\"ok\"}"));
        server.createContext("/genesis", exchange -> respond(exchange, 200, "{\"txn\":{}}\n"));
        server.createContext("/submit", exchange -> {
            lastSubmitted.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"op\":\"REPLY\",\"result\":{\"data\":null}}");
        });
        server.createContext("/broken/status", exchange -> respond(exchange, 503, "unavailable"));
        server.createContext("/slow/status", exchange -> respond(exchange, 200, "ok"));
        server.createContext("/slow/submit", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{}");
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private LedgerPoolConfig config(String path, Duration requestTimeout) {
        return LedgerPoolConfig.builder()
                .name("sovrin-test")
                .gatewayUrl("http://127.0.0.1:" + server.getAddress().getPort() + path)
                .requestTimeout(requestTimeout)
                .build();
    }

    @Test
    @DisplayName("Requests are posted to the gateway and replies returned verbatim")
    void submitAndRefresh() throws Exception {
        LedgerConnection connection = new HttpLedgerConnector(Duration.ofSeconds(2))
                .open(config("/", Duration.ofSeconds(2)), "{}");

        String reply = connection.submitRequest("{\"operation\":{\"type\":\"105\"}}");

        assertEquals("{\"op\":\"REPLY\",\"result\":{\"data\":null}}", reply);
        assertEquals("{\"operation\":{\"type\":\"105\"}}", lastSubmitted.get());
        assertEquals("{\"txn\":{}}\n", connection.getTransactions());

        connection.close();
        assertThrows(LedgerTransportException.class, () -> connection.submitRequest("{}"));
    }

    @Test
    @DisplayName("An unhealthy gateway fails the open")
    void unhealthyGateway() {
        HttpLedgerConnector connector = new HttpLedgerConnector(Duration.ofSeconds(2));

        LedgerTransportException error = assertThrows(LedgerTransportException.class,
                () -> connector.open(config("/broken", Duration.ofSeconds(2)), "{}"));
        assertEquals("Gateway for pool sovrin-test returned status 503 for /broken/status", error.getMessage());
        assertNull(error.getCause());
        assertThrows(LedgerTransportException.class,
                () -> connector.open(LedgerPoolConfig.builder().name("no-gateway").build(), "{}"));
    }

    @Test
    @DisplayName("Slow replies surface as timeouts")
    void slowReplyTimesOut() throws Exception {
        LedgerConnection connection = new HttpLedgerConnector(Duration.ofSeconds(2))
                .open(config("/slow", Duration.ofMillis(200)), "{}");

        assertThrows(LedgerTimeoutException.class, () -> connection.submitRequest("{}"));
    }

    @Test
    @DisplayName("Proxy addresses accept an optional scheme")
    void parseProxy() throws Exception {
        InetSocketAddress address = HttpLedgerConnector.parseProxy("socks5://proxy.internal:1080");

        assertEquals("proxy.internal", address.getHostString());
        assertEquals(1080, address.getPort());
        assertThrows(LedgerTransportException.class, () -> HttpLedgerConnector.parseProxy("proxy.internal"));
    }
}
