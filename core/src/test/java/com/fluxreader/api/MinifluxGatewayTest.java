package com.fluxreader.api;

import com.fluxreader.common.model.EntriesPage;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.test.TestBase;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Miniflux REST client against a local HTTP server
 */
class MinifluxGatewayTest extends TestBase {

    private static final String ENTRIES_JSON = """
            {"total": 1, "entries": [{
              "id": 5, "title": "Hello", "status": "unread", "starred": true,
              "url": "https://blog.example.com/hello",
              "published_at": "2024-02-03T04:05:06Z",
              "content": "<p>Hi</p>",
              "feed": {"id": 2, "title": "Blog", "category": {"id": 3, "title": "Tech"}}
            }]}
            """;

    private HttpServer server;
    private String serverAddress;
    private final Map<String, String> seen = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/entries", exchange -> {
            record(exchange);
            if (exchange.getRequestMethod().equals("PUT")) {
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
            } else {
                respond(exchange, 200, ENTRIES_JSON);
            }
        });
        server.createContext("/v1/feeds/", exchange -> {
            record(exchange);
            respond(exchange, 400, "{\"error_message\": \"feed not found\"}");
        });
        server.createContext("/v1/me", exchange -> {
            record(exchange);
            respond(exchange, 200, "{\"id\": 1, \"username\": \"reader\"}");
        });
        server.start();
        serverAddress = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void record(HttpExchange exchange) throws IOException {
        seen.put("method", exchange.getRequestMethod());
        seen.put("uri", exchange.getRequestURI().toString());
        String token = exchange.getRequestHeaders().getFirst("X-Auth-Token");
        seen.put("token", token != null ? token : "");
        seen.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private MinifluxGateway gateway() {
        return new MinifluxGateway(serverAddress, "token-123", 5000);
    }

    @Test
    void testListEntries() {
        EntryQuery query = EntryQuery.builder().status(EntryStatus.UNREAD).order("published_at").direction("desc")
                .limit(1).publishedBefore(1700000000L).build();

        ApiResult<EntriesPage> result = gateway().getEntries(query);

        assertTrue(result.isOk(), String.valueOf(result));
        assertEquals("/v1/entries?status=unread&order=published_at&direction=desc&limit=1&published_before=1700000000",
                seen.get("uri"));
        assertEquals("token-123", seen.get("token"));

        Entry entry = result.getValue().first();
        assertEquals(5, entry.getId());
        assertEquals(EntryStatus.UNREAD, entry.getStatus());
        assertTrue(entry.isStarred());
        assertEquals("2024-02-03T04:05:06Z", entry.getPublishedAt());
        assertEquals("Tech", entry.getCategory().title());
    }

    @Test
    void testBulkStatusUpdate() {
        ApiResult<Void> result = gateway().updateStatus(List.of(1L, 2L), EntryStatus.READ);

        assertTrue(result.isOk());
        assertEquals("PUT", seen.get("method"));
        assertEquals("{\"entry_ids\":[1,2],\"status\":\"read\"}", seen.get("body"));
    }

    @Test
    void testHttpErrorCarriesServerMessage() {
        ApiResult<Void> result = gateway().markFeedAsRead(77);

        assertFalse(result.isOk());
        assertEquals("/v1/feeds/77/mark-all-as-read", seen.get("uri"));
        assertEquals(400, result.getError().httpStatus());
        assertEquals("feed not found", result.getError().message());
        assertFalse(result.getError().transportFailure());
    }

    @Test
    void testConnectionTest() {
        ApiResult<Map<String, Object>> me = gateway().getMe();

        assertTrue(me.isOk());
        assertEquals("reader", me.getValue().get("username"));
    }

    @Test
    void testUnreachableServerIsTransportFailure() {
        server.stop(0);

        ApiResult<Entry> result = gateway().getEntry(5);

        assertFalse(result.isOk());
        assertTrue(result.getError().transportFailure());
    }

    @Test
    void testMissingConfigurationAndInvalidIds() {
        ApiResult<Entry> unconfigured = new MinifluxGateway("", "", 5000).getEntry(5);
        assertFalse(unconfigured.isOk());
        assertFalse(unconfigured.getError().transportFailure());

        assertFalse(gateway().toggleBookmark(0).isOk());
        assertFalse(gateway().updateEntries(List.of(), Map.of()).isOk());
        assertTrue(seen.isEmpty(), "Nothing reached the server");
    }

    @Test
    void testNormalizeBase() {
        assertEquals("https://rss.example.com", MinifluxGateway.normalizeBase("https://rss.example.com/v1/"));
        assertEquals("https://rss.example.com", MinifluxGateway.normalizeBase(" https://rss.example.com// "));
        assertEquals("", MinifluxGateway.normalizeBase(null));
    }
}
