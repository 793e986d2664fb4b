package com.agentstrike.backend;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class HttpBackendTest {

    static HttpServer server;
    static ExecutorService handlers;
    static String base;

    /** Last request body and Authorization header, keyed by the first path segment. */
    static final Map<String, String> bodies = new ConcurrentHashMap<>();
    static final Map<String, String> auth = new ConcurrentHashMap<>();

    @BeforeAll
    static void up() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        handlers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "test-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(handlers);
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        reply("ok", 200, "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"all clear\"}}]}");
        reply("unauthorized", 401, "{\"error\": \"bad key\"}");
        reply("forbidden", 403, "{\"error\": \"no access\"}");
        reply("ratelimited", 429, "{\"error\": \"slow down\"}");
        reply("overloaded", 503, "busy");
        reply("broken", 500, "stack trace");
        reply("missing", 404, "not found");
        reply("nochoices", 200, "{\"choices\": []}");
        reply("badchoices", 200, "{\"choices\": \"nope\"}");
        reply("nomessage", 200, "{\"choices\": [{\"index\": 0}]}");
        reply("ollama", 200, "{\"model\": \"llama3.1\", \"response\": \"local answer\", \"done\": true}");
        reply("ollama-error", 200, "{\"error\": \"model not found\"}");
        reply("ollama-noresponse", 200, "{\"done\": true}");
        reply("ollama-array", 200, "[1, 2]");
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "{}");
        });

        server.start();
    }

    @AfterAll
    static void down() {
        server.stop(0);
        handlers.shutdownNow();
    }

    private static void reply(String name, int status, String body) {
        server.createContext("/" + name, ex -> {
            bodies.put(name, new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String header = ex.getRequestHeaders().getFirst("Authorization");
            if (header != null) auth.put(name, header);
            respond(ex, status, body);
        });
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static DispatchResult openAi(String path, Duration timeout) {
        BackendConfig config = BackendConfig.genericHttp("remote", base + "/" + path + "/v1", "gpt-test")
                .withApiKey("sk-test-123");
        return new OpenAiCompatibleBackend(config).invoke(DispatchRequest.of("remote", "hello model", timeout));
    }

    private static DispatchResult openAi(String path) {
        return openAi(path, Duration.ofSeconds(5));
    }

    private static DispatchResult ollama(String path) {
        BackendConfig config = BackendConfig.localHttp("local", base + "/" + path, "llama3.1");
        return new LocalHttpBackend(config).invoke(DispatchRequest.of("local", "hello local", Duration.ofSeconds(5)));
    }

    @Test
    void chat_completion_content_is_returned_and_request_is_well_formed() {
        DispatchResult result = openAi("ok");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("all clear", result.getRawText());
        assertEquals("Bearer sk-test-123", auth.get("ok"));
        JsonObject sent = JsonParser.parseString(bodies.get("ok")).getAsJsonObject();
        assertEquals("gpt-test", sent.get("model").getAsString());
        assertEquals("hello model", sent.getAsJsonArray("messages").get(0).getAsJsonObject()
                .get("content").getAsString());
        assertFalse(sent.get("stream").getAsBoolean());
    }

    @Test
    void auth_statuses_map_to_auth_error() {
        assertEquals(BackendException.ErrorType.AUTH_ERROR, openAi("unauthorized").getErrorKind());
        assertEquals(BackendException.ErrorType.AUTH_ERROR, openAi("forbidden").getErrorKind());
    }

    @Test
    void busy_statuses_map_to_unavailable() {
        DispatchResult limited = openAi("ratelimited");
        assertEquals(BackendException.ErrorType.UNAVAILABLE, limited.getErrorKind());
        assertTrue(limited.getErrorMessage().contains("429"), limited.getErrorMessage());
        assertEquals(BackendException.ErrorType.UNAVAILABLE, openAi("overloaded").getErrorKind());
    }

    @Test
    void other_non_2xx_statuses_map_to_protocol_error() {
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, openAi("broken").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, openAi("missing").getErrorKind());
    }

    @Test
    void malformed_choices_map_to_protocol_error() {
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, openAi("nochoices").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, openAi("badchoices").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, openAi("nomessage").getErrorKind());
    }

    @Test
    void slow_server_maps_to_timeout() {
        DispatchResult result = openAi("slow", Duration.ofMillis(300));

        assertFalse(result.isSuccess());
        assertEquals(BackendException.ErrorType.TIMEOUT, result.getErrorKind());
    }

    @Test
    void refused_connection_maps_to_unavailable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        BackendConfig config = BackendConfig.localHttp("local", "http://127.0.0.1:" + closedPort, "llama3.1");
        LocalHttpBackend backend = new LocalHttpBackend(config);

        DispatchResult result = backend.invoke(DispatchRequest.of("local", "x", Duration.ofSeconds(5)));

        assertEquals(BackendException.ErrorType.UNAVAILABLE, result.getErrorKind());
        assertFalse(backend.isAvailable());
    }

    @Test
    void ollama_generate_returns_the_response_field() {
        DispatchResult result = ollama("ollama");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("local answer", result.getRawText());
        JsonObject sent = JsonParser.parseString(bodies.get("ollama")).getAsJsonObject();
        assertEquals("llama3.1", sent.get("model").getAsString());
        assertEquals("hello local", sent.get("prompt").getAsString());
        assertFalse(sent.get("stream").getAsBoolean());
    }

    @Test
    void ollama_error_bodies_map_to_protocol_error() {
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, ollama("ollama-error").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, ollama("ollama-noresponse").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, ollama("ollama-array").getErrorKind());
    }

    @Test
    void ollama_shares_the_status_mapping() {
        assertEquals(BackendException.ErrorType.AUTH_ERROR, ollama("unauthorized").getErrorKind());
        assertEquals(BackendException.ErrorType.UNAVAILABLE, ollama("ratelimited").getErrorKind());
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, ollama("broken").getErrorKind());
    }

    @Test
    void missing_base_url_is_unavailable_without_a_request() {
        LocalHttpBackend backend = new LocalHttpBackend(BackendConfig.localHttp("local", "", "llama3.1"));

        assertFalse(backend.isAvailable());
        assertEquals(BackendException.ErrorType.UNAVAILABLE,
                backend.invoke(DispatchRequest.of("local", "x", Duration.ofSeconds(1))).getErrorKind());
    }
}
