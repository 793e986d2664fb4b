package com.agentstrike.backend;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Backend for a local inference server speaking the Ollama API
 * ({@code POST /api/generate} with streaming disabled).
 * Thread-safe: one shared HttpClient, no mutable state.
 */
public class LocalHttpBackend implements AiBackend {

    private static final Gson GSON = new Gson();
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);

    private final BackendConfig config;
    private final String baseUrl;
    private final HttpClient httpClient;

    public LocalHttpBackend(BackendConfig config) {
        if (config.kind() != BackendKind.LOCAL_HTTP) {
            throw new IllegalArgumentException("Not a local HTTP backend config: " + config);
        }
        this.config = config;
        this.baseUrl = HttpCalls.stripTrailingSlash(config.baseUrl());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() { return config.id(); }

    @Override
    public BackendKind kind() { return BackendKind.LOCAL_HTTP; }

    @Override
    public String describe() {
        return "Local HTTP backend '" + config.id() + "': " + baseUrl + "/api/generate"
                + (config.model().isEmpty() ? "" : " model=" + config.model());
    }

    @Override
    public boolean isAvailable() {
        if (baseUrl.isEmpty()) return false;
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(PROBE_TIMEOUT)
                    .GET();
            addHeaders(rb);
            HttpResponse<Void> response = httpClient.send(rb.build(), HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (IOException | IllegalArgumentException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public DispatchResult invoke(DispatchRequest request) {
        return Invocations.timed(request, () -> call(request.prompt(), request.timeout()));
    }

    String call(String prompt, Duration timeout) throws BackendException {
        if (baseUrl.isEmpty()) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "No base URL configured for " + config.id());
        }
        JsonObject body = new JsonObject();
        body.addProperty("model", config.model());
        body.addProperty("prompt", prompt);
        body.addProperty("stream", false);

        HttpRequest.Builder rb;
        try {
            rb = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(body), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "Invalid base URL for " + config.id() + ": " + baseUrl, e);
        }
        addHeaders(rb);

        String responseBody = HttpCalls.send(httpClient, rb.build(), config.id());
        try {
            JsonObject root = JsonParser.parseString(responseBody).getAsJsonObject();
            if (root.has("error")) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        config.id() + " error: " + HttpCalls.getStr(root, "error"));
            }
            if (!root.has("response")) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        config.id() + " response has no 'response' field");
            }
            return HttpCalls.getStr(root, "response");
        } catch (JsonSyntaxException | IllegalStateException e) {
            throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                    config.id() + " returned malformed JSON: " + Invocations.truncate(responseBody, 200), e);
        }
    }

    private void addHeaders(HttpRequest.Builder rb) {
        if (!config.apiKey().isEmpty()) {
            rb.header("Authorization", "Bearer " + config.apiKey());
        }
        for (Map.Entry<String, String> h : config.headers().entrySet()) {
            rb.header(h.getKey(), h.getValue());
        }
    }
}
