package com.agentstrike.backend;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
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
import java.util.regex.Pattern;

/**
 * Backend for any endpoint speaking the OpenAI chat completions protocol
 * (OpenAI itself, LM Studio, vLLM, llama.cpp server, gateways).
 */
public class OpenAiCompatibleBackend implements AiBackend {

    private static final Gson GSON = new Gson();
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);
    private static final Pattern VERSION_SEGMENT = Pattern.compile("v\\d+[a-z0-9]*", Pattern.CASE_INSENSITIVE);

    private final BackendConfig config;
    private final String completionsUrl;
    private final HttpClient httpClient;

    public OpenAiCompatibleBackend(BackendConfig config) {
        if (config.kind() != BackendKind.GENERIC_HTTP) {
            throw new IllegalArgumentException("Not an OpenAI-compatible backend config: " + config);
        }
        this.config = config;
        this.completionsUrl = config.baseUrl().isEmpty() ? "" : resolveCompletionsUrl(config.baseUrl());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .build();
    }

    /**
     * Appends the chat completions path to a base URL. When the last path segment
     * is already a version ({@code /v1}, {@code /v2}, {@code /v1beta}) only
     * {@code /chat/completions} is appended, otherwise {@code /v1/chat/completions}.
     */
    public static String resolveCompletionsUrl(String baseUrl) {
        String base = HttpCalls.stripTrailingSlash(baseUrl.trim());
        if (base.endsWith("/chat/completions")) return base;
        return hasVersionSegment(base) ? base + "/chat/completions" : base + "/v1/chat/completions";
    }

    static String resolveModelsUrl(String baseUrl) {
        String base = HttpCalls.stripTrailingSlash(baseUrl.trim());
        return hasVersionSegment(base) ? base + "/models" : base + "/v1/models";
    }

    private static boolean hasVersionSegment(String base) {
        String path;
        try {
            path = URI.create(base).getPath();
        } catch (IllegalArgumentException e) {
            path = base;
        }
        if (path == null || path.isEmpty()) return false;
        String last = path.substring(path.lastIndexOf('/') + 1);
        return VERSION_SEGMENT.matcher(last).matches();
    }

    public String getCompletionsUrl() { return completionsUrl; }

    @Override
    public String id() { return config.id(); }

    @Override
    public BackendKind kind() { return BackendKind.GENERIC_HTTP; }

    @Override
    public String describe() {
        return "OpenAI-compatible backend '" + config.id() + "': " + completionsUrl
                + (config.model().isEmpty() ? "" : " model=" + config.model())
                + (config.apiKey().isEmpty() ? "" : " (API key set)");
    }

    /** Reachable means the models endpoint answers at all; an auth error still proves the server is up. */
    @Override
    public boolean isAvailable() {
        if (completionsUrl.isEmpty()) return false;
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder()
                    .uri(URI.create(resolveModelsUrl(config.baseUrl())))
                    .timeout(PROBE_TIMEOUT)
                    .GET();
            addHeaders(rb);
            HttpResponse<Void> response = httpClient.send(rb.build(), HttpResponse.BodyHandlers.discarding());
            return response.statusCode() < 500;
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
        if (completionsUrl.isEmpty()) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "No base URL configured for " + config.id());
        }
        JsonObject body = new JsonObject();
        if (!config.model().isEmpty()) body.addProperty("model", config.model());
        JsonArray messages = new JsonArray();
        JsonObject msg = new JsonObject();
        msg.addProperty("role", "user");
        msg.addProperty("content", prompt);
        messages.add(msg);
        body.add("messages", messages);
        body.addProperty("stream", false);

        HttpRequest.Builder rb;
        try {
            rb = HttpRequest.newBuilder()
                    .uri(URI.create(completionsUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(body), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "Invalid base URL for " + config.id() + ": " + config.baseUrl(), e);
        }
        addHeaders(rb);

        String responseBody = HttpCalls.send(httpClient, rb.build(), config.id());
        return extractContent(responseBody);
    }

    /** Reads {@code choices[0].message.content}. */
    String extractContent(String responseBody) throws BackendException {
        try {
            JsonObject root = JsonParser.parseString(responseBody).getAsJsonObject();
            JsonArray choices = root.getAsJsonArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        config.id() + " response has no choices array");
            }
            JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
            if (message == null) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        config.id() + " response has no message in first choice");
            }
            return HttpCalls.getStr(message, "content");
        } catch (JsonSyntaxException | IllegalStateException | ClassCastException e) {
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
