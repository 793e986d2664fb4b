package com.agentstrike.backend;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one backend: which transport, where, and with what
 * defaults. CLI backends use {@code command}; HTTP backends use
 * {@code baseUrl}, {@code model}, {@code apiKey} and {@code headers}.
 */
public record BackendConfig(String id,
                            BackendKind kind,
                            List<String> command,
                            String baseUrl,
                            String model,
                            String apiKey,
                            Map<String, String> headers,
                            Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public BackendConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        command = command != null ? List.copyOf(command) : List.of();
        baseUrl = baseUrl != null ? baseUrl.trim() : "";
        model = model != null ? model : "";
        apiKey = apiKey != null ? apiKey : "";
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public static BackendConfig cli(String id, List<String> command) {
        return new BackendConfig(id, BackendKind.CLI, command, null, null, null, null, null);
    }

    public static BackendConfig cli(CliProvider provider, String binaryPath) {
        return cli(provider.getBackendId(), provider.buildCommand(binaryPath));
    }

    public static BackendConfig localHttp(String id, String baseUrl, String model) {
        return new BackendConfig(id, BackendKind.LOCAL_HTTP, null, baseUrl, model, null, null, null);
    }

    public static BackendConfig genericHttp(String id, String baseUrl, String model) {
        return new BackendConfig(id, BackendKind.GENERIC_HTTP, null, baseUrl, model, null, null, null);
    }

    public BackendConfig withApiKey(String key) {
        return new BackendConfig(id, kind, command, baseUrl, model, key, headers, timeout);
    }

    public BackendConfig withBaseUrl(String url) {
        return new BackendConfig(id, kind, command, url, model, apiKey, headers, timeout);
    }

    public BackendConfig withModel(String m) {
        return new BackendConfig(id, kind, command, baseUrl, m, apiKey, headers, timeout);
    }

    public BackendConfig withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new BackendConfig(id, kind, command, baseUrl, model, apiKey, copy, timeout);
    }

    public BackendConfig withTimeout(Duration t) {
        return new BackendConfig(id, kind, command, baseUrl, model, apiKey, headers, t);
    }

    /** Keeps the API key out of logs. */
    @Override
    public String toString() {
        return "BackendConfig{" + id + ", " + kind
                + (command.isEmpty() ? "" : ", command=" + command)
                + (baseUrl.isEmpty() ? "" : ", baseUrl=" + baseUrl)
                + (model.isEmpty() ? "" : ", model=" + model)
                + (apiKey.isEmpty() ? "" : ", apiKey=***")
                + "}";
    }
}
