package com.agentstrike.model;

import burp.api.montoya.http.message.HttpRequestResponse;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable snapshot of an HTTP request/response pair plus free-form metadata.
 * Captures all data as plain Strings on the proxy thread so it is safe
 * to pass to background dispatch threads without touching Montoya objects.
 * The originating {@link HttpRequestResponse} is kept only so findings can be
 * attached to it when reported back to Burp.
 */
public final class TrafficContext {

    /** A single header line. Duplicates are allowed and order is preserved. */
    public record Header(String name, String value) {
        public Header {
            name = name != null ? name : "";
            value = value != null ? value : "";
        }

        @Override
        public String toString() { return name + ": " + value; }
    }

    private final String requestId;
    private final String url;
    private final String method;
    private final List<Header> requestHeaders;
    private final String requestBody;
    private final int statusCode;
    private final List<Header> responseHeaders;
    private final String responseBody;
    private final Map<String, String> metadata;
    private final HttpRequestResponse source;

    private TrafficContext(Builder b) {
        this.requestId = b.requestId != null ? b.requestId : UUID.randomUUID().toString();
        this.url = Objects.requireNonNull(b.url, "url is required");
        this.method = b.method != null ? b.method : "GET";
        this.requestHeaders = Collections.unmodifiableList(new ArrayList<>(b.requestHeaders));
        this.requestBody = b.requestBody != null ? b.requestBody : "";
        this.statusCode = b.statusCode;
        this.responseHeaders = Collections.unmodifiableList(new ArrayList<>(b.responseHeaders));
        this.responseBody = b.responseBody != null ? b.responseBody : "";
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.source = b.source;
    }

    /**
     * Creates a snapshot from a Montoya HttpRequestResponse.
     * Body strings are truncated to maxBodySize characters.
     */
    public static TrafficContext from(HttpRequestResponse reqRes, int maxBodySize) {
        var req = reqRes.request();
        var resp = reqRes.response();

        Builder b = builder(req.url()).method(req.method()).source(reqRes);
        for (var h : req.headers()) {
            b.requestHeader(h.name(), h.value());
        }
        b.requestBody(truncate(req.bodyToString(), maxBodySize));
        if (resp != null) {
            b.statusCode(resp.statusCode());
            for (var h : resp.headers()) {
                b.responseHeader(h.name(), h.value());
            }
            b.responseBody(truncate(resp.bodyToString(), maxBodySize));
        }
        return b.build();
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "\n[... truncated at " + max + " chars]" : s;
    }

    public String getRequestId() { return requestId; }
    public String getUrl() { return url; }
    public String getMethod() { return method; }
    public List<Header> getRequestHeaders() { return requestHeaders; }
    public String getRequestBody() { return requestBody; }
    public int getStatusCode() { return statusCode; }
    public List<Header> getResponseHeaders() { return responseHeaders; }
    public String getResponseBody() { return responseBody; }
    public Map<String, String> getMetadata() { return metadata; }
    public HttpRequestResponse getSource() { return source; }

    /** Lowercased host of the request URL, or empty when the URL cannot be parsed. */
    public String host() {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase() : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    public String requestHeader(String name) {
        for (Header h : requestHeaders) {
            if (h.name().equalsIgnoreCase(name)) return h.value();
        }
        return null;
    }

    public String responseHeader(String name) {
        for (Header h : responseHeaders) {
            if (h.name().equalsIgnoreCase(name)) return h.value();
        }
        return null;
    }

    /** Approximate wire size of both bodies in bytes. */
    public long sizeBytes() {
        return requestBody.getBytes(StandardCharsets.UTF_8).length
                + (long) responseBody.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Builds a compact text representation for including in a prompt.
     */
    public String toPromptText() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== REQUEST ===\n");
        sb.append(method).append(" ").append(url).append("\n");
        for (Header h : requestHeaders) {
            // Skip large or binary-looking headers
            if (h.value().length() < 500) sb.append(h).append("\n");
        }
        if (!requestBody.isEmpty()) {
            sb.append("\n").append(requestBody).append("\n");
        }

        if (statusCode > 0 || !responseHeaders.isEmpty() || !responseBody.isEmpty()) {
            sb.append("\n=== RESPONSE (").append(statusCode).append(") ===\n");
            for (Header h : responseHeaders) {
                if (h.value().length() < 500) sb.append(h).append("\n");
            }
            if (!responseBody.isEmpty()) {
                sb.append("\n").append(responseBody).append("\n");
            }
        }
        return sb.toString();
    }

    public Builder toBuilder() {
        Builder b = new Builder(url);
        b.requestId = requestId;
        b.method = method;
        b.requestHeaders.addAll(requestHeaders);
        b.requestBody = requestBody;
        b.statusCode = statusCode;
        b.responseHeaders.addAll(responseHeaders);
        b.responseBody = responseBody;
        b.metadata.putAll(metadata);
        b.source = source;
        return b;
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public static class Builder {
        private String requestId;
        private String url;
        private String method;
        private final List<Header> requestHeaders = new ArrayList<>();
        private String requestBody;
        private int statusCode;
        private final List<Header> responseHeaders = new ArrayList<>();
        private String responseBody;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private HttpRequestResponse source;

        private Builder(String url) {
            this.url = url;
        }

        public Builder requestId(String id) { this.requestId = id; return this; }
        public Builder url(String u) { this.url = u; return this; }
        public Builder method(String m) { this.method = m; return this; }
        public Builder requestHeader(String name, String value) { requestHeaders.add(new Header(name, value)); return this; }
        public Builder requestHeaders(List<Header> headers) { requestHeaders.clear(); requestHeaders.addAll(headers); return this; }
        public Builder requestBody(String body) { this.requestBody = body; return this; }
        public Builder statusCode(int code) { this.statusCode = code; return this; }
        public Builder responseHeader(String name, String value) { responseHeaders.add(new Header(name, value)); return this; }
        public Builder responseHeaders(List<Header> headers) { responseHeaders.clear(); responseHeaders.addAll(headers); return this; }
        public Builder responseBody(String body) { this.responseBody = body; return this; }
        public Builder metadata(String key, String value) { metadata.put(key, value != null ? value : ""); return this; }
        public Builder metadata(Map<String, String> values) { metadata.clear(); metadata.putAll(values); return this; }
        public Builder source(HttpRequestResponse rr) { this.source = rr; return this; }

        public TrafficContext build() {
            return new TrafficContext(this);
        }
    }
}
