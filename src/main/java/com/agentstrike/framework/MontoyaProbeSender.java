package com.agentstrike.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.HttpService;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.http.message.requests.HttpRequest;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.scanner.ProbeSender;

import java.io.IOException;
import java.net.URI;

/**
 * Sends probe requests through Burp's HTTP stack so they honour upstream proxy,
 * session handling and TLS settings, and show up in Logger.
 */
public class MontoyaProbeSender implements ProbeSender {

    private final MontoyaApi api;
    private final int maxBodySize;

    public MontoyaProbeSender(MontoyaApi api, int maxBodySize) {
        this.api = api;
        this.maxBodySize = maxBodySize;
    }

    @Override
    public TrafficContext send(TrafficContext probe) throws IOException {
        HttpRequest request;
        try {
            request = toHttpRequest(probe);
        } catch (IllegalArgumentException e) {
            throw new IOException("Cannot build request for " + probe.getUrl() + ": " + e.getMessage(), e);
        }

        HttpRequestResponse result;
        try {
            result = api.http().sendRequest(request);
        } catch (RuntimeException e) {
            throw new IOException("Burp failed to send probe: " + e.getMessage(), e);
        }
        if (result == null || result.response() == null) {
            throw new IOException("No response from " + probe.getUrl());
        }

        return TrafficContext.from(result, maxBodySize).toBuilder()
                .requestId(probe.getRequestId())
                .metadata(probe.getMetadata())
                .build();
    }

    static HttpRequest toHttpRequest(TrafficContext probe) {
        URI uri = URI.create(probe.getUrl());
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) path += "?" + uri.getRawQuery();

        StringBuilder raw = new StringBuilder();
        raw.append(probe.getMethod()).append(' ').append(path).append(" HTTP/1.1\r\n");
        boolean hasHost = false;
        for (TrafficContext.Header h : probe.getRequestHeaders()) {
            if (h.name().equalsIgnoreCase("Content-Length")) continue;
            if (h.name().equalsIgnoreCase("Host")) hasHost = true;
            raw.append(h.name()).append(": ").append(h.value()).append("\r\n");
        }
        if (!hasHost) raw.append("Host: ").append(uri.getRawAuthority()).append("\r\n");
        raw.append("\r\n");

        HttpRequest request = HttpRequest.httpRequest(HttpService.httpService(probe.getUrl()), raw.toString());
        // withBody recomputes Content-Length
        return probe.getRequestBody().isEmpty() ? request : request.withBody(probe.getRequestBody());
    }
}
