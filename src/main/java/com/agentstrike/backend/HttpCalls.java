package com.agentstrike.backend;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Shared send-and-map logic for the HTTP backends: HTTP status codes and
 * transport failures become typed {@link BackendException}s.
 */
final class HttpCalls {

    private HttpCalls() {}

    static String send(HttpClient client, HttpRequest request, String label) throws BackendException {
        try {
            HttpResponse<String> response = client.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status == 401 || status == 403) {
                throw new BackendException(BackendException.ErrorType.AUTH_ERROR,
                        label + " authentication failed (HTTP " + status + "): "
                                + Invocations.truncate(response.body(), 200));
            }
            if (status == 429 || status == 503) {
                throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                        label + " is busy (HTTP " + status + "): " + Invocations.truncate(response.body(), 200));
            }
            if (status < 200 || status >= 300) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        label + " returned HTTP " + status + ": " + Invocations.truncate(response.body(), 300));
            }
            return response.body();
        } catch (HttpTimeoutException e) {
            throw new BackendException(BackendException.ErrorType.TIMEOUT,
                    label + " request timed out", e);
        } catch (IOException e) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    label + " connection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.ErrorType.TIMEOUT,
                    label + " request interrupted", e);
        }
    }

    static String getStr(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return "";
        return el.isJsonPrimitive() ? el.getAsString() : el.toString();
    }

    static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }
}
