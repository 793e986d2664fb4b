package com.agentstrike.scanner;

import com.agentstrike.model.TrafficContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the injection points of a request: query and form parameters,
 * top-level JSON fields, cookies, a few routing headers and path segments.
 */
public final class InjectionPoints {

    /** Headers worth probing even when the client did not send them. */
    private static final List<String> PROBED_HEADERS = List.of("User-Agent", "Referer", "X-Forwarded-For", "X-Forwarded-Host");

    private InjectionPoints() {}

    public static List<InjectionPoint> extract(TrafficContext ctx) {
        Set<InjectionPoint> points = new LinkedHashSet<>();

        String url = ctx.getUrl();
        int q = url.indexOf('?');
        if (q >= 0) {
            int hash = url.indexOf('#', q);
            String query = hash >= 0 ? url.substring(q + 1, hash) : url.substring(q + 1);
            addPairs(points, query, InjectionType.URL_PARAM);
        }

        String contentType = ctx.requestHeader("Content-Type");
        String ct = contentType != null ? contentType.toLowerCase(Locale.ROOT) : "";
        String body = ctx.getRequestBody();
        if (!body.isEmpty()) {
            if (ct.contains("json") || (ct.isEmpty() && body.trim().startsWith("{"))) {
                addJsonFields(points, body);
            } else if (ct.contains("x-www-form-urlencoded") || (ct.isEmpty() && body.contains("="))) {
                addPairs(points, body, InjectionType.BODY_PARAM);
            }
        }

        String cookie = ctx.requestHeader("Cookie");
        if (cookie != null) {
            for (String part : cookie.split(";")) {
                int eq = part.indexOf('=');
                if (eq > 0) {
                    points.add(new InjectionPoint(part.substring(0, eq).trim(), InjectionType.COOKIE,
                            part.substring(eq + 1).trim()));
                }
            }
        }

        for (String header : PROBED_HEADERS) {
            String v = ctx.requestHeader(header);
            points.add(new InjectionPoint(header, InjectionType.HEADER, v != null ? v : ""));
        }

        List<String> segments = pathSegments(url);
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).isEmpty()) {
                points.add(new InjectionPoint(String.valueOf(i), InjectionType.PATH, segments.get(i)));
            }
        }
        return new ArrayList<>(points);
    }

    private static void addPairs(Set<InjectionPoint> points, String encoded, InjectionType type) {
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            if (!name.isEmpty()) points.add(new InjectionPoint(name, type, decode(value)));
        }
    }

    private static void addJsonFields(Set<InjectionPoint> points, String body) {
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) return;
            JsonObject obj = root.getAsJsonObject();
            for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                if (e.getValue().isJsonPrimitive()) {
                    points.add(new InjectionPoint(e.getKey(), InjectionType.JSON_PARAM, e.getValue().getAsString()));
                }
            }
        } catch (RuntimeException e) {
            // Not JSON after all; the body simply has no JSON injection points
            return;
        }
    }

    private static List<String> pathSegments(String url) {
        int schemeEnd = url.indexOf("://");
        int pathStart = url.indexOf('/', schemeEnd >= 0 ? schemeEnd + 3 : 0);
        if (pathStart < 0) return List.of();
        int end = url.length();
        for (char c : new char[]{'?', '#'}) {
            int i = url.indexOf(c, pathStart);
            if (i >= 0 && i < end) end = i;
        }
        String path = url.substring(pathStart + 1, end);
        return path.isEmpty() ? List.of() : List.of(path.split("/", -1));
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
