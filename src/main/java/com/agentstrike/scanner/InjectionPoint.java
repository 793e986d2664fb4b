package com.agentstrike.scanner;

import com.agentstrike.model.TrafficContext;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A place in a request where a payload can be injected.
 * For {@link InjectionType#PATH} the name is the zero-based segment index.
 */
public record InjectionPoint(String name, InjectionType type, String originalValue) {

    private static final Gson GSON = new Gson();

    public InjectionPoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        originalValue = originalValue != null ? originalValue : "";
    }

    /**
     * Returns a copy of {@code base} with this point's value replaced by {@code value}.
     * The response part of the copy is cleared and it gets a fresh request id.
     */
    public TrafficContext inject(TrafficContext base, String value) {
        TrafficContext.Builder b = base.toBuilder()
                .requestId(null)
                .statusCode(0)
                .responseHeaders(List.of())
                .responseBody("");
        switch (type) {
            case URL_PARAM -> b.url(replaceQueryParam(base.getUrl(), name, encode(value)));
            case BODY_PARAM -> b.requestBody(replaceFormParam(base.getRequestBody(), name, encode(value)));
            case JSON_PARAM -> b.requestBody(replaceJsonParam(base.getRequestBody(), name, value));
            case COOKIE -> b.requestHeaders(replaceCookie(base.getRequestHeaders(), name, value));
            case HEADER -> b.requestHeaders(replaceHeader(base.getRequestHeaders(), name, value));
            case PATH -> b.url(replacePathSegment(base.getUrl(), name, encode(value)));
        }
        return b.build();
    }

    @Override
    public String toString() {
        return type + ":" + name;
    }

    // ==================== Per-type replacement ====================

    private static String replaceQueryParam(String url, String param, String encoded) {
        int q = url.indexOf('?');
        int hash = url.indexOf('#');
        String fragment = hash >= 0 ? url.substring(hash) : "";
        String withoutFragment = hash >= 0 ? url.substring(0, hash) : url;
        if (q < 0 || (hash >= 0 && q > hash)) {
            return withoutFragment + "?" + param + "=" + encoded + fragment;
        }
        String base = withoutFragment.substring(0, q);
        String query = withoutFragment.substring(q + 1);
        return base + "?" + replaceFormParam(query, param, encoded) + fragment;
    }

    private static String replaceFormParam(String body, String param, String encoded) {
        String[] pairs = body.isEmpty() ? new String[0] : body.split("&", -1);
        StringBuilder sb = new StringBuilder();
        boolean replaced = false;
        for (String pair : pairs) {
            if (sb.length() > 0) sb.append('&');
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (!replaced && key.equals(param)) {
                sb.append(key).append('=').append(encoded);
                replaced = true;
            } else {
                sb.append(pair);
            }
        }
        if (!replaced) {
            if (sb.length() > 0) sb.append('&');
            sb.append(param).append('=').append(encoded);
        }
        return sb.toString();
    }

    private static String replaceJsonParam(String body, String param, String value) {
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject()) return body;
            JsonObject obj = root.getAsJsonObject();
            obj.addProperty(param, value);
            return GSON.toJson(obj);
        } catch (RuntimeException e) {
            return body;
        }
    }

    // Raw string replacement: a cookie parser would split payloads on ';'
    private static List<TrafficContext.Header> replaceCookie(List<TrafficContext.Header> headers,
                                                             String cookie, String value) {
        List<TrafficContext.Header> out = new ArrayList<>();
        boolean found = false;
        for (TrafficContext.Header h : headers) {
            if (!found && h.name().equalsIgnoreCase("Cookie")) {
                String current = h.value();
                Pattern p = Pattern.compile("(^|;\\s*)" + Pattern.quote(cookie) + "=[^;]*");
                String replaced = p.matcher(current).find()
                        ? p.matcher(current).replaceFirst("$1" + Matcher.quoteReplacement(cookie + "=" + value))
                        : current + "; " + cookie + "=" + value;
                out.add(new TrafficContext.Header(h.name(), replaced));
                found = true;
            } else {
                out.add(h);
            }
        }
        if (!found) out.add(new TrafficContext.Header("Cookie", cookie + "=" + value));
        return out;
    }

    private static List<TrafficContext.Header> replaceHeader(List<TrafficContext.Header> headers,
                                                             String header, String value) {
        List<TrafficContext.Header> out = new ArrayList<>();
        boolean found = false;
        for (TrafficContext.Header h : headers) {
            if (!found && h.name().equalsIgnoreCase(header)) {
                out.add(new TrafficContext.Header(h.name(), value));
                found = true;
            } else {
                out.add(h);
            }
        }
        if (!found) out.add(new TrafficContext.Header(header, value));
        return out;
    }

    private static String replacePathSegment(String url, String index, String encoded) {
        int schemeEnd = url.indexOf("://");
        int pathStart = url.indexOf('/', schemeEnd >= 0 ? schemeEnd + 3 : 0);
        if (pathStart < 0) return url;
        int end = url.length();
        for (char c : new char[]{'?', '#'}) {
            int i = url.indexOf(c, pathStart);
            if (i >= 0 && i < end) end = i;
        }
        String[] segments = url.substring(pathStart + 1, end).split("/", -1);
        int idx;
        try {
            idx = Integer.parseInt(index);
        } catch (NumberFormatException e) {
            return url;
        }
        if (idx < 0 || idx >= segments.length) return url;
        segments[idx] = encoded;
        return url.substring(0, pathStart + 1) + String.join("/", segments) + url.substring(end);
    }

    /**
     * Encodes only what breaks URL or form syntax (space, &amp;, #, +, ;, bare %).
     * Existing %XX sequences are kept so pre-encoded payloads are not double-encoded.
     */
    static String encode(String payload) {
        StringBuilder sb = new StringBuilder(payload.length() + 16);
        for (int i = 0; i < payload.length(); i++) {
            char c = payload.charAt(i);
            if (c == '%' && i + 2 < payload.length() && isHex(payload.charAt(i + 1)) && isHex(payload.charAt(i + 2))) {
                sb.append(payload, i, i + 3);
                i += 2;
                continue;
            }
            switch (c) {
                case ' ' -> sb.append("%20");
                case '&' -> sb.append("%26");
                case '#' -> sb.append("%23");
                case '+' -> sb.append("%2B");
                case ';' -> sb.append("%3B");
                case '%' -> sb.append("%25");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
