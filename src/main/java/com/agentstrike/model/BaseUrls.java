package com.agentstrike.model;

import java.net.URI;
import java.util.Locale;

/**
 * Canonical "base URL" used as the deduplication key for findings.
 * <p>
 * Rules: scheme and host are lowercased, default ports (80 for http, 443 for https)
 * are dropped, query and fragment are dropped, a trailing slash is dropped unless the
 * path is the root, and path case is preserved.
 */
public final class BaseUrls {

    private BaseUrls() {}

    public static String canonical(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return fallback(url);
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            StringBuilder sb = new StringBuilder();
            sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
            int port = uri.getPort();
            if (port > 0 && !isDefaultPort(scheme, port)) {
                sb.append(':').append(port);
            }
            String path = uri.getRawPath();
            if (path == null || path.isEmpty()) {
                path = "/";
            }
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            sb.append(path);
            return sb.toString();
        } catch (IllegalArgumentException e) {
            return fallback(url);
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    /** Same treatment for strings URI refuses: strip query/fragment, lowercase. */
    private static String fallback(String url) {
        String s = url.trim();
        int qIdx = s.indexOf('?');
        if (qIdx > 0) s = s.substring(0, qIdx);
        int fIdx = s.indexOf('#');
        if (fIdx > 0) s = s.substring(0, fIdx);
        return s.toLowerCase(Locale.ROOT);
    }
}
