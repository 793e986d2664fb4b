package com.agentstrike.framework;

import com.agentstrike.scanner.ScopePolicy;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * User-configured target scope. A URL is in scope when its host equals a
 * configured domain or is a subdomain of one. An empty scope matches nothing.
 */
public class ScopeManager implements ScopePolicy {

    // Volatile reference swap, readers never see a half-built set
    private volatile Set<String> targetDomains = Collections.emptySet();

    public void setTargetDomains(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            targetDomains = Collections.emptySet();
            return;
        }
        targetDomains = Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(ScopeManager::extractHost)
                .filter(h -> h != null && !h.isEmpty())
                .filter(ScopeManager::isValidScopeDomain)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Rejects bare TLDs ("com", "net") that would match too broadly.
     * IP literals are allowed.
     */
    private static boolean isValidScopeDomain(String domain) {
        if (domain.matches("\\d{1,3}(\\.\\d{1,3}){3}")) return true;
        if (domain.contains(":")) return true;
        return domain.contains(".") || domain.equals("localhost");
    }

    public Set<String> getTargetDomains() {
        return targetDomains;
    }

    @Override
    public boolean isInScope(String url) {
        return isHostInScope(extractHost(url));
    }

    public boolean isHostInScope(String host) {
        if (host == null || host.isEmpty()) return false;
        Set<String> domains = targetDomains;
        if (domains.isEmpty()) return false;
        String lowerHost = host.toLowerCase();
        for (String domain : domains) {
            if (lowerHost.equals(domain) || lowerHost.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Host part of a URL (or of a bare host[:port] string), lowercased.
     * Userinfo is stripped so {@code http://target.com@evil.com/} resolves to evil.com.
     */
    public static String extractHost(String url) {
        if (url == null) return null;
        String stripped = url.trim();
        if (stripped.contains("://")) {
            stripped = stripped.substring(stripped.indexOf("://") + 3);
        }
        int end = stripped.length();
        for (char c : new char[]{'/', '?', '#'}) {
            int idx = stripped.indexOf(c);
            if (idx >= 0 && idx < end) end = idx;
        }
        stripped = stripped.substring(0, end);
        int atSign = stripped.lastIndexOf('@');
        if (atSign >= 0) {
            stripped = stripped.substring(atSign + 1);
        }
        if (stripped.startsWith("[")) {
            int closeBracket = stripped.indexOf(']');
            if (closeBracket > 0) {
                return stripped.substring(1, closeBracket).toLowerCase();
            }
        }
        int colonIdx = stripped.lastIndexOf(':');
        if (colonIdx > 0 && stripped.substring(colonIdx + 1).matches("\\d*")) {
            stripped = stripped.substring(0, colonIdx);
        }
        return stripped.toLowerCase();
    }
}
