package com.agentstrike.privacy;

import com.agentstrike.audit.Hashing;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.model.TrafficContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts sensitive data from traffic and prompt text before anything leaves
 * the process. Pure and deterministic: the same input, mode and salt always
 * produce the same output.
 */
public final class PrivacyFilter {

    public static final String REDACTED = "[REDACTED]";
    public static final String STRIPPED = "[STRIPPED]";
    private static final String PSEUDONYM_SUFFIX = ".redacted";

    private static final Set<String> STRIPPED_HEADERS = Set.of("cookie", "set-cookie");
    private static final Set<String> REDACTED_HEADERS = Set.of(
            "authorization", "proxy-authorization", "x-api-key", "api-key", "x-auth-token",
            "x-access-token", "x-amz-security-token", "x-csrf-token", "x-xsrf-token");

    private record Redaction(Pattern pattern, String replacement) {}

    // ==================== Secret patterns ====================

    private static final List<Redaction> SECRET_REDACTIONS = List.of(
            // Raw header lines inside free text (rendered prompts)
            new Redaction(Pattern.compile("(?im)^((?:set-)?cookie)[ \\t]*:.*$"), "$1: " + STRIPPED),
            new Redaction(Pattern.compile("(?im)^((?:proxy-)?authorization|x-api-key|api-key|x-auth-token|x-access-token)[ \\t]*:.*$"),
                    "$1: " + REDACTED),
            // Private key blocks
            new Redaction(Pattern.compile("-----BEGIN[A-Z ]*PRIVATE KEY-----[\\s\\S]*?-----END[A-Z ]*PRIVATE KEY-----"),
                    REDACTED),
            new Redaction(Pattern.compile("-----BEGIN[A-Z ]*PRIVATE KEY-----"), REDACTED),
            // Bearer / Basic credentials wherever they appear
            new Redaction(Pattern.compile("(?i)\\b(bearer|basic)\\s+[A-Za-z0-9._~+/=-]{8,}"), "$1 " + REDACTED),
            // JWT
            new Redaction(Pattern.compile("\\beyJ[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]*"), REDACTED),
            // AWS
            new Redaction(Pattern.compile("\\b(?:AKIA|ASIA)[A-Z0-9]{16}\\b"), REDACTED),
            // OpenAI / Anthropic style
            new Redaction(Pattern.compile("\\bsk-[A-Za-z0-9_-]{16,}"), REDACTED),
            // Stripe
            new Redaction(Pattern.compile("\\b(?:sk|rk)_live_[0-9a-zA-Z]{16,}"), REDACTED),
            // GitHub
            new Redaction(Pattern.compile("\\bgh[pousr]_[A-Za-z0-9_]{20,}"), REDACTED),
            // Google
            new Redaction(Pattern.compile("\\bAIza[0-9A-Za-z_-]{35}"), REDACTED),
            // Slack
            new Redaction(Pattern.compile("\\bxox[baprs]-[0-9a-zA-Z-]{10,}"), REDACTED),
            // Secret-looking key=value / "key": "value" pairs
            new Redaction(Pattern.compile("(?i)([\"']?\\b(?:password|passwd|pwd|passphrase|secret|client_secret|token"
                    + "|access_token|refresh_token|id_token|api[_-]?key|apikey|auth|session(?:id)?|sid)\\b[\"']?"
                    + "\\s*[:=]\\s*[\"']?)([^&\\s\"',;}<]+)"), "$1" + REDACTED)
    );

    private static final Pattern URL_HOST = Pattern.compile("(?i)\\b((?:https?|wss?|ftp)://)([^/\\s:?#\"'<>@]+@)?([^/\\s:?#\"'<>]+)");

    private final PrivacyMode mode;
    private final String salt;
    private final Set<String> redactionHosts;

    public PrivacyFilter(PrivacyMode mode, String salt, Collection<String> redactionHosts) {
        this.mode = mode != null ? mode : PrivacyMode.BALANCED;
        this.salt = salt != null ? salt : "";
        Set<String> hosts = new LinkedHashSet<>();
        if (redactionHosts != null) {
            for (String h : redactionHosts) {
                if (h != null && !h.isBlank()) hosts.add(h.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.redactionHosts = Set.copyOf(hosts);
    }

    public static PrivacyFilter from(AgentSettings settings) {
        return new PrivacyFilter(settings.getPrivacyMode(), settings.getHostSalt(), settings.getRedactionHosts());
    }

    public PrivacyMode getMode() { return mode; }

    /**
     * Returns a redacted copy of the context: URL, both header lists, both bodies
     * and metadata values. The Burp message reference is kept for issue reporting
     * only and is never rendered into a prompt.
     */
    public TrafficContext apply(TrafficContext ctx) {
        if (ctx == null) return null;
        if (mode == PrivacyMode.OFF) return ctx;

        Set<String> hosts = hostsFor(ctx.host());
        TrafficContext.Builder b = ctx.toBuilder()
                .url(redact(ctx.getUrl(), hosts))
                .requestHeaders(redactHeaders(ctx.getRequestHeaders(), hosts))
                .requestBody(redact(ctx.getRequestBody(), hosts))
                .responseHeaders(redactHeaders(ctx.getResponseHeaders(), hosts))
                .responseBody(redact(ctx.getResponseBody(), hosts));

        Map<String, String> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.getMetadata().entrySet()) {
            metadata.put(e.getKey(), redact(e.getValue(), hosts));
        }
        return b.metadata(metadata).build();
    }

    /** Final pass over free text, e.g. a rendered prompt. */
    public String redactText(String text) {
        return redactText(text, Set.of());
    }

    /**
     * @param extraHosts hosts to anonymize in addition to the configured redaction set (STRICT only)
     */
    public String redactText(String text, Collection<String> extraHosts) {
        if (text == null) return "";
        if (mode == PrivacyMode.OFF) return text;
        Set<String> hosts = new LinkedHashSet<>(redactionHosts);
        if (extraHosts != null) {
            for (String h : extraHosts) {
                if (h != null && !h.isBlank()) hosts.add(h.toLowerCase(Locale.ROOT));
            }
        }
        return redact(text, hosts);
    }

    /** Stable pseudonym {@code host-<8 hex>.redacted} for a hostname. */
    public String pseudonym(String host) {
        String digest = Hashing.sha256Hex(salt + host.toLowerCase(Locale.ROOT));
        return "host-" + digest.substring(0, 8) + PSEUDONYM_SUFFIX;
    }

    // ==================== Internals ====================

    private Set<String> hostsFor(String contextHost) {
        Set<String> hosts = new LinkedHashSet<>(redactionHosts);
        if (contextHost != null && !contextHost.isEmpty()) hosts.add(contextHost);
        return hosts;
    }

    private List<TrafficContext.Header> redactHeaders(List<TrafficContext.Header> headers, Set<String> hosts) {
        List<TrafficContext.Header> out = new ArrayList<>(headers.size());
        for (TrafficContext.Header h : headers) {
            String name = h.name().toLowerCase(Locale.ROOT);
            if (STRIPPED_HEADERS.contains(name)) {
                out.add(new TrafficContext.Header(h.name(), STRIPPED));
            } else if (REDACTED_HEADERS.contains(name)) {
                out.add(new TrafficContext.Header(h.name(), REDACTED));
            } else {
                out.add(new TrafficContext.Header(h.name(), redact(h.value(), hosts)));
            }
        }
        return out;
    }

    private String redact(String text, Set<String> hosts) {
        if (text == null || text.isEmpty()) return "";
        String out = text;
        for (Redaction r : SECRET_REDACTIONS) {
            out = r.pattern().matcher(out).replaceAll(r.replacement());
        }
        if (mode == PrivacyMode.STRICT) {
            out = anonymizeHosts(out, hosts);
        }
        return out;
    }

    private String anonymizeHosts(String text, Set<String> knownHosts) {
        Set<String> hosts = new LinkedHashSet<>(knownHosts);
        Matcher m = URL_HOST.matcher(text);
        while (m.find()) {
            hosts.add(m.group(3).toLowerCase(Locale.ROOT));
        }
        List<String> ordered = new ArrayList<>();
        for (String h : hosts) {
            if (!h.endsWith(PSEUDONYM_SUFFIX)) ordered.add(h);
        }
        // Longest first so "api.example.com" is replaced before "example.com"
        ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        String out = text;
        for (String host : ordered) {
            Pattern p = Pattern.compile("(?i)(?<![A-Za-z0-9-])" + Pattern.quote(host) + "(?![A-Za-z0-9-])");
            out = p.matcher(out).replaceAll(Matcher.quoteReplacement(pseudonym(host)));
        }
        return out;
    }
}
