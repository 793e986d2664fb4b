package com.agentstrike.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Vulnerability classes the AI scanners can report and probe for.
 * The tag (enum name) is the canonical label used in finding names,
 * e.g. "[AI Active] SQLI". {@link #OTHER} is the fallback for labels the
 * AI invents; it is never scanned for actively.
 */
public enum VulnClass {

    // Injection
    SQLI("SQL Injection", Severity.HIGH, true, "sql injection", "sqli", "sql", "blind sql injection"),
    NOSQLI("NoSQL Injection", Severity.HIGH, false, "nosql injection", "nosqli", "nosql", "mongodb injection"),
    XSS_REFLECTED("Reflected Cross-Site Scripting", Severity.MEDIUM, false,
            "reflected xss", "xss", "cross-site scripting", "cross site scripting"),
    XSS_STORED("Stored Cross-Site Scripting", Severity.HIGH, false, "stored xss", "persistent xss"),
    XSS_DOM("DOM-based Cross-Site Scripting", Severity.MEDIUM, false, "dom xss", "dom-based xss", "dom based xss"),
    SSTI("Server-Side Template Injection", Severity.HIGH, true, "ssti", "template injection"),
    CMDI("OS Command Injection", Severity.CRITICAL, true,
            "command injection", "cmdi", "os command injection", "rce", "remote code execution"),
    CODE_INJECTION("Code Injection", Severity.CRITICAL, false, "code injection", "eval injection"),
    LDAP_INJECTION("LDAP Injection", Severity.HIGH, false, "ldap injection", "ldapi"),
    XPATH_INJECTION("XPath Injection", Severity.HIGH, false, "xpath injection", "xpath"),
    XXE("XML External Entity Injection", Severity.HIGH, true, "xxe", "xml external entity"),
    SSRF("Server-Side Request Forgery", Severity.HIGH, true, "ssrf", "server-side request forgery", "server side request forgery"),
    PATH_TRAVERSAL("Path Traversal", Severity.HIGH, false, "path traversal", "directory traversal", "dot dot slash"),
    LFI("Local File Inclusion", Severity.HIGH, false, "lfi", "local file inclusion"),
    RFI("Remote File Inclusion", Severity.HIGH, true, "rfi", "remote file inclusion"),
    OPEN_REDIRECT("Open Redirect", Severity.LOW, false, "open redirect", "unvalidated redirect"),
    CRLF_INJECTION("CRLF Injection", Severity.MEDIUM, false, "crlf injection", "crlf", "response splitting"),
    HOST_HEADER_INJECTION("Host Header Injection", Severity.MEDIUM, true, "host header injection", "host header"),
    REQUEST_SMUGGLING("HTTP Request Smuggling", Severity.HIGH, false, "request smuggling", "http smuggling", "desync"),
    CACHE_POISONING("Web Cache Poisoning", Severity.HIGH, false, "cache poisoning", "web cache poisoning"),
    CACHE_DECEPTION("Web Cache Deception", Severity.MEDIUM, false, "cache deception", "web cache deception"),
    XML_INJECTION("XML Injection", Severity.MEDIUM, false, "xml injection"),
    EL_INJECTION("Expression Language Injection", Severity.HIGH, true, "expression language injection", "el injection", "ognl injection", "spel injection"),
    LOG_INJECTION("Log Injection", Severity.LOW, true, "log injection", "log4shell", "jndi injection"),
    CSV_INJECTION("CSV Injection", Severity.LOW, false, "csv injection", "formula injection"),
    HTML_INJECTION("HTML Injection", Severity.LOW, false, "html injection", "content injection"),
    CSS_INJECTION("CSS Injection", Severity.LOW, false, "css injection"),
    EMAIL_HEADER_INJECTION("Email Header Injection", Severity.MEDIUM, false, "email header injection", "smtp injection", "mail injection"),
    HPP("HTTP Parameter Pollution", Severity.LOW, false, "parameter pollution", "hpp"),
    PROTOTYPE_POLLUTION("Prototype Pollution", Severity.HIGH, false, "prototype pollution"),
    DESERIALIZATION("Insecure Deserialization", Severity.CRITICAL, true, "insecure deserialization", "deserialization", "deser"),
    GRAPHQL_INJECTION("GraphQL Injection", Severity.HIGH, false, "graphql injection"),

    // Access control and authentication
    IDOR("Insecure Direct Object Reference", Severity.HIGH, false, "idor", "insecure direct object reference"),
    BOLA("Broken Object Level Authorization", Severity.HIGH, false, "bola", "broken object level authorization"),
    BFLA("Broken Function Level Authorization", Severity.HIGH, false, "bfla", "broken function level authorization"),
    MASS_ASSIGNMENT("Mass Assignment", Severity.MEDIUM, false, "mass assignment", "autobinding"),
    AUTH_BYPASS("Authentication Bypass", Severity.CRITICAL, false, "authentication bypass", "auth bypass"),
    BROKEN_AUTH("Broken Authentication", Severity.HIGH, false, "broken authentication", "weak authentication"),
    PRIVILEGE_ESCALATION("Privilege Escalation", Severity.HIGH, false, "privilege escalation", "privesc"),
    SESSION_FIXATION("Session Fixation", Severity.MEDIUM, false, "session fixation"),
    JWT_WEAKNESS("JWT Weakness", Severity.HIGH, false, "jwt", "json web token", "alg none"),
    OAUTH_MISCONFIG("OAuth Misconfiguration", Severity.MEDIUM, false, "oauth", "openid"),
    CSRF("Cross-Site Request Forgery", Severity.MEDIUM, false, "csrf", "cross-site request forgery", "xsrf"),
    CORS_MISCONFIG("CORS Misconfiguration", Severity.MEDIUM, false, "cors", "cross-origin resource sharing"),
    CLICKJACKING("Clickjacking", Severity.LOW, false, "clickjacking", "ui redressing"),
    USER_ENUMERATION("User Enumeration", Severity.LOW, false, "user enumeration", "username enumeration", "account enumeration"),
    RATE_LIMIT_BYPASS("Missing Rate Limiting", Severity.LOW, false, "rate limit", "brute force"),
    VERB_TAMPERING("HTTP Verb Tampering", Severity.MEDIUM, false, "verb tampering", "method override", "http method tampering"),

    // Logic and concurrency
    RACE_CONDITION("Race Condition", Severity.MEDIUM, false, "race condition", "toctou"),
    BUSINESS_LOGIC("Business Logic Flaw", Severity.MEDIUM, false, "business logic", "logic flaw"),
    FILE_UPLOAD("Unrestricted File Upload", Severity.HIGH, false, "file upload", "unrestricted upload"),
    WEBSOCKET_HIJACKING("Cross-Site WebSocket Hijacking", Severity.MEDIUM, false, "websocket hijacking", "cswsh", "websocket"),
    GRAPHQL_INTROSPECTION("GraphQL Introspection Enabled", Severity.LOW, false, "graphql introspection", "graphql"),

    // Exposure and configuration
    INFO_DISCLOSURE("Information Disclosure", Severity.LOW, false, "information disclosure", "info disclosure", "information leak"),
    STACK_TRACE("Stack Trace Disclosure", Severity.LOW, false, "stack trace", "verbose error", "error message"),
    DIRECTORY_LISTING("Directory Listing", Severity.LOW, false, "directory listing", "directory indexing"),
    DEBUG_ENDPOINT("Exposed Debug Endpoint", Severity.MEDIUM, false, "debug endpoint", "debug mode", "actuator"),
    MISSING_SECURITY_HEADERS("Missing Security Headers", Severity.INFO, false, "security header", "missing header", "hsts", "csp"),
    INSECURE_COOKIE("Insecure Cookie Attributes", Severity.LOW, false, "insecure cookie", "cookie flag", "httponly", "samesite"),
    SECRET_EXPOSURE("Exposed Secret", Severity.HIGH, false, "secret", "api key", "hardcoded credential", "credentials", "token leak"),
    VERSION_DISCLOSURE("Software Version Disclosure", Severity.INFO, false, "version disclosure", "server banner"),
    SUBDOMAIN_TAKEOVER("Subdomain Takeover", Severity.HIGH, false, "subdomain takeover", "dangling dns"),

    OTHER("Other", Severity.INFO, false);

    private static final List<AliasEntry> ALIASES_LONGEST_FIRST = buildAliasIndex();

    private final String displayName;
    private final Severity defaultSeverity;
    private final boolean oobCapable;
    private final List<String> aliases;

    VulnClass(String displayName, Severity defaultSeverity, boolean oobCapable, String... aliases) {
        this.displayName = displayName;
        this.defaultSeverity = defaultSeverity;
        this.oobCapable = oobCapable;
        this.aliases = List.of(aliases);
    }

    public String tag() { return name(); }
    public String getDisplayName() { return displayName; }
    public Severity getDefaultSeverity() { return defaultSeverity; }
    public boolean isOobCapable() { return oobCapable; }
    public List<String> getAliases() { return aliases; }

    /** Every class except {@link #OTHER}. */
    public static Set<VulnClass> scannable() {
        return Collections.unmodifiableSet(EnumSet.complementOf(EnumSet.of(OTHER)));
    }

    /**
     * Normalizes a free-form label (tag, display name, alias or a sentence
     * containing an alias) to a class. Unknown labels map to {@link #OTHER}.
     */
    public static VulnClass fromLabel(String label) {
        if (label == null || label.isBlank()) return OTHER;
        String trimmed = label.trim();
        String asTag = trimmed.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_").replaceAll("^_+|_+$", "");
        for (VulnClass c : values()) {
            if (c.name().equals(asTag) || c.displayName.equalsIgnoreCase(trimmed)) {
                return c;
            }
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (AliasEntry entry : ALIASES_LONGEST_FIRST) {
            if (lower.equals(entry.alias)) return entry.vulnClass;
        }
        for (AliasEntry entry : ALIASES_LONGEST_FIRST) {
            if (containsWord(lower, entry.alias)) return entry.vulnClass;
        }
        return OTHER;
    }

    private static boolean containsWord(String text, String alias) {
        int idx = text.indexOf(alias);
        while (idx >= 0) {
            int end = idx + alias.length();
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(text.charAt(idx - 1));
            boolean endOk = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startOk && endOk) return true;
            idx = text.indexOf(alias, idx + 1);
        }
        return false;
    }

    private static List<AliasEntry> buildAliasIndex() {
        List<AliasEntry> entries = new ArrayList<>();
        for (VulnClass c : values()) {
            for (String alias : c.aliases) {
                entries.add(new AliasEntry(alias, c));
            }
        }
        entries.sort(Comparator.comparingInt((AliasEntry e) -> e.alias.length()).reversed());
        return Collections.unmodifiableList(entries);
    }

    /** Parses a comma separated list of labels, ignoring unknown entries. */
    public static Set<VulnClass> parseList(String commaSeparated) {
        Set<VulnClass> result = EnumSet.noneOf(VulnClass.class);
        if (commaSeparated == null || commaSeparated.isBlank()) return result;
        Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(VulnClass::fromLabel)
                .filter(c -> c != OTHER)
                .forEach(result::add);
        return result;
    }

    private record AliasEntry(String alias, VulnClass vulnClass) {}
}
