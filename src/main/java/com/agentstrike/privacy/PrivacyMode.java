package com.agentstrike.privacy;

/**
 * How much of the captured traffic may leave the process in a prompt.
 */
public enum PrivacyMode {

    /** Secrets redacted and hostnames replaced by stable pseudonyms. */
    STRICT,
    /** Secrets, cookies and auth headers redacted. */
    BALANCED,
    /** Nothing redacted. */
    OFF;

    public static PrivacyMode fromString(String value, PrivacyMode fallback) {
        if (value == null || value.isBlank()) return fallback;
        for (PrivacyMode m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) return m;
        }
        return fallback;
    }
}
