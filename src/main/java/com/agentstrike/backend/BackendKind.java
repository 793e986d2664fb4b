package com.agentstrike.backend;

/**
 * Transport families a backend can use. Selected by configuration, never by
 * inspecting the runtime type of a backend.
 */
public enum BackendKind {

    CLI("CLI Tool"),                        // local AI CLI, prompt piped via stdin
    LOCAL_HTTP("Local HTTP"),               // local inference server (Ollama-style API)
    GENERIC_HTTP("OpenAI-compatible HTTP"); // any /chat/completions endpoint

    private final String displayName;

    BackendKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    public static BackendKind fromString(String value, BackendKind fallback) {
        if (value == null || value.isBlank()) return fallback;
        String v = value.trim().replace('-', '_');
        for (BackendKind k : values()) {
            if (k.name().equalsIgnoreCase(v)) return k;
        }
        return fallback;
    }

    @Override
    public String toString() { return displayName; }
}
