package com.agentstrike.config;

/**
 * Raised when configuration refers to something that does not exist
 * (a prompt template, an agent profile, a backend id).
 */
public class ConfigException extends RuntimeException {

    public enum Kind {
        MISSING_TEMPLATE,
        UNKNOWN_PROFILE,
        UNKNOWN_BACKEND
    }

    private final Kind kind;

    public ConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
