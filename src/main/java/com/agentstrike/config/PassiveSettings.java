package com.agentstrike.config;

/**
 * Passive scanner knobs. Values are clamped to sane ranges on construction.
 */
public record PassiveSettings(boolean enabled,
                              int rateLimitSeconds,
                              boolean scopeOnly,
                              int maxSizeKb,
                              boolean escalateToActive,
                              int minConfidence) {

    public PassiveSettings {
        rateLimitSeconds = Math.max(0, rateLimitSeconds);
        maxSizeKb = Math.max(1, maxSizeKb);
        minConfidence = Math.max(0, Math.min(100, minConfidence));
    }

    public static PassiveSettings defaults() {
        return new PassiveSettings(false, 10, true, 256, false, 50);
    }

    public PassiveSettings withEnabled(boolean v) {
        return new PassiveSettings(v, rateLimitSeconds, scopeOnly, maxSizeKb, escalateToActive, minConfidence);
    }

    public PassiveSettings withRateLimitSeconds(int v) {
        return new PassiveSettings(enabled, v, scopeOnly, maxSizeKb, escalateToActive, minConfidence);
    }

    public PassiveSettings withScopeOnly(boolean v) {
        return new PassiveSettings(enabled, rateLimitSeconds, v, maxSizeKb, escalateToActive, minConfidence);
    }

    public PassiveSettings withMaxSizeKb(int v) {
        return new PassiveSettings(enabled, rateLimitSeconds, scopeOnly, v, escalateToActive, minConfidence);
    }

    public PassiveSettings withEscalateToActive(boolean v) {
        return new PassiveSettings(enabled, rateLimitSeconds, scopeOnly, maxSizeKb, v, minConfidence);
    }

    public PassiveSettings withMinConfidence(int v) {
        return new PassiveSettings(enabled, rateLimitSeconds, scopeOnly, maxSizeKb, escalateToActive, v);
    }
}
