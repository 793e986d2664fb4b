package com.agentstrike.model;

/**
 * How aggressive a payload is. Ordered: a payload is permitted only when its
 * risk is at or below the configured ceiling.
 */
public enum PayloadRisk {

    SAFE("Safe"),             // read-only probes: markers, math expressions, quotes
    MODERATE("Moderate"),     // may trigger errors or touch internal resources
    DANGEROUS("Dangerous");   // may change server state or execute commands

    private final String displayName;

    PayloadRisk(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }

    public boolean exceeds(PayloadRisk ceiling) {
        return this.ordinal() > ceiling.ordinal();
    }

    public static PayloadRisk lowerOf(PayloadRisk a, PayloadRisk b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }

    public static PayloadRisk fromString(String value, PayloadRisk fallback) {
        if (value == null || value.isBlank()) return fallback;
        for (PayloadRisk r : values()) {
            if (r.name().equalsIgnoreCase(value.trim()) || r.displayName.equalsIgnoreCase(value.trim())) {
                return r;
            }
        }
        return fallback;
    }

    @Override
    public String toString() { return displayName; }
}
