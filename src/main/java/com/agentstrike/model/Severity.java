package com.agentstrike.model;

public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Map to Burp's AuditIssueSeverity name for native issue reporting.
     * Burp has no CRITICAL, so it maps to HIGH.
     */
    public String toBurpSeverity() {
        return switch (this) {
            case INFO -> "INFORMATION";
            case LOW -> "LOW";
            case MEDIUM -> "MEDIUM";
            case HIGH, CRITICAL -> "HIGH";
        };
    }

    public boolean isHigherThan(Severity other) {
        return this.ordinal() > other.ordinal();
    }

    /** Lenient parse of AI-supplied severity labels. Unknown values map to the fallback. */
    public static Severity fromString(String s, Severity fallback) {
        if (s == null || s.isBlank()) return fallback;
        return switch (s.trim().toUpperCase()) {
            case "CRITICAL" -> CRITICAL;
            case "HIGH" -> HIGH;
            case "MEDIUM", "MODERATE" -> MEDIUM;
            case "LOW" -> LOW;
            case "INFO", "INFORMATION", "INFORMATIONAL" -> INFO;
            default -> fallback;
        };
    }
}
