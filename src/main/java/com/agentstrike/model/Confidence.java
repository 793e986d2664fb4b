package com.agentstrike.model;

public enum Confidence {
    TENTATIVE,
    FIRM,
    CERTAIN;

    /**
     * Map to Burp's AuditIssueConfidence name for native issue reporting.
     */
    public String toBurpConfidence() {
        return switch (this) {
            case TENTATIVE -> "TENTATIVE";
            case FIRM -> "FIRM";
            case CERTAIN -> "CERTAIN";
        };
    }

    /** Buckets a 0-100 score reported by the AI. */
    public static Confidence fromScore(int score) {
        if (score >= 90) return CERTAIN;
        if (score >= 60) return FIRM;
        return TENTATIVE;
    }
}
