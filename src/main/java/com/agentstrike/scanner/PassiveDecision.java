package com.agentstrike.scanner;

/**
 * What the passive scanner did with one traffic event.
 */
public enum PassiveDecision {
    DISABLED,
    OUT_OF_SCOPE,
    OVERSIZED,
    STATIC_RESOURCE,
    RATE_LIMITED,
    /** Accepted by the filters but the triage queue was full. */
    QUEUE_FULL,
    SUBMITTED;

    public boolean isSubmitted() {
        return this == SUBMITTED;
    }
}
