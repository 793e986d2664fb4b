package com.agentstrike.scanner;

/**
 * Lifecycle of a {@link ScanJob}:
 * CREATED → EXPANDING → DISPATCHING → COLLECTING → COMPLETED, or CANCELLED from any non-terminal state.
 */
public enum ScanJobState {
    CREATED,
    EXPANDING,
    DISPATCHING,
    COLLECTING,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
