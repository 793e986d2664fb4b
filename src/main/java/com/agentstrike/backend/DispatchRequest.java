package com.agentstrike.backend;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * One AI call. Immutable and owned solely by the call that created it.
 */
public record DispatchRequest(String backendId, String prompt, Duration timeout, String requestId) {

    public DispatchRequest {
        Objects.requireNonNull(backendId, "backendId");
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(requestId, "requestId");
    }

    public static DispatchRequest of(String backendId, String prompt, Duration timeout) {
        return new DispatchRequest(backendId, prompt, timeout, UUID.randomUUID().toString());
    }
}
