package com.agentstrike.agent;

import java.time.Duration;

/**
 * Per-call overrides. Null fields fall back to the settings snapshot.
 */
public record DispatchOptions(String backendId, Duration timeout) {

    public static final DispatchOptions DEFAULT = new DispatchOptions(null, null);

    public static DispatchOptions backend(String backendId) {
        return new DispatchOptions(backendId, null);
    }

    public static DispatchOptions timeout(Duration timeout) {
        return new DispatchOptions(null, timeout);
    }
}
