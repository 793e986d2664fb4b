package com.agentstrike.backend;

import java.time.Duration;

/**
 * Converts a throwing backend call into a {@link DispatchResult} with latency.
 */
final class Invocations {

    interface Call {
        String run() throws BackendException;
    }

    private Invocations() {}

    static DispatchResult timed(DispatchRequest request, Call call) {
        long start = System.nanoTime();
        try {
            String text = call.run();
            return DispatchResult.success(request, text, Duration.ofNanos(System.nanoTime() - start));
        } catch (BackendException e) {
            return DispatchResult.failure(request, e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
