package com.agentstrike.backend;

import java.time.Duration;

/**
 * Outcome of a single backend invocation. A failed result may still carry
 * partial text (e.g. output captured from a CLI before it timed out).
 */
public final class DispatchResult {

    private final String requestId;
    private final String backendId;
    private final String rawText;
    private final Duration latency;
    private final boolean success;
    private final BackendException.ErrorType errorKind;
    private final String errorMessage;

    private DispatchResult(String requestId, String backendId, String rawText, Duration latency,
                           boolean success, BackendException.ErrorType errorKind, String errorMessage) {
        this.requestId = requestId;
        this.backendId = backendId;
        this.rawText = rawText != null ? rawText : "";
        this.latency = latency != null ? latency : Duration.ZERO;
        this.success = success;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage != null ? errorMessage : "";
    }

    public static DispatchResult success(DispatchRequest request, String rawText, Duration latency) {
        return new DispatchResult(request.requestId(), request.backendId(), rawText, latency, true, null, null);
    }

    public static DispatchResult failure(DispatchRequest request, BackendException e, Duration latency) {
        return new DispatchResult(request.requestId(), request.backendId(), e.getPartialOutput(), latency,
                false, e.getErrorType(), e.getMessage());
    }

    public static DispatchResult failure(String requestId, String backendId, BackendException.ErrorType kind,
                                         String message) {
        return new DispatchResult(requestId, backendId, "", Duration.ZERO, false, kind, message);
    }

    public String getRequestId() { return requestId; }
    public String getBackendId() { return backendId; }
    public String getRawText() { return rawText; }
    public Duration getLatency() { return latency; }
    public boolean isSuccess() { return success; }
    public BackendException.ErrorType getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }

    public String outcome() {
        return success ? "SUCCESS" : String.valueOf(errorKind);
    }

    @Override
    public String toString() {
        return "DispatchResult{" + requestId + " via " + backendId + ": " + outcome()
                + " in " + latency.toMillis() + "ms}";
    }
}
