package com.agentstrike.backend;

/**
 * Uniform capability over heterogeneous AI providers.
 * Implementations must be thread-safe: the supervisor invokes them concurrently.
 */
public interface AiBackend {

    /** Registry id, unique among registered backends. */
    String id();

    BackendKind kind();

    /** One-line human readable description for diagnostics. Never contains secrets. */
    String describe();

    /** Cheap health probe. Must not throw. */
    boolean isAvailable();

    /**
     * Sends the prompt and returns the result. Backend failures are reported
     * through the result ({@link DispatchResult#getErrorKind()}), never thrown.
     * Must return within roughly {@code request.timeout()}.
     */
    DispatchResult invoke(DispatchRequest request);
}
