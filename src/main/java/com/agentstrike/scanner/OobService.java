package com.agentstrike.scanner;

/**
 * Out-of-band interaction service (e.g. Burp Collaborator).
 */
public interface OobService {

    /** A registered interaction token and the host to embed in payloads. */
    record Token(String id, String host) {}

    boolean isAvailable();

    /** Returns a fresh token, or null when no token can be issued. */
    Token register(String description);

    /** True once an interaction for the token has been observed. */
    boolean hasInteraction(String tokenId);

    /** Forgets a token that is no longer awaited. */
    void release(String tokenId);
}
