package com.agentstrike.scanner;

/**
 * Decides whether a URL may be scanned. Pure: no I/O, no side effects.
 */
@FunctionalInterface
public interface ScopePolicy {

    boolean isInScope(String url);

    ScopePolicy ALLOW_ALL = url -> true;
}
