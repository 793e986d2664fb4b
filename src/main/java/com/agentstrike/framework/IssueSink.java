package com.agentstrike.framework;

import com.agentstrike.model.Finding;

/**
 * Destination for consolidated findings (Burp's Site Map in production).
 */
@FunctionalInterface
public interface IssueSink {
    void reportIssue(Finding finding);
}
