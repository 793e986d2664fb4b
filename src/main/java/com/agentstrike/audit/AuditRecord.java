package com.agentstrike.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit entry. Prompts and responses are only ever stored as SHA-256 hashes.
 * Field order is the serialized order and therefore part of the hash input.
 */
public final class AuditRecord {

    private final String timestamp;
    private final AuditEventType type;
    private final String requestId;
    private final String backend;
    private final String promptHash;
    private final String responseHash;
    private final String outcome;
    private final Map<String, String> details;

    public AuditRecord(String timestamp, AuditEventType type, String requestId, String backend,
                       String promptHash, String responseHash, String outcome, Map<String, String> details) {
        this.timestamp = timestamp;
        this.type = type;
        this.requestId = requestId != null ? requestId : "";
        this.backend = backend != null ? backend : "";
        this.promptHash = promptHash != null ? promptHash : "";
        this.responseHash = responseHash != null ? responseHash : "";
        this.outcome = outcome != null ? outcome : "";
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public String getTimestamp() { return timestamp; }
    public AuditEventType getType() { return type; }
    public String getRequestId() { return requestId; }
    public String getBackend() { return backend; }
    public String getPromptHash() { return promptHash; }
    public String getResponseHash() { return responseHash; }
    public String getOutcome() { return outcome; }
    public Map<String, String> getDetails() { return Collections.unmodifiableMap(details); }

    @Override
    public String toString() {
        return "AuditRecord{" + type + " " + requestId + " " + backend + " " + outcome + "}";
    }
}
