package com.agentstrike.audit;

public enum AuditEventType {
    DISPATCH_START,
    DISPATCH_END,
    FINDING_CREATED,
    SCANNER_STATE,
    POLICY_SKIP
}
