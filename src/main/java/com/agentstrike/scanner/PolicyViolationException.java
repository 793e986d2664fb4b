package com.agentstrike.scanner;

/**
 * A unit of work was refused by policy. Abandons that unit only; scanning continues.
 */
public class PolicyViolationException extends Exception {

    public enum Kind {
        OUT_OF_SCOPE,
        RISK_EXCEEDED,
        OVERSIZED_PAYLOAD
    }

    private final Kind kind;

    public PolicyViolationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
