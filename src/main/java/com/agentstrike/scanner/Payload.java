package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.VulnClass;

import java.util.Objects;

/**
 * One probe value for a vulnerability class. Values containing {@link #OOB_PLACEHOLDER}
 * need an out-of-band token substituted before they are sent.
 */
public record Payload(VulnClass vulnClass, String value, PayloadRisk risk, boolean oob) {

    public static final String OOB_PLACEHOLDER = "{OOB}";

    public Payload {
        Objects.requireNonNull(vulnClass, "vulnClass");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(risk, "risk");
    }

    public static Payload of(VulnClass vulnClass, String value, PayloadRisk risk) {
        return new Payload(vulnClass, value, risk, value.contains(OOB_PLACEHOLDER));
    }

    /** Substitutes the out-of-band host for the placeholder. */
    public String withOobHost(String host) {
        return value.replace(OOB_PLACEHOLDER, host);
    }
}
