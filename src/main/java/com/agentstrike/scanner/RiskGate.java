package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;

/**
 * Pure risk predicate applied while expanding a scan and again right before dispatch.
 */
public final class RiskGate {

    private RiskGate() {}

    public static boolean permits(Payload payload, PayloadRisk ceiling) {
        return !payload.risk().exceeds(ceiling);
    }

    public static void check(Payload payload, PayloadRisk ceiling) throws PolicyViolationException {
        if (!permits(payload, ceiling)) {
            throw new PolicyViolationException(PolicyViolationException.Kind.RISK_EXCEEDED,
                    payload.vulnClass().tag() + " payload is " + payload.risk() + ", ceiling is " + ceiling);
        }
    }
}
