package com.agentstrike.scanner;

import com.agentstrike.model.VulnClass;

/**
 * One (injection point, payload, class) triple that survived planning.
 */
public record PlannedProbe(InjectionPoint point, Payload payload) {

    public VulnClass vulnClass() {
        return payload.vulnClass();
    }
}
