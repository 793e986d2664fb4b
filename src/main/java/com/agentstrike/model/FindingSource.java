package com.agentstrike.model;

/**
 * Which engine produced a finding. The label prefixes the reported issue name.
 */
public enum FindingSource {

    PASSIVE("[AI Passive]"),
    ACTIVE("[AI Active]"),
    AGENT("[AI Agent]");

    private final String label;

    FindingSource(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public String issueName(VulnClass vulnClass) {
        return label + " " + vulnClass.tag();
    }
}
