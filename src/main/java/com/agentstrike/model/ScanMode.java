package com.agentstrike.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Preset bundles of vulnerability classes and risk ceiling for active scanning.
 * All modes share the same job state machine; they differ only in what gets expanded.
 */
public enum ScanMode {

    BUG_BOUNTY("Bug Bounty", PayloadRisk.SAFE, EnumSet.of(
            VulnClass.SQLI, VulnClass.XSS_REFLECTED, VulnClass.XSS_DOM, VulnClass.SSTI,
            VulnClass.SSRF, VulnClass.OPEN_REDIRECT, VulnClass.PATH_TRAVERSAL, VulnClass.LFI,
            VulnClass.CRLF_INJECTION, VulnClass.HOST_HEADER_INJECTION, VulnClass.CORS_MISCONFIG,
            VulnClass.IDOR, VulnClass.PROTOTYPE_POLLUTION, VulnClass.HTML_INJECTION)),

    PENTEST("Pentest", PayloadRisk.MODERATE, EnumSet.of(
            VulnClass.SQLI, VulnClass.NOSQLI, VulnClass.XSS_REFLECTED, VulnClass.XSS_STORED,
            VulnClass.XSS_DOM, VulnClass.SSTI, VulnClass.CMDI, VulnClass.CODE_INJECTION,
            VulnClass.LDAP_INJECTION, VulnClass.XPATH_INJECTION, VulnClass.XXE, VulnClass.SSRF,
            VulnClass.PATH_TRAVERSAL, VulnClass.LFI, VulnClass.RFI, VulnClass.OPEN_REDIRECT,
            VulnClass.CRLF_INJECTION, VulnClass.HOST_HEADER_INJECTION, VulnClass.EL_INJECTION,
            VulnClass.LOG_INJECTION, VulnClass.HTML_INJECTION, VulnClass.HPP,
            VulnClass.PROTOTYPE_POLLUTION, VulnClass.DESERIALIZATION, VulnClass.IDOR,
            VulnClass.MASS_ASSIGNMENT, VulnClass.VERB_TAMPERING, VulnClass.CORS_MISCONFIG)),

    FULL("Full", PayloadRisk.DANGEROUS, EnumSet.copyOf(VulnClass.scannable()));

    private final String displayName;
    private final PayloadRisk defaultCeiling;
    private final Set<VulnClass> defaultClasses;

    ScanMode(String displayName, PayloadRisk defaultCeiling, Set<VulnClass> defaultClasses) {
        this.displayName = displayName;
        this.defaultCeiling = defaultCeiling;
        this.defaultClasses = Collections.unmodifiableSet(defaultClasses);
    }

    public String getDisplayName() { return displayName; }
    public PayloadRisk getDefaultCeiling() { return defaultCeiling; }
    public Set<VulnClass> getDefaultClasses() { return defaultClasses; }

    public static ScanMode fromString(String value, ScanMode fallback) {
        if (value == null || value.isBlank()) return fallback;
        String v = value.trim().replace('-', '_').replace(' ', '_');
        for (ScanMode m : values()) {
            if (m.name().equalsIgnoreCase(v) || m.displayName.equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        return fallback;
    }

    @Override
    public String toString() { return displayName; }
}
