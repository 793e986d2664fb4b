package com.agentstrike.agent;

/**
 * Persona an agent profile speaks with. The persona line opens every prompt.
 */
public enum AgentRole {

    PENTESTER("You are a senior penetration tester working on an authorized engagement."),
    BUGHUNTER("You are an experienced bug bounty hunter. Stay within program rules and favor low-noise, high-impact findings."),
    AUDITOR("You are an application security auditor reviewing traffic for compliance and defensive weaknesses.");

    private final String persona;

    AgentRole(String persona) {
        this.persona = persona;
    }

    public String getPersona() { return persona; }

    public static AgentRole fromString(String value, AgentRole fallback) {
        if (value == null || value.isBlank()) return fallback;
        for (AgentRole r : values()) {
            if (r.name().equalsIgnoreCase(value.trim())) return r;
        }
        return fallback;
    }
}
