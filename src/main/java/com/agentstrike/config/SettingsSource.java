package com.agentstrike.config;

/**
 * Supplies the settings snapshot a unit of work should use.
 */
@FunctionalInterface
public interface SettingsSource {

    /** Never null. Callers read it once per unit of work and keep it for that unit. */
    AgentSettings current();
}
