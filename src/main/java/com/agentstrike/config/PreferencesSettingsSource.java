package com.agentstrike.config;

import burp.api.montoya.persistence.Preferences;

/**
 * Read-only view of settings stored in Burp's per-user preferences under
 * {@code agentstrike.*} keys. Each call re-reads the preferences, so values
 * edited elsewhere take effect on the next unit of work.
 */
public class PreferencesSettingsSource implements SettingsSource {

    private final Preferences preferences;
    private final AgentSettings base;

    /**
     * @param base snapshot providing values (including backend configs) for keys that are not stored
     */
    public PreferencesSettingsSource(Preferences preferences, AgentSettings base) {
        this.preferences = preferences;
        this.base = base;
    }

    @Override
    public AgentSettings current() {
        return SettingsKeys.overlay(base, preferences::getString);
    }
}
