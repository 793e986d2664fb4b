package com.agentstrike.agent;

import com.agentstrike.config.ConfigException;
import com.agentstrike.model.ScanMode;
import com.agentstrike.model.VulnClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Known agent profiles plus the process-wide active one.
 * Bundled: {@code pentester}, {@code bughunter}, {@code auditor}.
 */
public class ProfileRegistry {

    public static final String PENTESTER = "pentester";
    public static final String BUGHUNTER = "bughunter";
    public static final String AUDITOR = "auditor";

    private final Map<String, AgentProfile> profiles = new ConcurrentHashMap<>();
    private volatile AgentProfile active;
    private volatile Consumer<String> logger;

    public ProfileRegistry() {
        register(new AgentProfile(PENTESTER, AgentRole.PENTESTER, AgentProfile.standardActions(),
                ScanMode.PENTEST.getDefaultClasses()));
        register(new AgentProfile(BUGHUNTER, AgentRole.BUGHUNTER, AgentProfile.standardActions(),
                ScanMode.BUG_BOUNTY.getDefaultClasses()));
        register(new AgentProfile(AUDITOR, AgentRole.AUDITOR, AgentProfile.standardActions(),
                VulnClass.scannable()));
        this.active = profiles.get(PENTESTER);
    }

    public void setLogger(Consumer<String> logger) { this.logger = logger; }

    public void register(AgentProfile profile) {
        profiles.put(profile.id(), profile);
    }

    /**
     * @throws ConfigException UNKNOWN_PROFILE
     */
    public AgentProfile require(String id) {
        AgentProfile p = id == null ? null : profiles.get(id);
        if (p == null) {
            throw new ConfigException(ConfigException.Kind.UNKNOWN_PROFILE,
                    "Unknown agent profile '" + id + "'. Known: " + ids());
        }
        return p;
    }

    public AgentProfile getActiveProfile() {
        return active;
    }

    /** Swaps the active profile. The previous one stays in effect if the id is unknown. */
    public AgentProfile setActiveProfile(String id) {
        AgentProfile p = require(id);
        this.active = p;
        Consumer<String> l = logger;
        if (l != null) l.accept("[Profiles] Active profile: " + p.id() + " (" + p.role() + ")");
        return p;
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(profiles.keySet());
        ids.sort(null);
        return ids;
    }
}
