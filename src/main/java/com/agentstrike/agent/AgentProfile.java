package com.agentstrike.agent;

import com.agentstrike.model.VulnClass;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named agent persona: role, the template used for each action, and the
 * vulnerability classes it cares about.
 */
public record AgentProfile(String id, AgentRole role, Map<String, String> actions, Set<VulnClass> enabledClasses) {

    public static final String ACTION_PASSIVE = "passive";
    public static final String ACTION_ACTIVE = "active";
    public static final String ACTION_ANALYZE = "analyze";
    public static final String ACTION_EXPLAIN = "explain";
    public static final String ACTION_CHAT = "chat";

    public AgentProfile {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions != null ? actions : Map.of()));
        Set<VulnClass> classes = EnumSet.noneOf(VulnClass.class);
        if (enabledClasses != null) classes.addAll(enabledClasses);
        enabledClasses = Collections.unmodifiableSet(classes);
    }

    /** Template id bound to an action, if the profile supports that action. */
    public Optional<String> templateFor(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    /** Standard action set used by the bundled profiles. */
    static Map<String, String> standardActions() {
        Map<String, String> actions = new LinkedHashMap<>();
        actions.put(ACTION_PASSIVE, TemplateRegistry.PASSIVE_TRIAGE);
        actions.put(ACTION_ACTIVE, TemplateRegistry.ACTIVE_VERIFY);
        actions.put(ACTION_ANALYZE, TemplateRegistry.ANALYZE_REQUEST);
        actions.put(ACTION_EXPLAIN, TemplateRegistry.EXPLAIN_FINDING);
        actions.put(ACTION_CHAT, TemplateRegistry.CHAT);
        return actions;
    }
}
