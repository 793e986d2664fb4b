package com.agentstrike.config;

import com.agentstrike.backend.BackendConfig;
import com.agentstrike.backend.BackendFactory;
import com.agentstrike.privacy.PrivacyMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable settings snapshot. Components read one snapshot per unit of work
 * through {@link SettingsSource#current()}; changes publish a new snapshot.
 */
public final class AgentSettings {

    public static final Path DEFAULT_AUDIT_PATH =
            Path.of(System.getProperty("user.home", "."), ".agentstrike", "audit.jsonl");

    private final PrivacyMode privacyMode;
    private final boolean determinismMode;
    private final boolean auditEnabled;
    private final Path auditLogPath;
    private final String hostSalt;
    private final String backendId;
    private final String profileId;
    private final int supervisorPoolSize;
    private final int dispatchTimeoutSeconds;
    private final int maxRetries;
    private final int maxSessionTurns;
    private final Set<String> redactionHosts;
    private final String scopeDomains;
    private final PassiveSettings passive;
    private final ActiveSettings active;
    private final List<BackendConfig> backends;

    private AgentSettings(Builder b) {
        this.privacyMode = b.privacyMode != null ? b.privacyMode : PrivacyMode.BALANCED;
        this.determinismMode = b.determinismMode;
        this.auditEnabled = b.auditEnabled;
        this.auditLogPath = b.auditLogPath != null ? b.auditLogPath : DEFAULT_AUDIT_PATH;
        this.hostSalt = b.hostSalt != null ? b.hostSalt : "";
        this.backendId = b.backendId != null && !b.backendId.isBlank() ? b.backendId.trim() : "ollama";
        this.profileId = b.profileId != null && !b.profileId.isBlank() ? b.profileId.trim() : "pentester";
        this.supervisorPoolSize = Math.max(1, b.supervisorPoolSize);
        this.dispatchTimeoutSeconds = Math.max(1, b.dispatchTimeoutSeconds);
        this.maxRetries = Math.max(0, b.maxRetries);
        this.maxSessionTurns = Math.max(1, b.maxSessionTurns);
        this.redactionHosts = Collections.unmodifiableSet(new LinkedHashSet<>(b.redactionHosts));
        this.scopeDomains = b.scopeDomains != null ? b.scopeDomains : "";
        this.passive = b.passive != null ? b.passive : PassiveSettings.defaults();
        this.active = b.active != null ? b.active : ActiveSettings.defaults();
        this.backends = List.copyOf(b.backends);
    }

    public static AgentSettings defaults() {
        return builder().build();
    }

    public PrivacyMode getPrivacyMode() { return privacyMode; }
    public boolean isDeterminismMode() { return determinismMode; }
    public boolean isAuditEnabled() { return auditEnabled; }
    public Path getAuditLogPath() { return auditLogPath; }
    public String getHostSalt() { return hostSalt; }
    public String getBackendId() { return backendId; }
    public String getProfileId() { return profileId; }
    public int getSupervisorPoolSize() { return supervisorPoolSize; }
    public int getDispatchTimeoutSeconds() { return dispatchTimeoutSeconds; }
    public Duration getDispatchTimeout() { return Duration.ofSeconds(dispatchTimeoutSeconds); }
    public int getMaxRetries() { return maxRetries; }
    public int getMaxSessionTurns() { return maxSessionTurns; }
    public Set<String> getRedactionHosts() { return redactionHosts; }
    public String getScopeDomains() { return scopeDomains; }
    public PassiveSettings getPassive() { return passive; }
    public ActiveSettings getActive() { return active; }
    public List<BackendConfig> getBackends() { return backends; }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .privacyMode(privacyMode)
                .determinismMode(determinismMode)
                .auditEnabled(auditEnabled)
                .auditLogPath(auditLogPath)
                .hostSalt(hostSalt)
                .backendId(backendId)
                .profileId(profileId)
                .supervisorPoolSize(supervisorPoolSize)
                .dispatchTimeoutSeconds(dispatchTimeoutSeconds)
                .maxRetries(maxRetries)
                .maxSessionTurns(maxSessionTurns)
                .redactionHosts(redactionHosts)
                .scopeDomains(scopeDomains)
                .passive(passive)
                .active(active);
        b.backends.clear();
        b.backends.addAll(backends);
        return b;
    }

    @Override
    public String toString() {
        return "AgentSettings{privacy=" + privacyMode + ", determinism=" + determinismMode
                + ", audit=" + auditEnabled + ", backend=" + backendId + ", profile=" + profileId
                + ", pool=" + supervisorPoolSize + ", timeout=" + dispatchTimeoutSeconds + "s"
                + ", retries=" + maxRetries + ", passive=" + passive + ", active=" + active + "}";
    }

    public static class Builder {
        private PrivacyMode privacyMode = PrivacyMode.BALANCED;
        private boolean determinismMode = false;
        private boolean auditEnabled = true;
        private Path auditLogPath = DEFAULT_AUDIT_PATH;
        private String hostSalt = "";
        private String backendId = "ollama";
        private String profileId = "pentester";
        private int supervisorPoolSize = 4;
        private int dispatchTimeoutSeconds = 120;
        private int maxRetries = 1;
        private int maxSessionTurns = 10;
        private final Set<String> redactionHosts = new LinkedHashSet<>();
        private String scopeDomains = "";
        private PassiveSettings passive = PassiveSettings.defaults();
        private ActiveSettings active = ActiveSettings.defaults();
        private final List<BackendConfig> backends = new ArrayList<>(BackendFactory.defaultConfigs());

        private Builder() {}

        public Builder privacyMode(PrivacyMode m) { this.privacyMode = m; return this; }
        public Builder determinismMode(boolean d) { this.determinismMode = d; return this; }
        public Builder auditEnabled(boolean a) { this.auditEnabled = a; return this; }
        public Builder auditLogPath(Path p) { this.auditLogPath = p; return this; }
        public Builder hostSalt(String s) { this.hostSalt = s; return this; }
        public Builder backendId(String id) { this.backendId = id; return this; }
        public Builder profileId(String id) { this.profileId = id; return this; }
        public Builder supervisorPoolSize(int n) { this.supervisorPoolSize = n; return this; }
        public Builder dispatchTimeoutSeconds(int s) { this.dispatchTimeoutSeconds = s; return this; }
        public Builder maxRetries(int n) { this.maxRetries = n; return this; }
        public Builder maxSessionTurns(int n) { this.maxSessionTurns = n; return this; }
        public Builder redactionHosts(Set<String> hosts) {
            redactionHosts.clear();
            for (String h : hosts) addRedactionHost(h);
            return this;
        }
        public Builder addRedactionHost(String host) {
            if (host != null && !host.isBlank()) redactionHosts.add(host.trim().toLowerCase(Locale.ROOT));
            return this;
        }
        public Builder scopeDomains(String domains) { this.scopeDomains = domains; return this; }
        public Builder passive(PassiveSettings p) { this.passive = p; return this; }
        public Builder active(ActiveSettings a) { this.active = a; return this; }
        /** Replaces the backend list. */
        public Builder backends(List<BackendConfig> configs) {
            backends.clear();
            backends.addAll(configs);
            return this;
        }
        public Builder addBackend(BackendConfig config) { backends.add(config); return this; }

        public AgentSettings build() {
            return new AgentSettings(this);
        }
    }
}
