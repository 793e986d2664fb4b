package com.agentstrike.support;

import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.agent.ProfileRegistry;
import com.agentstrike.agent.TemplateRegistry;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.backend.BackendRegistry;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.MutableSettingsSource;
import com.agentstrike.privacy.PrivacyMode;

import java.nio.file.Path;
import java.time.Duration;

/** Shared wiring for tests that need a supervisor over a fake backend. */
public final class TestSettings {

    public static final String BACKEND_ID = "fake";

    private TestSettings() {}

    /** Settings pointing at the fake backend, audit under {@code dir}, no retries. */
    public static AgentSettings.Builder base(Path dir) {
        return AgentSettings.builder()
                .backendId(BACKEND_ID)
                .profileId(ProfileRegistry.PENTESTER)
                .privacyMode(PrivacyMode.BALANCED)
                .auditLogPath(dir.resolve("audit.jsonl"))
                .hostSalt("test-salt")
                .supervisorPoolSize(8)
                .dispatchTimeoutSeconds(10)
                .maxRetries(0);
    }

    public static AgentSupervisor supervisor(MutableSettingsSource settings, AuditLogger audit, FakeBackend backend) {
        BackendRegistry registry = new BackendRegistry();
        registry.register(backend);
        AgentSupervisor supervisor = new AgentSupervisor(settings, registry, new ProfileRegistry(),
                new TemplateRegistry(), audit);
        supervisor.setRetryBackoff(Duration.ZERO);
        return supervisor;
    }
}
