package com.agentstrike.tools;

import com.agentstrike.agent.AgentProfile;
import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.agent.ChatSession;
import com.agentstrike.agent.ProfileRegistry;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.audit.ChainVerification;
import com.agentstrike.backend.DispatchResult;
import com.agentstrike.config.ActiveSettings;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.ConfigException;
import com.agentstrike.config.MutableSettingsSource;
import com.agentstrike.config.PassiveSettings;
import com.agentstrike.framework.FindingsStore;
import com.agentstrike.framework.ScopeManager;
import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.Severity;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.agentstrike.scanner.PolicyViolationException;
import com.agentstrike.support.FakeBackend;
import com.agentstrike.support.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentToolOperationsTest {

    @TempDir
    Path dir;

    private final ScopeManager scope = new ScopeManager();
    private final FakeBackend backend = new FakeBackend(TestSettings.BACKEND_ID, "{\"findings\": []}");
    private AgentSupervisor supervisor;
    private AuditLogger audit;
    private FindingsStore store;

    @AfterEach
    void tearDown() {
        if (supervisor != null) supervisor.shutdown();
    }

    private AgentToolOperations create(AgentSettings settings) {
        MutableSettingsSource source = new MutableSettingsSource(settings);
        audit = new AuditLogger(settings.getAuditLogPath());
        supervisor = TestSettings.supervisor(source, audit, backend);
        store = new FindingsStore(audit);
        scope.setTargetDomains("example.com");
        return new AgentToolOperations(source, supervisor, store, scope, audit);
    }

    private AgentToolOperations create() {
        return create(TestSettings.base(dir).build());
    }

    private static TrafficContext request(String url) {
        return TrafficContext.builder(url).requestId("tool-1").statusCode(200).responseBody("ok").build();
    }

    @Test
    void dispatch_runs_the_action_for_in_scope_traffic() throws Exception {
        AgentToolOperations ops = create();

        DispatchResult result = ops.dispatch(AgentProfile.ACTION_ANALYZE, request("https://a.example.com/x"));

        assertTrue(result.isSuccess());
        assertEquals(1, backend.invocations());
    }

    @Test
    void out_of_scope_traffic_is_refused_before_dispatch() throws Exception {
        AgentToolOperations ops = create();

        PolicyViolationException e = assertThrows(PolicyViolationException.class,
                () -> ops.dispatch(AgentProfile.ACTION_ANALYZE, request("https://evil.test/x")));

        assertEquals(PolicyViolationException.Kind.OUT_OF_SCOPE, e.getKind());
        assertEquals(0, backend.invocations());
        assertTrue(Files.readString(audit.getPath()).contains("OUT_OF_SCOPE"));
    }

    @Test
    void scope_check_is_skipped_when_scope_only_is_off() throws Exception {
        AgentToolOperations ops = create(TestSettings.base(dir)
                .active(ActiveSettings.defaults().withScopeOnly(false)).build());

        assertTrue(ops.dispatch(AgentProfile.ACTION_ANALYZE, request("https://evil.test/x")).isSuccess());
    }

    @Test
    void oversized_context_is_refused_before_dispatch() throws Exception {
        AgentToolOperations ops = create(TestSettings.base(dir)
                .passive(PassiveSettings.defaults().withMaxSizeKb(1)).build());
        TrafficContext big = TrafficContext.builder("https://a.example.com/upload")
                .requestBody("A".repeat(4_096))
                .build();

        PolicyViolationException e = assertThrows(PolicyViolationException.class,
                () -> ops.dispatch(AgentProfile.ACTION_ANALYZE, big));

        assertEquals(PolicyViolationException.Kind.OVERSIZED_PAYLOAD, e.getKind());
        assertEquals(0, backend.invocations());
    }

    @Test
    void unknown_backend_surfaces_as_config_error() {
        AgentToolOperations ops = create();

        ConfigException e = assertThrows(ConfigException.class,
                () -> ops.dispatch(null, AgentProfile.ACTION_ANALYZE, request("https://a.example.com/x"), "nope"));
        assertEquals(ConfigException.Kind.UNKNOWN_BACKEND, e.getKind());
    }

    @Test
    void created_findings_merge_by_class_and_base_url() throws Exception {
        AgentToolOperations ops = create();

        ops.createFinding("sql injection", "https://a.example.com/items?id=1", "medium", 40,
                "first", "", "");
        Finding merged = ops.createFinding("SQLI", "https://a.example.com/items?id=2", "HIGH", 95,
                "second", "", "Use bind variables");

        assertEquals(1, store.getCount());
        assertEquals(FindingSource.AGENT, merged.getSource());
        assertEquals("[AI Agent] SQLI", merged.getName());
        assertEquals(Severity.HIGH, merged.getSeverity());
        assertEquals(Confidence.CERTAIN, merged.getConfidence());
        assertEquals("first\n---\nsecond", merged.getEvidence());
    }

    @Test
    void unknown_labels_are_stored_as_other() throws Exception {
        AgentToolOperations ops = create();

        Finding f = ops.createFinding("weird banner thing", "https://a.example.com/", null, 70, "x", "seen twice", null);

        assertEquals(VulnClass.OTHER, f.getVulnClass());
        assertEquals("Reported as: weird banner thing\nseen twice", f.getDetail());
        assertEquals(Severity.INFO, f.getSeverity());
    }

    @Test
    void create_finding_validates_url_and_scope() {
        AgentToolOperations ops = create();

        assertThrows(IllegalArgumentException.class, () -> ops.createFinding("xss", " ", "LOW", 50, "", "", ""));
        PolicyViolationException e = assertThrows(PolicyViolationException.class,
                () -> ops.createFinding("xss", "https://evil.test/", "LOW", 50, "", "", ""));
        assertEquals(PolicyViolationException.Kind.OUT_OF_SCOPE, e.getKind());
        assertEquals(0, store.getCount());
    }

    @Test
    void list_backends_reports_availability() {
        AgentToolOperations ops = create();

        List<String> lines = ops.listBackends();

        assertEquals(List.of("fake fake [available]"), lines);
    }

    @Test
    void verify_audit_covers_tool_activity() throws Exception {
        AgentToolOperations ops = create();
        ops.dispatch(AgentProfile.ACTION_ANALYZE, request("https://a.example.com/x"));
        ops.createFinding("xss", "https://a.example.com/x", "LOW", 50, "", "", "");

        ChainVerification v = ops.verifyAudit();

        assertTrue(v.valid(), v.reason());
        assertEquals(3, v.recordCount());
    }

    @Test
    void chat_appends_turns_to_an_open_session() throws Exception {
        backend.respondWith(prompt -> "The id parameter looks injectable.");
        AgentToolOperations ops = create();
        ChatSession session = ops.openSession(null);
        assertEquals(ProfileRegistry.PENTESTER, session.getProfileId());

        DispatchResult first = ops.chat(session.getId(), "What stands out?", request("https://a.example.com/items?id=1"));
        ops.chat(session.getId(), "And without the request?", null);

        assertTrue(first.isSuccess());
        assertEquals(2, session.size());
        assertEquals("What stands out?", session.recentTurns(2).get(0).user());
        assertTrue(backend.prompts().get(1).contains("What stands out?"));
    }

    @Test
    void chat_rejects_unknown_sessions_and_profiles() {
        AgentToolOperations ops = create();

        assertThrows(IllegalArgumentException.class, () -> ops.chat("missing", "hi", null));
        ConfigException e = assertThrows(ConfigException.class, () -> ops.openSession("ghost"));
        assertEquals(ConfigException.Kind.UNKNOWN_PROFILE, e.getKind());
        assertEquals(0, backend.invocations());
    }
}
