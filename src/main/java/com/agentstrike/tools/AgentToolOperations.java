package com.agentstrike.tools;

import com.agentstrike.agent.AgentProfile;
import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.agent.ChatSession;
import com.agentstrike.agent.DispatchOptions;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.audit.ChainVerification;
import com.agentstrike.backend.DispatchResult;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.SettingsSource;
import com.agentstrike.framework.FindingsStore;
import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.Severity;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.agentstrike.scanner.PolicyViolationException;
import com.agentstrike.scanner.ScopePolicy;

import java.util.List;
import java.util.Map;

/**
 * Plain callable surface for an external tool-protocol server: dispatch an
 * action, record a finding, list backends, verify the audit chain, chat.
 * Calls are subject to the same scope and size policy as the scanners.
 */
public class AgentToolOperations {

    private final SettingsSource settings;
    private final AgentSupervisor supervisor;
    private final FindingsStore findingsStore;
    private final ScopePolicy scope;
    private final AuditLogger audit;

    public AgentToolOperations(SettingsSource settings, AgentSupervisor supervisor, FindingsStore findingsStore,
                               ScopePolicy scope, AuditLogger audit) {
        this.settings = settings;
        this.supervisor = supervisor;
        this.findingsStore = findingsStore;
        this.scope = scope;
        this.audit = audit;
    }

    /**
     * Runs one supervisor action on the given traffic.
     *
     * @param profileId null for the configured profile
     * @param backendId null for the configured backend
     * @throws PolicyViolationException OUT_OF_SCOPE or OVERSIZED_PAYLOAD; nothing is dispatched
     */
    public DispatchResult dispatch(String profileId, String actionId, TrafficContext context, String backendId)
            throws PolicyViolationException {
        AgentSettings snapshot = settings.current();
        checkPolicy(context, snapshot);
        String profile = profileId != null ? profileId : snapshot.getProfileId();
        return supervisor.run(profile, actionId, context, DispatchOptions.backend(backendId));
    }

    public DispatchResult dispatch(String actionId, TrafficContext context) throws PolicyViolationException {
        return dispatch(null, actionId, context, null);
    }

    /**
     * Records a finding reported by an external agent. The class label is normalized
     * (unknown labels become OTHER) and the result merges with any existing finding
     * for the same class and base URL.
     *
     * @param confidence 0-100
     * @return the stored finding after merging
     * @throws PolicyViolationException OUT_OF_SCOPE when the URL is outside scope
     */
    public Finding createFinding(String classLabel, String url, String severity, int confidence,
                                 String evidence, String detail, String remediation)
            throws PolicyViolationException {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (settings.current().getActive().scopeOnly() && !scope.isInScope(url)) {
            audit.policySkip("", PolicyViolationException.Kind.OUT_OF_SCOPE.name(), Map.of("url", url));
            throw new PolicyViolationException(PolicyViolationException.Kind.OUT_OF_SCOPE, url + " is out of scope");
        }
        VulnClass vulnClass = VulnClass.fromLabel(classLabel);
        Finding finding = Finding.builder(vulnClass, FindingSource.AGENT, url)
                .severity(Severity.fromString(severity, vulnClass.getDefaultSeverity()))
                .confidence(Confidence.fromScore(confidence))
                .evidence(evidence)
                .detail(vulnClass == VulnClass.OTHER && classLabel != null && !classLabel.isBlank()
                        ? "Reported as: " + classLabel + (detail == null || detail.isEmpty() ? "" : "\n" + detail)
                        : detail)
                .remediation(remediation)
                .build();
        findingsStore.addFinding(finding);
        Finding stored = findingsStore.get(finding.dedupKey());
        return stored != null ? stored : finding;
    }

    /** One line per backend: description and availability. */
    public List<String> listBackends() {
        return supervisor.backends().diagnostics();
    }

    public ChainVerification verifyAudit() {
        return audit.verify();
    }

    public ChatSession openSession(String profileId) {
        String profile = profileId != null ? profileId : settings.current().getProfileId();
        supervisor.profiles().require(profile);
        return supervisor.sessions().open(profile);
    }

    /**
     * Sends one chat message in a session, optionally about a request.
     *
     * @throws IllegalArgumentException when the session id is unknown
     */
    public DispatchResult chat(String sessionId, String message, TrafficContext about) throws PolicyViolationException {
        ChatSession session = supervisor.sessions().get(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        TrafficContext context;
        if (about != null) {
            checkPolicy(about, settings.current());
            context = about.toBuilder().metadata("message", message).build();
        } else {
            context = TrafficContext.builder("").method("").metadata("message", message).build();
        }
        return supervisor.run(session, AgentProfile.ACTION_CHAT, context);
    }

    private void checkPolicy(TrafficContext context, AgentSettings snapshot) throws PolicyViolationException {
        if (context == null) return;
        if (snapshot.getActive().scopeOnly() && !scope.isInScope(context.getUrl())) {
            audit.policySkip(context.getRequestId(), PolicyViolationException.Kind.OUT_OF_SCOPE.name(),
                    Map.of("url", context.getUrl()));
            throw new PolicyViolationException(PolicyViolationException.Kind.OUT_OF_SCOPE,
                    context.getUrl() + " is out of scope");
        }
        long limit = snapshot.getPassive().maxSizeKb() * 1024L;
        if (context.sizeBytes() > limit) {
            audit.policySkip(context.getRequestId(), PolicyViolationException.Kind.OVERSIZED_PAYLOAD.name(),
                    Map.of("bytes", String.valueOf(context.sizeBytes())));
            throw new PolicyViolationException(PolicyViolationException.Kind.OVERSIZED_PAYLOAD,
                    "Context is " + context.sizeBytes() + " bytes, limit is " + limit);
        }
    }
}
