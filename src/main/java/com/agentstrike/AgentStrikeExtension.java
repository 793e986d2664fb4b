package com.agentstrike;

import burp.api.montoya.BurpExtension;
import burp.api.montoya.MontoyaApi;
import burp.api.montoya.core.Registration;
import burp.api.montoya.persistence.Preferences;
import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.agent.ProfileRegistry;
import com.agentstrike.agent.TemplateRegistry;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.backend.BackendFactory;
import com.agentstrike.backend.BackendRegistry;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.EnvironmentDiscovery;
import com.agentstrike.config.PreferencesSettingsSource;
import com.agentstrike.config.SettingsKeys;
import com.agentstrike.config.SettingsSource;
import com.agentstrike.framework.AgentStrikeScanCheck;
import com.agentstrike.framework.CollaboratorOobService;
import com.agentstrike.framework.FindingsStore;
import com.agentstrike.framework.MontoyaProbeSender;
import com.agentstrike.framework.ScopeManager;
import com.agentstrike.framework.SiteMapIssueSink;
import com.agentstrike.framework.TargetThrottle;
import com.agentstrike.framework.TrafficInterceptor;
import com.agentstrike.scanner.ActiveAiScanner;
import com.agentstrike.scanner.FindingConsolidator;
import com.agentstrike.scanner.PassiveAiScanner;
import com.agentstrike.scanner.PayloadLibrary;
import com.agentstrike.scanner.ScopePolicy;
import com.agentstrike.tools.AgentToolOperations;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.function.Consumer;

/**
 * AgentStrike entry point.
 *
 * Wires the AI orchestration engine into Burp: settings come from Burp preferences
 * (overlaying environment-discovered backends), proxied traffic feeds the passive
 * scanner, active probes go out through Burp's HTTP stack, findings land in the
 * Site Map and every AI call is recorded in the hash-chained audit log.
 */
public class AgentStrikeExtension implements BurpExtension {

    private static final int MAX_BODY_SIZE = 64 * 1024;

    private AgentSupervisor supervisor;
    private PassiveAiScanner passiveScanner;
    private ActiveAiScanner activeScanner;
    private CollaboratorOobService oobService;
    private AgentToolOperations toolOperations;
    private AuditLogger audit;
    private Registration scanCheckRegistration;

    @Override
    public void initialize(MontoyaApi api) {
        api.extension().setName("AgentStrike");
        api.logging().logToOutput("=== AgentStrike initializing ===");
        Consumer<String> out = msg -> api.logging().logToOutput(msg);
        Consumer<String> err = msg -> api.logging().logToError(msg);

        // ==================== SETTINGS ====================
        Preferences preferences = api.persistence().preferences();
        ensureHostSalt(preferences);
        AgentSettings base = AgentSettings.builder()
                .backends(EnvironmentDiscovery.discoverBackends())
                .build();
        SettingsSource settings = new PreferencesSettingsSource(preferences, base);
        AgentSettings snapshot = settings.current();

        ScopeManager scopeManager = new ScopeManager();
        scopeManager.setTargetDomains(snapshot.getScopeDomains());
        // Explicit scope domains win; otherwise Burp's own target scope decides
        ScopePolicy scope = url -> scopeManager.getTargetDomains().isEmpty()
                ? api.scope().isInScope(url)
                : scopeManager.isInScope(url);

        // ==================== CORE ====================
        audit = new AuditLogger(snapshot.getAuditLogPath(), Clock.systemUTC(), err);
        audit.setLogger(out);
        audit.setEnabled(snapshot.isAuditEnabled());
        api.logging().logToOutput("Audit log: " + audit.getPath()
                + (snapshot.isAuditEnabled() ? " (next index " + audit.getNextIndex() + ")" : " (disabled)"));

        BackendRegistry backends = BackendFactory.createRegistry(snapshot.getBackends());
        api.logging().logToOutput("Backends: " + String.join(", ", backends.listBackendIds())
                + " | active: " + snapshot.getBackendId());
        for (String line : backends.diagnostics()) {
            api.logging().logToOutput("  " + line);
        }

        ProfileRegistry profiles = new ProfileRegistry();
        profiles.setLogger(out);
        supervisor = new AgentSupervisor(settings, backends, profiles, new TemplateRegistry(), audit);
        supervisor.setLogger(out);
        supervisor.setErrorLogger(err);

        FindingsStore findingsStore = new FindingsStore(audit);
        findingsStore.setErrorLogger(err);
        findingsStore.addSink(new SiteMapIssueSink(api));

        FindingConsolidator consolidator = new FindingConsolidator();
        consolidator.setErrorLogger(err);

        // ==================== SCANNERS ====================
        oobService = new CollaboratorOobService(api);
        oobService.setLogger(out);
        oobService.setErrorLogger(err);
        boolean collabAvailable = oobService.initialize();

        activeScanner = new ActiveAiScanner(settings, supervisor, new PayloadLibrary(), consolidator,
                findingsStore, scope, new MontoyaProbeSender(api, MAX_BODY_SIZE), audit, new TargetThrottle());
        activeScanner.setLogger(out);
        activeScanner.setErrorLogger(err);
        activeScanner.setOobService(oobService);

        passiveScanner = new PassiveAiScanner(settings, supervisor, consolidator, findingsStore, scope, audit,
                new TargetThrottle());
        passiveScanner.setLogger(out);
        passiveScanner.setErrorLogger(err);
        passiveScanner.setEscalationTarget(activeScanner);

        api.proxy().registerResponseHandler(new TrafficInterceptor(api, passiveScanner, MAX_BODY_SIZE));
        api.logging().logToOutput("Traffic interceptor registered.");

        // Burp Scanner integration is a Professional feature; Community throws here
        try {
            AgentStrikeScanCheck scanCheck = new AgentStrikeScanCheck(activeScanner, MAX_BODY_SIZE);
            scanCheck.setLogger(out);
            scanCheck.setErrorLogger(err);
            scanCheckRegistration = api.scanner().registerScanCheck(scanCheck);
            api.logging().logToOutput("ScanCheck registered with Burp Scanner.");
        } catch (RuntimeException e) {
            api.logging().logToOutput("ScanCheck not registered (Burp Professional required): " + e.getMessage());
        }

        toolOperations = new AgentToolOperations(settings, supervisor, findingsStore, scope, audit);

        // ==================== CLEANUP ON UNLOAD ====================
        api.extension().registerUnloadingHandler(() -> {
            api.logging().logToOutput("AgentStrike unloading...");
            if (scanCheckRegistration != null) scanCheckRegistration.deregister();
            passiveScanner.shutdown();
            activeScanner.shutdown();
            supervisor.shutdown();
            oobService.shutdown();
            api.logging().logToOutput("AgentStrike unloaded.");
        });

        api.logging().logToOutput("=== AgentStrike ready ===");
        api.logging().logToOutput("Profile: " + snapshot.getProfileId()
                + " | Privacy: " + snapshot.getPrivacyMode()
                + " | Passive: " + (passiveScanner.isEnabled() ? "on" : "off")
                + " | Active: " + (activeScanner.isEnabled() ? "on" : "off")
                + " | Collaborator: " + (collabAvailable ? "Yes" : "No"));
    }

    /** Pseudonyms must stay stable across sessions, so the salt is created once and persisted. */
    private static void ensureHostSalt(Preferences preferences) {
        String salt = preferences.getString(SettingsKeys.HOST_SALT);
        if (salt == null || salt.isBlank()) {
            byte[] bytes = new byte[16];
            new SecureRandom().nextBytes(bytes);
            preferences.setString(SettingsKeys.HOST_SALT, HexFormat.of().formatHex(bytes));
        }
    }

    public AgentToolOperations getToolOperations() {
        return toolOperations;
    }
}
