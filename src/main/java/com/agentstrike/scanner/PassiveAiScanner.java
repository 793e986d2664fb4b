package com.agentstrike.scanner;

import com.agentstrike.agent.AgentProfile;
import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.backend.DispatchResult;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.ConfigException;
import com.agentstrike.config.PassiveSettings;
import com.agentstrike.config.SettingsSource;
import com.agentstrike.framework.DispatchExecutor;
import com.agentstrike.framework.FindingsStore;
import com.agentstrike.framework.TargetThrottle;
import com.agentstrike.model.Finding;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Background triage of proxied traffic. Each event is filtered on the calling
 * (proxy) thread, which never blocks; accepted events are analysed on a small
 * dedicated pool through the supervisor's passive action.
 */
public class PassiveAiScanner {

    private static final Set<String> STATIC_EXTENSIONS = Set.of(
            ".css", ".js", ".mjs", ".map",
            ".png", ".jpg", ".jpeg", ".gif", ".svg", ".ico", ".webp", ".bmp",
            ".woff", ".woff2", ".ttf", ".eot", ".otf",
            ".mp4", ".mp3", ".webm", ".avi", ".pdf", ".zip", ".gz"
    );

    private final SettingsSource settings;
    private final AgentSupervisor supervisor;
    private final FindingConsolidator consolidator;
    private final FindingsStore findingsStore;
    private final ScopePolicy scope;
    private final AuditLogger audit;
    private final TargetThrottle throttle;
    private final DispatchExecutor pool;

    private volatile boolean enabled;
    private volatile ActiveAiScanner escalationTarget;
    private volatile Duration shutdownGrace = Duration.ofSeconds(5);
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    private final AtomicLong observed = new AtomicLong();
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong findings = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();

    public PassiveAiScanner(SettingsSource settings, AgentSupervisor supervisor, FindingConsolidator consolidator,
                            FindingsStore findingsStore, ScopePolicy scope, AuditLogger audit,
                            TargetThrottle throttle) {
        this.settings = settings;
        this.supervisor = supervisor;
        this.consolidator = consolidator;
        this.findingsStore = findingsStore;
        this.scope = scope;
        this.audit = audit;
        this.throttle = throttle;
        this.pool = new DispatchExecutor("Passive", 2, 200);
        this.enabled = settings.current().getPassive().enabled();
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
        pool.setLogger(logger);
    }

    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    /** Active scanner that receives escalations when {@code escalateToActive} is on. */
    public void setEscalationTarget(ActiveAiScanner activeScanner) { this.escalationTarget = activeScanner; }

    public boolean isEnabled() { return enabled; }

    /** Takes effect for the next event; queued work still finishes. */
    public void setEnabled(boolean enabled) {
        if (this.enabled == enabled) return;
        this.enabled = enabled;
        audit.scannerState("passive", enabled ? "ENABLED" : "DISABLED");
        log("[PassiveAI] " + (enabled ? "Enabled" : "Disabled"));
    }

    // ==================== Intake ====================

    /**
     * Filters one traffic event and, if it passes, queues it for triage.
     * Checks run in order: enabled, scope, size, static resource, per-host rate limit.
     */
    public PassiveDecision onTraffic(TrafficContext context) {
        observed.incrementAndGet();
        PassiveDecision decision = decide(context);
        if (decision != PassiveDecision.SUBMITTED) {
            skipped.incrementAndGet();
            return decision;
        }

        inFlight.incrementAndGet();
        Future<?> queued = pool.submit(() -> {
            try {
                analyze(context);
            } finally {
                inFlight.decrementAndGet();
            }
        });
        if (queued == null) {
            inFlight.decrementAndGet();
            skipped.incrementAndGet();
            return PassiveDecision.QUEUE_FULL;
        }
        submitted.incrementAndGet();
        return PassiveDecision.SUBMITTED;
    }

    private PassiveDecision decide(TrafficContext context) {
        if (!enabled) return PassiveDecision.DISABLED;
        PassiveSettings cfg = settings.current().getPassive();
        if (cfg.scopeOnly() && !scope.isInScope(context.getUrl())) return PassiveDecision.OUT_OF_SCOPE;
        if (context.sizeBytes() > cfg.maxSizeKb() * 1024L) return PassiveDecision.OVERSIZED;
        if (isStaticResource(context.getUrl())) return PassiveDecision.STATIC_RESOURCE;
        String key = context.host().isEmpty() ? context.getUrl() : context.host();
        if (!throttle.tryAcquire(key, cfg.rateLimitSeconds() * 1000L)) return PassiveDecision.RATE_LIMITED;
        return PassiveDecision.SUBMITTED;
    }

    static boolean isStaticResource(String url) {
        if (url == null) return false;
        String path = url;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int hash = path.indexOf('#');
        if (hash >= 0) path = path.substring(0, hash);
        int lastSlash = path.lastIndexOf('/');
        String last = lastSlash >= 0 ? path.substring(lastSlash) : path;
        int dot = last.lastIndexOf('.');
        if (dot < 0) return false;
        return STATIC_EXTENSIONS.contains(last.substring(dot).toLowerCase(Locale.ROOT));
    }

    // ==================== Analysis ====================

    private void analyze(TrafficContext context) {
        AgentSettings snapshot = settings.current();
        DispatchResult result;
        try {
            result = supervisor.run(snapshot.getProfileId(), AgentProfile.ACTION_PASSIVE, context);
        } catch (ConfigException e) {
            errors.incrementAndGet();
            logError("[PassiveAI] Configuration error, event dropped: " + e.getMessage());
            return;
        }
        if (!result.isSuccess()) {
            errors.incrementAndGet();
            return;
        }

        List<Finding> parsed = consolidator.parsePassive(result.getRawText(), context,
                snapshot.getPassive().minConfidence());
        List<Finding> added = findingsStore.addFindings(parsed);
        findings.addAndGet(added.size());
        if (!added.isEmpty()) {
            log("[PassiveAI] " + added.size() + " new finding(s) on " + context.getUrl());
        }

        if (snapshot.getPassive().escalateToActive()) {
            escalate(context, added);
        }
    }

    /** Only findings the store had not seen before are escalated. */
    private void escalate(TrafficContext context, List<Finding> added) {
        ActiveAiScanner active = escalationTarget;
        if (active == null || added.isEmpty()) return;
        Set<VulnClass> classes = EnumSet.noneOf(VulnClass.class);
        for (Finding f : added) {
            if (active.supports(f.getVulnClass())) classes.add(f.getVulnClass());
        }
        if (classes.isEmpty()) return;
        try {
            ScanJob job = active.submit(context, classes);
            log("[PassiveAI] Escalated " + classes + " on " + context.getUrl() + " as job " + job.getId());
        } catch (ConfigException e) {
            logError("[PassiveAI] Escalation failed: " + e.getMessage());
        }
    }

    // ==================== Lifecycle & stats ====================

    /** Waits until no queued or running triage remains. Returns false on timeout. */
    public boolean awaitIdle(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (inFlight.get() > 0) {
            if (System.currentTimeMillis() >= deadline) return false;
            Thread.sleep(10);
        }
        return true;
    }

    /** How long each pool may drain on shutdown before running tasks are interrupted. */
    public void setShutdownGrace(Duration grace) { this.shutdownGrace = grace; }

    /** Stops intake and drains the pool. Never throws. */
    public void shutdown() {
        try {
            enabled = false;
            pool.setUnloading(true);
            pool.shutdown(shutdownGrace);
        } catch (RuntimeException e) {
            logError("[PassiveAI] Error during shutdown: " + e.getMessage());
        }
    }

    public Map<String, Long> stats() {
        return Map.of(
                "observed", observed.get(),
                "submitted", submitted.get(),
                "skipped", skipped.get(),
                "findings", findings.get(),
                "errors", errors.get());
    }

    public long getObserved() { return observed.get(); }
    public long getSubmitted() { return submitted.get(); }
    public long getSkipped() { return skipped.get(); }
    public long getFindings() { return findings.get(); }
    public long getErrors() { return errors.get(); }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
