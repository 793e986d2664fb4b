package com.agentstrike.scanner;

import com.agentstrike.agent.AgentProfile;
import com.agentstrike.agent.AgentSupervisor;
import com.agentstrike.agent.DispatchOptions;
import com.agentstrike.audit.AuditLogger;
import com.agentstrike.backend.DispatchResult;
import com.agentstrike.config.ActiveSettings;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.ConfigException;
import com.agentstrike.config.SettingsSource;
import com.agentstrike.framework.DispatchExecutor;
import com.agentstrike.framework.FindingsStore;
import com.agentstrike.framework.TargetThrottle;
import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Payload-driven probing. A job is expanded into probes by the {@link ScanPlanner},
 * each probe is sent through the {@link ProbeSender} and the exchange is judged by
 * the AI through the supervisor's active action.
 *
 * <p>Two pools: one coordinator thread per job walks the state machine, and a
 * scanner-wide probe pool sized {@code maxConcurrent} runs the probes, which
 * bounds the number of in-flight active dispatches.</p>
 */
public class ActiveAiScanner {

    private static final int MAX_RETAINED_JOBS = 200;

    private final SettingsSource settings;
    private final AgentSupervisor supervisor;
    private final PayloadLibrary library;
    private final ScanPlanner planner;
    private final FindingConsolidator consolidator;
    private final FindingsStore findingsStore;
    private final ScopePolicy scope;
    private final ProbeSender probeSender;
    private final AuditLogger audit;
    private final TargetThrottle throttle;
    private final DispatchExecutor coordinators;
    private final DispatchExecutor probePool;
    private final ConcurrentHashMap<String, ScanJob> jobs = new ConcurrentHashMap<>();

    private volatile OobService oobService;
    private volatile boolean enabled;
    private volatile Duration oobPollInterval = Duration.ofSeconds(1);
    private volatile Duration shutdownGrace = Duration.ofSeconds(5);
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public ActiveAiScanner(SettingsSource settings, AgentSupervisor supervisor, PayloadLibrary library,
                           FindingConsolidator consolidator, FindingsStore findingsStore, ScopePolicy scope,
                           ProbeSender probeSender, AuditLogger audit, TargetThrottle throttle) {
        this.settings = settings;
        this.supervisor = supervisor;
        this.library = library;
        this.planner = new ScanPlanner(library);
        this.consolidator = consolidator;
        this.findingsStore = findingsStore;
        this.scope = scope;
        this.probeSender = probeSender;
        this.audit = audit;
        this.throttle = throttle;
        ActiveSettings active = settings.current().getActive();
        this.enabled = active.enabled();
        this.coordinators = new DispatchExecutor("Active-Jobs", 4, 100);
        this.probePool = new DispatchExecutor("Active-Probes", active.maxConcurrent(), 5000);
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
        coordinators.setLogger(logger);
        probePool.setLogger(logger);
    }

    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    /** Out-of-band service for {@code {OOB}} payloads; null disables them. */
    public void setOobService(OobService oobService) { this.oobService = oobService; }

    public void setOobPollInterval(Duration interval) { this.oobPollInterval = interval; }

    public boolean isEnabled() { return enabled; }

    /** Disabling refuses new jobs; running jobs continue until cancelled. */
    public void setEnabled(boolean enabled) {
        if (this.enabled == enabled) return;
        this.enabled = enabled;
        audit.scannerState("active", enabled ? "ENABLED" : "DISABLED");
        log("[ActiveAI] " + (enabled ? "Enabled" : "Disabled"));
    }

    /** True when the payload library can probe for the class. */
    public boolean supports(VulnClass vulnClass) {
        return library.hasPayloads(vulnClass);
    }

    public DispatchExecutor getProbePool() { return probePool; }

    // ==================== Submission ====================

    /** Scans every extracted injection point for the scan mode's classes allowed by the active profile. */
    public ScanJob submit(TrafficContext target) {
        return submit(target, defaultClasses());
    }

    public ScanJob submit(TrafficContext target, Collection<VulnClass> classes) {
        return submit(target, InjectionPoints.extract(target), classes);
    }

    /**
     * Creates and starts a job. Never returns null: a disabled scanner returns an
     * already CANCELLED job, an out-of-scope target under {@code scopeOnly} an already
     * COMPLETED one with nothing dispatched.
     */
    public ScanJob submit(TrafficContext target, List<InjectionPoint> points, Collection<VulnClass> classes) {
        AgentSettings snapshot = settings.current();
        ActiveSettings cfg = snapshot.getActive();
        Set<VulnClass> scanClasses = EnumSet.noneOf(VulnClass.class);
        for (VulnClass c : classes) {
            if (c != VulnClass.OTHER) scanClasses.add(c);
        }
        ScanJob job = new ScanJob(UUID.randomUUID().toString(), target, points, scanClasses,
                cfg.scanMode(), cfg.effectiveCeiling());
        register(job);

        if (!enabled) {
            job.cancel("Active scanner is disabled");
            return job;
        }
        if (cfg.scopeOnly() && !scope.isInScope(target.getUrl())) {
            audit.policySkip(job.getId(), PolicyViolationException.Kind.OUT_OF_SCOPE.name(),
                    Map.of("url", target.getUrl()));
            job.transition(ScanJobState.CREATED, ScanJobState.COMPLETED);
            log("[ActiveAI] Job " + job.getId() + " skipped, target out of scope: " + target.getUrl());
            return job;
        }

        if (probePool.getPoolSize() != cfg.maxConcurrent()) {
            probePool.resize(cfg.maxConcurrent());
        }
        Future<?> coordinator = coordinators.submit(() -> runJob(job, snapshot));
        if (coordinator == null) {
            job.cancel("Active scanner job queue is full");
        } else {
            job.track(coordinator);
        }
        return job;
    }

    /**
     * The scan mode's classes that the active profile enables.
     * @throws ConfigException when the configured profile is unknown
     */
    public Set<VulnClass> defaultClasses() {
        AgentSettings snapshot = settings.current();
        AgentProfile profile = supervisor.profiles().require(snapshot.getProfileId());
        Set<VulnClass> classes = EnumSet.noneOf(VulnClass.class);
        classes.addAll(snapshot.getActive().scanMode().getDefaultClasses());
        classes.retainAll(profile.enabledClasses());
        return classes;
    }

    private void register(ScanJob job) {
        jobs.put(job.getId(), job);
        if (jobs.size() <= MAX_RETAINED_JOBS) return;
        jobs.values().stream()
                .filter(ScanJob::isDone)
                .sorted(Comparator.comparingLong(ScanJob::getCreatedAt))
                .limit(jobs.size() - MAX_RETAINED_JOBS)
                .forEach(j -> jobs.remove(j.getId()));
    }

    // ==================== Job lifecycle ====================

    private void runJob(ScanJob job, AgentSettings snapshot) {
        ActiveSettings cfg = snapshot.getActive();
        if (!job.transition(ScanJobState.CREATED, ScanJobState.EXPANDING)) return;

        try {
            // Fail fast on a bad profile before any probe goes out
            supervisor.profiles().require(snapshot.getProfileId());
        } catch (ConfigException e) {
            fail(job, e);
            return;
        }

        OobService oob = oobService;
        boolean oobAvailable = cfg.useOob() && oob != null && oob.isAvailable();
        ScanPlanner.Plan plan = planner.plan(job.getInjectionPoints(), job.getVulnClasses(),
                job.getRiskCeiling(), cfg.maxPayloadsPerPoint(), oobAvailable);
        job.setPlan(plan.probes().size(), plan.skippedByRisk(), plan.skippedNoOob());
        if (plan.skippedByRisk() > 0) {
            audit.policySkip(job.getId(), PolicyViolationException.Kind.RISK_EXCEEDED.name(), Map.of(
                    "ceiling", job.getRiskCeiling().name(),
                    "skipped", String.valueOf(plan.skippedByRisk())));
        }
        log("[ActiveAI] Job " + job.getId() + " on " + job.getTarget().getUrl() + ": "
                + plan.probes().size() + " probes across " + job.getInjectionPoints().size() + " points, "
                + plan.skippedByRisk() + " over " + job.getRiskCeiling() + ", "
                + plan.skippedNoOob() + " need OOB");

        if (!job.transition(ScanJobState.EXPANDING, ScanJobState.DISPATCHING)) return;

        List<PendingOob> pendingOob = new CopyOnWriteArrayList<>();
        List<Future<?>> probes = new ArrayList<>();
        for (PlannedProbe probe : plan.probes()) {
            if (job.isCancelled()) break;
            Future<?> f = probePool.submit(() -> runProbe(job, probe, snapshot, oob, pendingOob));
            if (f == null) {
                job.recordFailed();
                continue;
            }
            job.track(f);
            probes.add(f);
        }
        if (!awaitAll(job, probes)) return;

        if (!job.transition(ScanJobState.DISPATCHING, ScanJobState.COLLECTING)) {
            releaseAll(oob, pendingOob);
            return;
        }
        collectOob(job, oob, pendingOob, cfg.oobWaitSeconds());
        if (job.transition(ScanJobState.COLLECTING, ScanJobState.COMPLETED)) {
            log("[ActiveAI] Job " + job.getId() + " completed: " + job.getDispatched() + " dispatched, "
                    + job.getFailed() + " failed, " + job.getFindings() + " finding(s)");
        }
    }

    /** False when the job was cancelled while waiting. */
    private boolean awaitAll(ScanJob job, List<Future<?>> probes) {
        for (Future<?> f : probes) {
            try {
                f.get();
            } catch (CancellationException e) {
                if (job.isCancelled()) return false;
            } catch (ExecutionException e) {
                job.recordFailed();
                logError("[ActiveAI] Probe crashed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                job.cancel("Interrupted");
                return false;
            }
        }
        return !job.isCancelled();
    }

    private void fail(ScanJob job, ConfigException e) {
        if (job.cancel(e.getMessage())) {
            logError("[ActiveAI] Job " + job.getId() + " cancelled: " + e.getKind() + " " + e.getMessage());
        }
    }

    // ==================== Probes ====================

    private void runProbe(ScanJob job, PlannedProbe probe, AgentSettings snapshot, OobService oob,
                          List<PendingOob> pendingOob) {
        if (job.isCancelled()) return;
        ActiveSettings cfg = snapshot.getActive();
        Payload payload = probe.payload();
        try {
            RiskGate.check(payload, job.getRiskCeiling());
        } catch (PolicyViolationException e) {
            audit.policySkip(job.getId(), e.getKind().name(), Map.of("payload", payload.value()));
            return;
        }

        String value = payload.value();
        OobService.Token token = null;
        if (payload.oob()) {
            token = oob != null ? oob.register(job.getId() + " " + probe) : null;
            if (token == null) {
                job.recordFailed();
                return;
            }
            value = payload.withOobHost(token.host());
        }

        try {
            throttle.awaitSlot(job.getTarget().host(), cfg.requestDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(oob, token);
            return;
        }

        TrafficContext exchange;
        try {
            exchange = probeSender.send(probe.point().inject(job.getTarget(), value));
        } catch (IOException e) {
            job.recordFailed();
            release(oob, token);
            logError("[ActiveAI] Probe to " + job.getTarget().getUrl() + " failed: " + e.getMessage());
            return;
        }
        if (job.isCancelled()) {
            release(oob, token);
            return;
        }

        TrafficContext judged = exchange.toBuilder()
                .metadata("vulnClass", probe.vulnClass().tag())
                .metadata("injectionPoint", probe.point().name())
                .metadata("injectionType", probe.point().type().name())
                .metadata("originalValue", probe.point().originalValue())
                .metadata("payload", value)
                .metadata("oobNote", token != null
                        ? "The payload also triggers an out-of-band callback; confirmation will be checked separately."
                        : "")
                .metadata("baselineStatus", String.valueOf(job.getTarget().getStatusCode()))
                .build();

        DispatchResult result;
        try {
            result = supervisor.run(snapshot.getProfileId(), AgentProfile.ACTION_ACTIVE, judged,
                    DispatchOptions.timeout(Duration.ofSeconds(cfg.timeoutSeconds())));
        } catch (ConfigException e) {
            release(oob, token);
            fail(job, e);
            return;
        }
        job.recordDispatched();
        if (token != null) pendingOob.add(new PendingOob(token, probe, exchange, value));

        if (!result.isSuccess()) {
            job.recordFailed();
            return;
        }
        Optional<FindingConsolidator.Verdict> verdict = consolidator.parseVerdict(result.getRawText());
        if (verdict.isEmpty()) {
            job.recordFailed();
            return;
        }
        if (verdict.get().vulnerable()) {
            report(job, consolidator.activeFinding(verdict.get(), probe, exchange, value));
        }
    }

    // ==================== Out-of-band collection ====================

    private record PendingOob(OobService.Token token, PlannedProbe probe, TrafficContext exchange, String sentPayload) {}

    private void collectOob(ScanJob job, OobService oob, List<PendingOob> pending, int waitSeconds) {
        if (pending.isEmpty() || oob == null) return;
        List<PendingOob> open = new ArrayList<>(pending);
        long deadline = System.currentTimeMillis() + waitSeconds * 1000L;
        try {
            while (!open.isEmpty() && !job.isCancelled()) {
                open.removeIf(p -> {
                    if (!oob.hasInteraction(p.token().id())) return false;
                    report(job, oobFinding(p));
                    oob.release(p.token().id());
                    return true;
                });
                if (open.isEmpty() || System.currentTimeMillis() >= deadline) break;
                Thread.sleep(Math.max(1, oobPollInterval.toMillis()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            releaseAll(oob, open);
        }
    }

    private Finding oobFinding(PendingOob p) {
        VulnClass vulnClass = p.probe().vulnClass();
        return Finding.builder(vulnClass, FindingSource.ACTIVE, p.exchange().getUrl())
                .confidence(Confidence.CERTAIN)
                .evidence("Out-of-band interaction received for " + p.token().host())
                .detail("Payload injected into " + p.probe().point().type() + " '" + p.probe().point().name()
                        + "' caused the target to contact the interaction server.")
                .payload(p.sentPayload())
                .parameter(p.probe().point().name())
                .sourceRequestId(p.exchange().getRequestId())
                .requestResponse(p.exchange().getSource())
                .build();
    }

    private void releaseAll(OobService oob, List<PendingOob> pending) {
        for (PendingOob p : pending) release(oob, p.token());
    }

    private void release(OobService oob, OobService.Token token) {
        if (oob == null || token == null) return;
        try {
            oob.release(token.id());
        } catch (RuntimeException e) {
            logError("[ActiveAI] Failed to release OOB token: " + e.getMessage());
        }
    }

    private void report(ScanJob job, Finding finding) {
        job.recordFinding();
        if (findingsStore.addFinding(finding)) {
            log("[ActiveAI] " + finding);
        }
    }

    // ==================== Control ====================

    public Optional<ScanJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /** All retained jobs, oldest first. */
    public List<ScanJob> getJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(ScanJob::getCreatedAt))
                .collect(Collectors.toList());
    }

    public boolean cancel(String jobId) {
        ScanJob job = jobs.get(jobId);
        if (job == null) return false;
        boolean cancelled = job.cancel("Cancelled by user");
        if (cancelled) log("[ActiveAI] Job " + jobId + " cancelled");
        return cancelled;
    }

    /** Cancels every running job. Returns how many were cancelled. */
    public int cancelAll() {
        int count = 0;
        for (ScanJob job : jobs.values()) {
            if (job.cancel("Cancelled by user")) count++;
        }
        int dropped = probePool.cancelAll();
        log("[ActiveAI] Cancelled " + count + " job(s), dropped " + dropped + " queued probe(s)");
        return count;
    }

    public Map<ScanJobState, Long> jobCounts() {
        Map<ScanJobState, Long> counts = new LinkedHashMap<>();
        for (ScanJobState s : ScanJobState.values()) counts.put(s, 0L);
        for (ScanJob job : jobs.values()) counts.merge(job.getState(), 1L, Long::sum);
        return counts;
    }

    public PayloadRisk currentCeiling() {
        return settings.current().getActive().effectiveCeiling();
    }

    /** How long each pool may drain on shutdown before running tasks are interrupted. */
    public void setShutdownGrace(Duration grace) { this.shutdownGrace = grace; }

    /** Refuses new jobs, cancels running ones, then drains both pools. Never throws. */
    public void shutdown() {
        try {
            enabled = false;
            for (ScanJob job : jobs.values()) job.cancel("Scanner shut down");
            coordinators.setUnloading(true);
            probePool.setUnloading(true);
            probePool.shutdown(shutdownGrace);
            coordinators.shutdown(shutdownGrace);
        } catch (RuntimeException e) {
            logError("[ActiveAI] Error during shutdown: " + e.getMessage());
        }
    }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
