package com.agentstrike.framework;

import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.scanner.AuditResult;
import burp.api.montoya.scanner.ConsolidationAction;
import burp.api.montoya.scanner.ScanCheck;
import burp.api.montoya.scanner.audit.insertionpoint.AuditInsertionPoint;
import burp.api.montoya.scanner.audit.issues.AuditIssue;
import com.agentstrike.config.ConfigException;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.agentstrike.scanner.ActiveAiScanner;
import com.agentstrike.scanner.InjectionPoint;
import com.agentstrike.scanner.InjectionPoints;
import com.agentstrike.scanner.InjectionType;
import com.agentstrike.scanner.ScanJob;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Bridges Burp Scanner's active audits into the AI active scanner (Burp Professional).
 *
 * Each audited insertion point becomes a ScanJob on that single point. The job runs
 * asynchronously, so the audit result is always empty: findings reach the Site Map
 * through the FindingsStore sink. Passive audits are left to the proxy interceptor.
 */
public class AgentStrikeScanCheck implements ScanCheck {

    private final ActiveAiScanner activeScanner;
    private final int maxBodySize;
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public AgentStrikeScanCheck(ActiveAiScanner activeScanner, int maxBodySize) {
        this.activeScanner = activeScanner;
        this.maxBodySize = maxBodySize;
    }

    public void setLogger(Consumer<String> logger) { this.logger = logger; }
    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    @Override
    public AuditResult activeAudit(HttpRequestResponse baseRequestResponse, AuditInsertionPoint insertionPoint) {
        try {
            TrafficContext target = TrafficContext.from(baseRequestResponse, maxBodySize);
            audit(target, insertionPoint.name(), insertionPoint.baseValue());
        } catch (RuntimeException e) {
            logError("[ScanCheck] Audit of " + insertionPoint.name() + " failed: "
                    + e.getClass().getName() + ": " + e.getMessage());
        }
        return AuditResult.auditResult();
    }

    /**
     * Submits a job for the named insertion point of the target.
     * Returns empty when the scanner is off, the point is unknown, or no class applies.
     */
    public Optional<ScanJob> audit(TrafficContext target, String pointName, String baseValue) {
        if (!activeScanner.isEnabled()) return Optional.empty();

        Optional<InjectionPoint> point = matchPoint(InjectionPoints.extract(target), pointName, baseValue);
        if (point.isEmpty()) return Optional.empty();

        Set<VulnClass> classes;
        try {
            classes = activeScanner.defaultClasses();
        } catch (ConfigException e) {
            logError("[ScanCheck] " + e.getKind() + ": " + e.getMessage());
            return Optional.empty();
        }
        classes.removeIf(c -> !activeScanner.supports(c));
        if (classes.isEmpty()) return Optional.empty();

        ScanJob job = activeScanner.submit(target, List.of(point.get()), classes);
        log("[ScanCheck] " + point.get().type() + " '" + point.get().name() + "' on " + target.getUrl()
                + " queued as job " + job.getId());
        return Optional.of(job);
    }

    /**
     * Burp names insertion points after the parameter or header. Headers match
     * case-insensitively; among several candidates the one holding the base value wins.
     */
    static Optional<InjectionPoint> matchPoint(List<InjectionPoint> points, String name, String baseValue) {
        if (name == null || name.isEmpty()) return Optional.empty();
        InjectionPoint byName = null;
        for (InjectionPoint p : points) {
            boolean sameName = p.type() == InjectionType.HEADER
                    ? p.name().equalsIgnoreCase(name)
                    : p.name().equals(name);
            if (!sameName) continue;
            if (baseValue != null && baseValue.equals(p.originalValue())) return Optional.of(p);
            if (byName == null) byName = p;
        }
        return Optional.ofNullable(byName);
    }

    @Override
    public AuditResult passiveAudit(HttpRequestResponse baseRequestResponse) {
        return AuditResult.auditResult();
    }

    @Override
    public ConsolidationAction consolidateIssues(AuditIssue newIssue, AuditIssue existingIssue) {
        if (newIssue.name().equals(existingIssue.name())
                && newIssue.baseUrl().equals(existingIssue.baseUrl())) {
            return ConsolidationAction.KEEP_EXISTING;
        }
        return ConsolidationAction.KEEP_BOTH;
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
