package com.agentstrike.framework;

import com.agentstrike.audit.AuditLogger;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Central findings storage. Both scanners and the tool operations report here.
 * Findings with the same dedup key (issue name + canonical base URL) collapse into one:
 * the stored finding is merged, and sinks hear only about the first occurrence.
 */
public class FindingsStore {

    private static final int MAX_FINDINGS = 10000;

    private final Map<String, Finding> findings = new LinkedHashMap<>();
    private final CopyOnWriteArrayList<IssueSink> sinks = new CopyOnWriteArrayList<>();
    private final AuditLogger audit;
    private volatile Consumer<String> errorLogger;

    public FindingsStore(AuditLogger audit) {
        this.audit = audit;
    }

    public void setErrorLogger(Consumer<String> logger) {
        this.errorLogger = logger;
    }

    public void addSink(IssueSink sink) {
        if (sink != null) {
            sinks.add(sink);
        }
    }

    public void removeSink(IssueSink sink) {
        sinks.remove(sink);
    }

    /**
     * Adds or merges a finding. Returns true when it was new.
     * Sink notification and auditing happen outside the lock.
     */
    public boolean addFinding(Finding finding) {
        synchronized (this) {
            String key = finding.dedupKey();
            Finding existing = findings.get(key);
            if (existing != null) {
                findings.put(key, existing.mergedWith(finding));
                return false;
            }
            if (findings.size() >= MAX_FINDINGS) return false;
            findings.put(key, finding);
        }

        if (audit != null) audit.findingCreated(finding);
        for (IssueSink sink : sinks) {
            try {
                sink.reportIssue(finding);
            } catch (RuntimeException e) {
                logError("[FindingsStore] Sink error: " + e.getClass().getName() + ": " + e.getMessage());
            }
        }
        return true;
    }

    /** Adds each finding in order; returns the ones that were new. */
    public List<Finding> addFindings(List<Finding> newFindings) {
        List<Finding> added = new ArrayList<>();
        for (Finding f : newFindings) {
            if (addFinding(f)) added.add(f);
        }
        return added;
    }

    public synchronized List<Finding> getAllFindings() {
        return Collections.unmodifiableList(new ArrayList<>(findings.values()));
    }

    /** Current (merged) state of the finding stored under a dedup key, or null. */
    public synchronized Finding get(String dedupKey) {
        return findings.get(dedupKey);
    }

    public synchronized List<Finding> getFindingsBySource(FindingSource source) {
        return findings.values().stream()
                .filter(f -> f.getSource() == source)
                .collect(Collectors.toList());
    }

    public synchronized List<Finding> getFindingsBySeverity(Severity severity) {
        return findings.values().stream()
                .filter(f -> f.getSeverity() == severity)
                .collect(Collectors.toList());
    }

    public synchronized int getCount() {
        return findings.size();
    }

    public synchronized void clear() {
        findings.clear();
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
