package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.ScanMode;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One active scan of one target. State and counters are updated by scanner
 * threads and may be read from anywhere.
 */
public class ScanJob {

    private final String id;
    private final TrafficContext target;
    private final List<InjectionPoint> injectionPoints;
    private final Set<VulnClass> vulnClasses;
    private final ScanMode scanMode;
    private final PayloadRisk riskCeiling;
    private final long createdAt;

    private final AtomicReference<ScanJobState> state = new AtomicReference<>(ScanJobState.CREATED);
    private final AtomicInteger planned = new AtomicInteger();
    private final AtomicInteger dispatched = new AtomicInteger();
    private final AtomicInteger skippedByRisk = new AtomicInteger();
    private final AtomicInteger skippedNoOob = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger findings = new AtomicInteger();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile String failureMessage = "";
    private volatile long finishedAt;

    public ScanJob(String id, TrafficContext target, List<InjectionPoint> injectionPoints,
                   Set<VulnClass> vulnClasses, ScanMode scanMode, PayloadRisk riskCeiling) {
        this.id = id;
        this.target = target;
        this.injectionPoints = List.copyOf(injectionPoints);
        Set<VulnClass> classes = EnumSet.noneOf(VulnClass.class);
        classes.addAll(vulnClasses);
        this.vulnClasses = Collections.unmodifiableSet(classes);
        this.scanMode = scanMode;
        this.riskCeiling = riskCeiling;
        this.createdAt = System.currentTimeMillis();
    }

    public String getId() { return id; }
    public TrafficContext getTarget() { return target; }
    public List<InjectionPoint> getInjectionPoints() { return injectionPoints; }
    public Set<VulnClass> getVulnClasses() { return vulnClasses; }
    public ScanMode getScanMode() { return scanMode; }
    public PayloadRisk getRiskCeiling() { return riskCeiling; }
    public long getCreatedAt() { return createdAt; }
    public long getFinishedAt() { return finishedAt; }
    public ScanJobState getState() { return state.get(); }
    public boolean isCancelled() { return state.get() == ScanJobState.CANCELLED; }
    public boolean isDone() { return state.get().isTerminal(); }

    public int getPlanned() { return planned.get(); }
    public int getDispatched() { return dispatched.get(); }
    public int getSkippedByRisk() { return skippedByRisk.get(); }
    public int getSkippedNoOob() { return skippedNoOob.get(); }
    public int getFailed() { return failed.get(); }
    public int getFindings() { return findings.get(); }

    /** Why the job was cancelled by an error; empty when it was not. */
    public String failureMessage() { return failureMessage; }

    /** Blocks until the job is COMPLETED or CANCELLED. Returns false on timeout. */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    // ==================== Scanner-side mutation ====================

    /** Moves {@code from → to}. Fails when the job already left {@code from} (e.g. it was cancelled). */
    boolean transition(ScanJobState from, ScanJobState to) {
        boolean moved = state.compareAndSet(from, to);
        if (moved && to.isTerminal()) markFinished();
        return moved;
    }

    /** Cancels unless already terminal. Returns true when this call cancelled the job. */
    boolean cancel(String reason) {
        while (true) {
            ScanJobState current = state.get();
            if (current.isTerminal()) return false;
            if (state.compareAndSet(current, ScanJobState.CANCELLED)) {
                if (reason != null && !reason.isEmpty()) failureMessage = reason;
                markFinished();
                for (Future<?> f : tasks) f.cancel(true);
                return true;
            }
        }
    }

    private void markFinished() {
        finishedAt = System.currentTimeMillis();
        finished.countDown();
    }

    void setPlan(int plannedCount, int riskSkipped, int oobSkipped) {
        planned.set(plannedCount);
        skippedByRisk.set(riskSkipped);
        skippedNoOob.set(oobSkipped);
    }

    void track(Future<?> task) { tasks.add(task); }
    List<Future<?>> tasks() { return tasks; }
    void recordDispatched() { dispatched.incrementAndGet(); }
    void recordFailed() { failed.incrementAndGet(); }
    void recordFinding() { findings.incrementAndGet(); }

    @Override
    public String toString() {
        return "ScanJob{" + id + " " + state.get() + " " + target.getUrl()
                + " planned=" + planned + " dispatched=" + dispatched + " skippedByRisk=" + skippedByRisk
                + " failed=" + failed + " findings=" + findings + "}";
    }
}
