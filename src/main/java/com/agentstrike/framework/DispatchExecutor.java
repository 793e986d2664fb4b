package com.agentstrike.framework;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded worker pool for AI dispatches and scan probes.
 * A full queue rejects the task (counted and logged) instead of growing without bound;
 * callers get {@code null} back and report the work as failed.
 * Resizing and cancelling act on the one live pool; it is never replaced.
 */
public class DispatchExecutor {

    private final String name;
    private final int maxQueueSize;
    private final ThreadPoolExecutor executor;
    private volatile int poolSize;
    private final Object resizeLock = new Object();
    private final AtomicLong rejectedTaskCount = new AtomicLong(0);
    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private volatile Consumer<String> logger;
    private volatile boolean unloading = false;

    public DispatchExecutor(String name, int poolSize, int maxQueueSize) {
        this.name = name;
        this.poolSize = Math.max(1, poolSize);
        this.maxQueueSize = Math.max(1, maxQueueSize);
        this.executor = createPool(this.poolSize);
    }

    /** Sets the logger for warnings (routed to api.logging().logToOutput() by the extension). */
    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
    }

    public String getName() { return name; }

    /** Total tasks rejected because the queue was full or the pool was shutting down. */
    public long getRejectedTaskCount() {
        return rejectedTaskCount.get();
    }

    private ThreadPoolExecutor createPool(int size) {
        return new ThreadPoolExecutor(
                size, size, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(maxQueueSize),
                r -> {
                    Thread t = new Thread(r, "AgentStrike-" + name + "-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                (rejectedTask, pool) -> {
                    long total = rejectedTaskCount.incrementAndGet();
                    log("[" + name + "] WARNING: task rejected (queue full at " + maxQueueSize
                            + " tasks or pool stopping). Total rejected: " + total);
                    throw new RejectedExecutionException(name + " saturated");
                }
        );
    }

    /**
     * Submits a task. Returns null when the task could not be queued.
     */
    public <T> Future<T> submit(Callable<T> task) {
        if (executor.isShutdown()) return null;
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            return null;
        }
    }

    /**
     * Submits a fire-and-forget task. Returns null when the task could not be queued.
     * NullPointerExceptions thrown by Burp's API proxy during extension unload are dropped.
     */
    public Future<?> submit(Runnable task) {
        if (executor.isShutdown()) return null;
        try {
            return executor.submit(guard(task));
        } catch (RejectedExecutionException e) {
            return null;
        }
    }

    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (NullPointerException e) {
                // Burp invalidates its API proxy on unload, NPEs are expected then
                if (!unloading) {
                    log("[" + name + "] NPE in task: " + e.getMessage());
                }
            }
        };
    }

    /**
     * Changes the thread count of the live pool. Growing raises the maximum before the
     * core size, shrinking lowers the core size first. When shrinking, tasks already
     * running finish on their threads, which then retire; queued tasks wait for the
     * smaller pool.
     */
    public void resize(int newSize) {
        int size = Math.max(1, newSize);
        synchronized (resizeLock) {
            if (size == this.poolSize) return;
            if (size > executor.getMaximumPoolSize()) {
                executor.setMaximumPoolSize(size);
                executor.setCorePoolSize(size);
            } else {
                executor.setCorePoolSize(size);
                executor.setMaximumPoolSize(size);
            }
            this.poolSize = size;
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getQueueSize() {
        return executor.getQueue().size();
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    /**
     * Drops every queued task and cancels its future. Running tasks are left to their
     * owners, which cancel the futures they track.
     * Returns the number of tasks that never started.
     */
    public int cancelAll() {
        List<Runnable> notRun = new ArrayList<>();
        executor.getQueue().drainTo(notRun);
        for (Runnable r : notRun) {
            if (r instanceof Future) {
                ((Future<?>) r).cancel(false);
            }
        }
        return notRun.size();
    }

    public void setUnloading(boolean unloading) {
        this.unloading = unloading;
    }

    /** Graceful drain for up to {@code grace}, then forced interrupt. Never throws. */
    public void shutdown(Duration grace) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }
}
