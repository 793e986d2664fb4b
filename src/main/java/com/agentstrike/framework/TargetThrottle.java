package com.agentstrike.framework;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Per-target spacing. The passive scanner uses the non-blocking {@link #tryAcquire};
 * active probes wait their turn with {@link #awaitSlot}.
 */
public class TargetThrottle {

    /** Past this many tracked keys, keys whose slot has already passed are dropped. */
    static final int SWEEP_THRESHOLD = 256;

    private final ConcurrentHashMap<String, Long> nextAllowed = new ConcurrentHashMap<>();
    private final LongSupplier clockMillis;

    public TargetThrottle() {
        this(System::currentTimeMillis);
    }

    public TargetThrottle(LongSupplier clockMillis) {
        this.clockMillis = clockMillis;
    }

    /**
     * Claims the key if its interval has passed since the last successful claim.
     * Returns false without waiting otherwise.
     */
    public boolean tryAcquire(String key, long intervalMillis) {
        if (intervalMillis <= 0) return true;
        long now = clockMillis.getAsLong();
        boolean[] acquired = {false};
        nextAllowed.compute(key, (k, next) -> {
            if (next == null || now >= next) {
                acquired[0] = true;
                return now + intervalMillis;
            }
            return next;
        });
        evictExpired(now);
        return acquired[0];
    }

    /**
     * Reserves the next slot for the key, then sleeps until it arrives.
     * Concurrent callers get consecutive slots {@code intervalMillis} apart.
     */
    public void awaitSlot(String key, long intervalMillis) throws InterruptedException {
        if (intervalMillis <= 0) return;
        long now = clockMillis.getAsLong();
        long[] slot = {now};
        nextAllowed.compute(key, (k, next) -> {
            slot[0] = next == null ? now : Math.max(now, next);
            return slot[0] + intervalMillis;
        });
        evictExpired(now);
        long wait = slot[0] - now;
        if (wait > 0) Thread.sleep(wait);
    }

    private void evictExpired(long now) {
        if (nextAllowed.size() <= SWEEP_THRESHOLD) return;
        nextAllowed.values().removeIf(next -> next <= now);
    }

    /** Number of keys currently tracked. */
    public int trackedKeys() {
        return nextAllowed.size();
    }

    public void reset() {
        nextAllowed.clear();
    }
}
