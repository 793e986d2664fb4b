package com.agentstrike.framework;

import com.agentstrike.support.ManualClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetThrottleTest {

    @Test
    void try_acquire_allows_one_claim_per_interval_per_key() {
        ManualClock clock = new ManualClock(1_000);
        TargetThrottle throttle = new TargetThrottle(clock);

        assertTrue(throttle.tryAcquire("a.example.com", 10_000));
        clock.advance(2_000);
        assertFalse(throttle.tryAcquire("a.example.com", 10_000));
        assertTrue(throttle.tryAcquire("b.example.com", 10_000));
        clock.advance(8_000);
        assertTrue(throttle.tryAcquire("a.example.com", 10_000));
    }

    @Test
    void zero_interval_never_throttles() {
        TargetThrottle throttle = new TargetThrottle(new ManualClock(0));
        for (int i = 0; i < 5; i++) {
            assertTrue(throttle.tryAcquire("k", 0));
        }
    }

    @Test
    void await_slot_spaces_consecutive_callers() throws InterruptedException {
        TargetThrottle throttle = new TargetThrottle();
        long start = System.nanoTime();
        throttle.awaitSlot("host", 100);
        throttle.awaitSlot("host", 100);
        throttle.awaitSlot("host", 100);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(elapsedMs >= 180, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void keys_whose_slot_has_passed_are_evicted() {
        ManualClock clock = new ManualClock(0);
        TargetThrottle throttle = new TargetThrottle(clock);
        for (int i = 0; i < TargetThrottle.SWEEP_THRESHOLD; i++) {
            assertTrue(throttle.tryAcquire("host-" + i + ".example.com", 1_000));
        }
        assertEquals(TargetThrottle.SWEEP_THRESHOLD, throttle.trackedKeys());

        clock.advance(5_000);
        assertTrue(throttle.tryAcquire("late.example.com", 1_000));

        assertEquals(1, throttle.trackedKeys());
        // An evicted key is simply allowed again
        assertTrue(throttle.tryAcquire("host-0.example.com", 1_000));
        assertFalse(throttle.tryAcquire("late.example.com", 1_000));
    }

    @Test
    void keys_still_inside_their_window_are_kept() {
        ManualClock clock = new ManualClock(0);
        TargetThrottle throttle = new TargetThrottle(clock);
        for (int i = 0; i <= TargetThrottle.SWEEP_THRESHOLD; i++) {
            throttle.tryAcquire("host-" + i + ".example.com", 60_000);
        }
        assertEquals(TargetThrottle.SWEEP_THRESHOLD + 1, throttle.trackedKeys());
        assertFalse(throttle.tryAcquire("host-0.example.com", 60_000));
    }

    @Test
    void reset_forgets_all_keys() {
        ManualClock clock = new ManualClock(0);
        TargetThrottle throttle = new TargetThrottle(clock);
        assertTrue(throttle.tryAcquire("k", 60_000));
        assertFalse(throttle.tryAcquire("k", 60_000));
        throttle.reset();
        assertTrue(throttle.tryAcquire("k", 60_000));
    }
}
