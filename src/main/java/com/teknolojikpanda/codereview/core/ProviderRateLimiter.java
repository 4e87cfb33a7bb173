package com.teknolojikpanda.codereview.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Enforces a minimum gap between dispatches to the same provider.
 * <p>
 * A bucket of one per provider id: callers block until the interval since the previous dispatch
 * has elapsed, then the new dispatch time is recorded. Uses the monotonic clock.
 */
public class ProviderRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    /**
     * Waits for the provider's slot and records the dispatch.
     *
     * @return the recorded dispatch time in {@link System#nanoTime()} units
     * @throws InterruptedException if interrupted while waiting
     */
    public long acquire(@Nonnull String providerId, long minIntervalMs) throws InterruptedException {
        Objects.requireNonNull(providerId, "providerId");
        Slot slot = slots.computeIfAbsent(providerId, key -> new Slot());
        synchronized (slot) {
            long now = System.nanoTime();
            if (slot.requestCount > 0 && minIntervalMs > 0) {
                long intervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMs);
                long waitNanos = slot.lastDispatchNanos + intervalNanos - now;
                if (waitNanos > 0) {
                    log.debug("Rate limiter [{}] waiting {}ms", providerId, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                    now = System.nanoTime();
                    while (now - slot.lastDispatchNanos < intervalNanos) {
                        TimeUnit.NANOSECONDS.sleep(slot.lastDispatchNanos + intervalNanos - now);
                        now = System.nanoTime();
                    }
                }
            }
            slot.lastDispatchNanos = now;
            slot.requestCount++;
            return now;
        }
    }

    /**
     * Number of dispatches recorded for the provider.
     */
    public int requestCount(@Nonnull String providerId) {
        Slot slot = slots.get(providerId);
        if (slot == null) {
            return 0;
        }
        synchronized (slot) {
            return slot.requestCount;
        }
    }

    public void reset() {
        slots.clear();
    }

    private static final class Slot {
        private long lastDispatchNanos;
        private int requestCount;
    }
}
