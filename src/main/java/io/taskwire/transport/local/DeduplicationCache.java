package io.taskwire.transport.local;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;

/**
 * Sliding-window record of envelope ids. An id is a duplicate while its entry has not expired;
 * each sighting outside the window restarts it.
 */
public final class DeduplicationCache {
    private final ConcurrentMap<String, Long> expiries = new ConcurrentHashMap<>();
    private final Object sweepLock = new Object();
    private final long windowMs;
    private final int maxEntries;
    private final LongSupplier clock;
    private volatile long lastSweepMs;

    public DeduplicationCache(long windowMs, int maxEntries, LongSupplier clock) {
        if (windowMs <= 0) {
            throw new IllegalArgumentException("dedup window must be > 0: " + windowMs);
        }
        this.windowMs = windowMs;
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
        this.lastSweepMs = clock.getAsLong();
    }

    /**
     * Records {@code id} and reports whether it is new.
     *
     * @return false when the id was already seen inside the window
     */
    public boolean register(String id) {
        if (id == null || id.isBlank()) {
            return true;
        }
        long nowMs = clock.getAsLong();
        long expireAt = nowMs + windowMs;
        boolean[] fresh = {false};
        expiries.compute(id, (key, existing) -> {
            if (existing != null && existing > nowMs) {
                return existing;
            }
            fresh[0] = true;
            return expireAt;
        });
        if (fresh[0]) {
            maybeSweep(nowMs);
        }
        return fresh[0];
    }

    public void forget(String id) {
        if (id != null) {
            expiries.remove(id);
        }
    }

    public int size() {
        return expiries.size();
    }

    /**
     * Evicts expired entries, then the entries closest to expiry while the cache is over its cap.
     *
     * @return number of evicted entries
     */
    public int sweep() {
        long nowMs = clock.getAsLong();
        synchronized (sweepLock) {
            return sweepLocked(nowMs);
        }
    }

    public void clear() {
        expiries.clear();
    }

    private void maybeSweep(long nowMs) {
        long sweepInterval = Math.max(5_000L, Math.min(windowMs, 30_000L));
        int softCap = maxEntries * 2;
        if ((nowMs - lastSweepMs) < sweepInterval && expiries.size() <= softCap) {
            return;
        }
        synchronized (sweepLock) {
            if ((nowMs - lastSweepMs) < sweepInterval && expiries.size() <= softCap) {
                return;
            }
            sweepLocked(nowMs);
        }
    }

    private int sweepLocked(long nowMs) {
        int evicted = 0;
        for (Map.Entry<String, Long> entry : new ArrayList<>(expiries.entrySet())) {
            if (entry.getValue() <= nowMs && expiries.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        int oversize = expiries.size() - maxEntries;
        if (oversize > 0) {
            List<Map.Entry<String, Long>> byExpire = new ArrayList<>(expiries.entrySet());
            byExpire.sort(Map.Entry.comparingByValue());
            for (int i = 0; i < oversize && i < byExpire.size(); i++) {
                Map.Entry<String, Long> victim = byExpire.get(i);
                if (expiries.remove(victim.getKey(), victim.getValue())) {
                    evicted++;
                }
            }
        }
        lastSweepMs = nowMs;
        return evicted;
    }
}
