package com.chathub.common.ratelimit;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Independent sliding windows per key.
 *
 * <p>
 * Windows are created on first use and live as long as this limiter; keys are
 * never pruned. Different keys never contend on the same lock.
 * </p>
 */
public class KeyedRateLimiter<K> {

    private final int limit;
    private final long windowMs;
    private final Map<K, SlidingWindowLimiter> windows = new ConcurrentHashMap<>();

    public KeyedRateLimiter(int limit) {
        this(limit, SlidingWindowLimiter.DEFAULT_WINDOW_MS);
    }

    public KeyedRateLimiter(int limit, long windowMs) {
        this.limit = limit;
        this.windowMs = windowMs;
    }

    public RateLimitDecision tryAcquire(K key, long nowMs) {
        return windows.computeIfAbsent(key, k -> new SlidingWindowLimiter(limit, windowMs))
                .tryAcquire(nowMs);
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Number of keys seen so far.
     */
    public int trackedKeys() {
        return windows.size();
    }
}
