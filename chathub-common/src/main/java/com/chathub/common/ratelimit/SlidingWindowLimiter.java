package com.chathub.common.ratelimit;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window admission control over a trailing time interval.
 *
 * <p>
 * Keeps the timestamps of admitted events in arrival order. A check first evicts
 * every timestamp at least one window old, then rejects when the remaining count
 * has reached the limit. Rejected events are not recorded.
 * </p>
 *
 * <p>
 * Callers pass the current time explicitly; instances are safe for concurrent use.
 * </p>
 */
public class SlidingWindowLimiter {

    public static final long DEFAULT_WINDOW_MS = 60_000L;

    private final int limit;
    private final long windowMs;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public SlidingWindowLimiter(int limit) {
        this(limit, DEFAULT_WINDOW_MS);
    }

    public SlidingWindowLimiter(int limit, long windowMs) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0: " + windowMs);
        }
        this.limit = limit;
        this.windowMs = windowMs;
    }

    /**
     * Admit and record one event at {@code nowMs}, or report how long to wait.
     */
    public synchronized RateLimitDecision tryAcquire(long nowMs) {
        evictExpired(nowMs);

        if (timestamps.size() >= limit) {
            Long oldest = timestamps.peekFirst();
            long remainingMs = oldest != null ? windowMs - (nowMs - oldest) : windowMs;
            // round up so waiting the reported time always frees a slot
            long waitSeconds = (remainingMs + 999) / 1000;
            return RateLimitDecision.reject(waitSeconds);
        }

        timestamps.addLast(nowMs);
        return RateLimitDecision.allow();
    }

    /**
     * Number of events currently inside the window.
     */
    public synchronized int inWindow(long nowMs) {
        evictExpired(nowMs);
        return timestamps.size();
    }

    public int getLimit() {
        return limit;
    }

    public long getWindowMs() {
        return windowMs;
    }

    private void evictExpired(long nowMs) {
        while (!timestamps.isEmpty() && nowMs - timestamps.peekFirst() >= windowMs) {
            timestamps.pollFirst();
        }
    }
}
