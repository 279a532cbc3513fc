package com.chathub.common.ratelimit;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed     whether the event was admitted (and recorded)
 * @param waitSeconds seconds until the next event would be admitted; 0 when allowed, at least 1 otherwise
 */
public record RateLimitDecision(boolean allowed, long waitSeconds) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0);

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision reject(long waitSeconds) {
        return new RateLimitDecision(false, Math.max(1, waitSeconds));
    }
}
