package com.portico.backend.global.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, long remainingTokens, Duration retryAfter) {

    static RateLimitDecision allow(long remainingTokens) {
        return new RateLimitDecision(true, remainingTokens, Duration.ZERO);
    }

    static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter);
    }

    /**
     * Whole seconds for the Retry-After header, never below one.
     */
    public long retryAfterSeconds() {
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        return Math.max(1, seconds);
    }
}
