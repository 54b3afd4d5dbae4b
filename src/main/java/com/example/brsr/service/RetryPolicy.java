package com.example.brsr.service;

import java.time.Duration;

/**
 * Exponential backoff policy shared by retrieval and model calls.
 * <p>
 * {@link #delayBeforeRetry} is a pure function of its arguments: with the defaults it yields
 * 1s, 2s, 4s for attempts 1, 2, 3 and twice that when the failure looked like a rate limit.
 *
 * @param maxAttempts         total attempts, first call included
 * @param baseDelay           delay after the first failed attempt
 * @param multiplier          growth factor between consecutive delays
 * @param jitter              relative spread in [0, 1]; 0 disables jitter
 * @param rateLimitMultiplier extra factor applied to rate-limited failures
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, double jitter,
                          double rateLimitMultiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1]");
        }
        if (rateLimitMultiplier < 1.0) {
            throw new IllegalArgumentException("rateLimitMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, 0.0, 2.0);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt      1-based number of the attempt that just failed
     * @param rateLimited  whether the failure looked like a rate limit
     * @param jitterSample value in [0, 1), ignored when jitter is 0
     */
    public Duration delayBeforeRetry(int attempt, boolean rateLimited, double jitterSample) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (rateLimited) {
            millis *= rateLimitMultiplier;
        }
        if (jitter > 0.0) {
            millis *= 1.0 + jitter * (2.0 * jitterSample - 1.0);
        }
        return Duration.ofMillis(Math.round(Math.max(0.0, millis)));
    }

    public boolean canRetryAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
