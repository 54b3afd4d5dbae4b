package com.example.brsr.service;

import com.example.brsr.exception.IndicatorExtractionException;
import com.example.brsr.exception.NoResultsException;
import com.example.brsr.exception.PreconditionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs a call under a {@link RetryPolicy}, blocking the calling thread between attempts.
 * <p>
 * Precondition failures and empty retrievals are rethrown immediately. Any other failure is
 * retried; once the policy gives up an {@link IndicatorExtractionException} carries the last error.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final String[] RATE_LIMIT_SIGNATURES = {
            "rate limit", "rate_limit", "ratelimit", "quota", "429", "too many requests"
    };

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, d -> Thread.sleep(d.toMillis()), () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, DoubleSupplier jitterSource) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.jitterSource = jitterSource;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * @param operation label used in logs and in the final error message
     * @param call      the call to run
     * @return the first successful result
     * @throws IndicatorExtractionException when every attempt failed
     */
    public <T> T execute(String operation, Supplier<T> call) {
        RuntimeException lastError = null;
        int attempt = 1;
        for (; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                lastError = e;
                if (!policy.canRetryAfter(attempt)) {
                    break;
                }
                boolean rateLimited = isRateLimited(e);
                Duration delay = policy.delayBeforeRetry(attempt, rateLimited, jitterSource.getAsDouble());
                log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms{}",
                        operation, attempt, policy.maxAttempts(), rootCauseMessage(e), delay.toMillis(),
                        rateLimited ? " (rate limited)" : "");
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IndicatorExtractionException(
                            operation + " interrupted while waiting to retry", attempt, e);
                }
            }
        }
        int attempts = Math.min(attempt, policy.maxAttempts());
        throw new IndicatorExtractionException("Error in " + operation + " after " + attempts
                + " attempts: " + rootCauseMessage(lastError), attempts, lastError);
    }

    public static boolean isRetryable(Throwable error) {
        return !(error instanceof PreconditionFailedException) && !(error instanceof NoResultsException);
    }

    public static boolean isRateLimited(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg == null) continue;
            String lower = msg.toLowerCase(Locale.ROOT);
            for (String signature : RATE_LIMIT_SIGNATURES) {
                if (lower.contains(signature)) {
                    return true;
                }
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    static String rootCauseMessage(Throwable e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
