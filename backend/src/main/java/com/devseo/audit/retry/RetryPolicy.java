package com.devseo.audit.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Bounded retry: one initial attempt plus at most {@code maxRetries} retries, pausing
 * according to the {@link Backoff} between attempts.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Backoff backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, Backoff backoff, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public static RetryPolicy linear(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, Backoff.linear(), Sleeper.THREAD);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, Backoff.exponential(), Sleeper.THREAD);
    }

    public static RetryPolicy fixed(int maxRetries, Duration baseDelay) {
        return new RetryPolicy(maxRetries, baseDelay, Backoff.fixed(), Sleeper.THREAD);
    }

    public RetryPolicy withSleeper(Sleeper replacement) {
        return new RetryPolicy(maxRetries, baseDelay, backoff, replacement);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public Duration delayBeforeRetry(int retryNumber, Exception failure) {
        Duration delay = backoff.delay(retryNumber, baseDelay, failure);
        return delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    /**
     * Sleeps before the given retry. Returns false when the thread was interrupted,
     * in which case the interrupt flag is restored and the caller should stop retrying.
     */
    public boolean pause(int retryNumber, Exception failure) {
        try {
            sleeper.sleep(delayBeforeRetry(retryNumber, failure));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Runs {@code call} until it succeeds or the retries are used up; the last failure is rethrown.
     */
    public <T> T execute(String operation, Callable<T> call) throws Exception {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts(); attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                lastFailure = e;
                if (attempt >= maxAttempts()) {
                    break;
                }
                Duration delay = delayBeforeRetry(attempt, e);
                log.warn(
                    "Retry {}/{} for {} in {}ms: {}",
                    attempt,
                    maxRetries,
                    operation,
                    delay.toMillis(),
                    e.getMessage()
                );
                if (!pause(attempt, e)) {
                    break;
                }
            }
        }
        throw lastFailure;
    }
}
