package com.devseo.audit.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Computes the pause before a retry. {@code retryNumber} starts at 1 for the first retry.
 */
@FunctionalInterface
public interface Backoff {

    Duration delay(int retryNumber, Duration baseDelay, Exception failure);

    static Backoff fixed() {
        return (retryNumber, baseDelay, failure) -> baseDelay;
    }

    static Backoff linear() {
        return (retryNumber, baseDelay, failure) -> baseDelay.multipliedBy(Math.max(1, retryNumber));
    }

    static Backoff exponential() {
        return (retryNumber, baseDelay, failure) ->
            baseDelay.multipliedBy(1L << Math.min(30, Math.max(0, retryNumber - 1)));
    }

    static Backoff byFailure(Predicate<Exception> matcher, Backoff whenMatched, Backoff otherwise) {
        return (retryNumber, baseDelay, failure) -> matcher.test(failure)
            ? whenMatched.delay(retryNumber, baseDelay, failure)
            : otherwise.delay(retryNumber, baseDelay, failure);
    }
}
