package org.lite.ingestion.concurrency;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Capped exponential backoff without jitter.
 * <p>
 * The delay before attempt {@code k + 1} is {@code min(initialBackoff * 2^(k-1), maxBackoff)}:
 * non-decreasing in {@code k} and never above the ceiling. {@code maxAttempts} counts the first
 * call, so {@code maxAttempts - 1} retries are made at most.
 */
public final class BackoffPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public BackoffPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Delay to wait before the given attempt; zero for the first one.
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        int exponent = Math.min(attempt - 2, 30);
        try {
            Duration delay = initialBackoff.multipliedBy(1L << exponent);
            return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
        } catch (ArithmeticException overflow) {
            return maxBackoff;
        }
    }

    /**
     * Reactor retry spec applying this policy to errors accepted by {@code retryable}. Rejected
     * errors propagate untouched after the first attempt; exhaustion raises
     * {@link RetryExhaustedException} carrying the attempt count and the last failure.
     */
    public RetryBackoffSpec toRetrySpec(Predicate<? super Throwable> retryable) {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .jitter(0d)
                .filter(retryable)
                .onRetryExhaustedThrow((spec, signal) ->
                        new RetryExhaustedException((int) signal.totalRetries() + 1, signal.failure()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }
}
