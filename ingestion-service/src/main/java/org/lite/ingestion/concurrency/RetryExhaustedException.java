package org.lite.ingestion.concurrency;

/**
 * Raised when every attempt allowed by a {@link BackoffPolicy} failed with a retryable error.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Failed after " + attempts + " attempts: " + (lastFailure != null ? lastFailure.getMessage() : "unknown error"), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
