package org.lite.ingestion.enums;

/**
 * Closed classification of completion-service failures.
 */
public enum CompletionErrorKind {
    GATEWAY_STATUS(true),
    NETWORK(true),
    TIMEOUT_MESSAGE(true),
    NON_RETRYABLE(false);

    private final boolean retryable;

    CompletionErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
