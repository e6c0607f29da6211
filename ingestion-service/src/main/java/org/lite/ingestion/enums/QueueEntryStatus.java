package org.lite.ingestion.enums;

/**
 * Lifecycle of a queued document.
 * Status flow: QUEUED -> PROCESSING -> COMPLETED | FAILED
 */
public enum QueueEntryStatus {
    QUEUED,        // Waiting to be picked up by a batch
    PROCESSING,    // Owned by a running pipeline task
    COMPLETED,     // Summarized and indexed (or served from the index)
    FAILED;        // Terminal failure or retries exhausted

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
