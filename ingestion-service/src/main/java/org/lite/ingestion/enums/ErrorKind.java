package org.lite.ingestion.enums;

/**
 * Failure taxonomy of the ingestion pipeline.
 */
public enum ErrorKind {
    RETRYABLE_TRANSIENT,   // Gateway/timeout class errors, retried inside the failing stage
    NON_RETRYABLE_INPUT,   // Unsupported type, corrupt or empty extraction result
    RESOURCE_EXHAUSTION,   // Recognition produced no usable page
    FATAL_TO_ENTRY         // Anything else; fails the owning entry only
}
