package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

/**
 * A recognition worker lost its engine handle mid-job. The page job may be retried on another worker.
 */
public class TransientWorkerException extends DocumentProcessingException {

    public TransientWorkerException(String message, Throwable cause) {
        super(ErrorKind.RETRYABLE_TRANSIENT, message, cause);
    }

    public TransientWorkerException(String message) {
        super(ErrorKind.RETRYABLE_TRANSIENT, message);
    }
}
