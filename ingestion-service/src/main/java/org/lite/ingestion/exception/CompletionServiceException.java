package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

/**
 * Non-success HTTP answer of the completion service.
 */
public class CompletionServiceException extends DocumentProcessingException {

    private final int statusCode;

    public CompletionServiceException(int statusCode, String message) {
        super(ErrorKind.RETRYABLE_TRANSIENT, "HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
