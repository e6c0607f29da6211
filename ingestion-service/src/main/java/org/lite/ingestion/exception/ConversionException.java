package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

public class ConversionException extends DocumentProcessingException {

    private final boolean transientFailure;

    public ConversionException(String message, boolean transientFailure) {
        super(transientFailure ? ErrorKind.RETRYABLE_TRANSIENT : ErrorKind.FATAL_TO_ENTRY, message);
        this.transientFailure = transientFailure;
    }

    public ConversionException(String message, Throwable cause) {
        super(ErrorKind.FATAL_TO_ENTRY, message, cause);
        this.transientFailure = false;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
