package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

public class ExtractionException extends DocumentProcessingException {

    public ExtractionException(String message) {
        super(ErrorKind.NON_RETRYABLE_INPUT, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.NON_RETRYABLE_INPUT, message, cause);
    }
}
