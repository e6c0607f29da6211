package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

/**
 * Thrown when neither the local path, the download directory nor the URL yields the document bytes.
 */
public class SourceNotFoundException extends DocumentProcessingException {

    public SourceNotFoundException(String message) {
        super(ErrorKind.NON_RETRYABLE_INPUT, message);
    }

    public SourceNotFoundException(String message, Throwable cause) {
        super(ErrorKind.FATAL_TO_ENTRY, message, cause);
    }
}
