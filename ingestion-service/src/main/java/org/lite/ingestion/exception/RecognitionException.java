package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

public class RecognitionException extends DocumentProcessingException {

    public RecognitionException(String message) {
        super(ErrorKind.RESOURCE_EXHAUSTION, message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE_EXHAUSTION, message, cause);
    }
}
