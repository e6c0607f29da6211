package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

public class SummarizationException extends DocumentProcessingException {

    public SummarizationException(String message) {
        super(ErrorKind.FATAL_TO_ENTRY, message);
    }
}
