package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

/**
 * Thrown for ZIP archives and formats the pipeline cannot convert or read.
 */
public class UnsupportedDocumentException extends DocumentProcessingException {

    public UnsupportedDocumentException(String filename, String documentType) {
        super(ErrorKind.NON_RETRYABLE_INPUT,
                String.format("Unsupported document type '%s': %s", documentType, filename));
    }
}
