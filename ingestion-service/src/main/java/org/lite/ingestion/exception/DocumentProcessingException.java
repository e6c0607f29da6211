package org.lite.ingestion.exception;

import org.lite.ingestion.enums.ErrorKind;

/**
 * Base failure of a pipeline stage. The kind decides whether the failing stage may retry;
 * at the pipeline boundary every kind fails the owning entry only.
 */
public class DocumentProcessingException extends RuntimeException {

    private final ErrorKind kind;

    public DocumentProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DocumentProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof DocumentProcessingException dpe) {
            return dpe.getKind();
        }
        return ErrorKind.FATAL_TO_ENTRY;
    }
}
