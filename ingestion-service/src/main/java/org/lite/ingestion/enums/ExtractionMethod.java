package org.lite.ingestion.enums;

public enum ExtractionMethod {
    DIRECT,
    PLAIN_TEXT,
    OCR
}
