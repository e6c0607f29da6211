package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;
import org.lite.ingestion.enums.DocumentType;
import org.lite.ingestion.enums.ExtractionMethod;

@Value
@Builder
public class ExtractionResult {
    String text;
    ExtractionMethod method;
    DocumentType sourceType;
    // Filename with the extension of the detected type
    String filename;
    boolean converted;
    int wordCount;
    int pageCount;
}
