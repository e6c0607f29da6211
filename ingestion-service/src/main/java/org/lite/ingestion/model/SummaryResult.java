package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;
import org.lite.ingestion.enums.ExtractionMethod;

/**
 * Structured analysis of one document, as stored in the content index and on the queue entry.
 */
@Value
@Builder
public class SummaryResult {
    // JSON document
    String content;
    ExtractionMethod extractionMethod;
    int wordCount;
    int completionAttempts;
    boolean wasRetried;
    // The completion service never produced usable content
    boolean placeholder;
}
