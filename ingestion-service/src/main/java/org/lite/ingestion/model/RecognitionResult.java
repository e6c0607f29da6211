package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecognitionResult {
    String text;
    int totalPages;
    int pagesRecognized;
    int pagesFailed;
    int workers;

    public boolean isPartial() {
        return pagesFailed > 0;
    }
}
