package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GeneratedSection {
    public static final String STATUS_GENERATED = "generated";
    public static final String STATUS_ERROR = "error";

    String title;
    String content;
    String status;
    int wordCount;
    int attempts;
    boolean wasRetried;
}
