package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversionResult {
    boolean success;
    byte[] pdfContent;
    // False when the source already was a PDF
    boolean converted;
    int attempts;
    String failureReason;

    public static ConversionResult passthrough(byte[] pdfContent) {
        return ConversionResult.builder()
                .success(true)
                .pdfContent(pdfContent)
                .converted(false)
                .attempts(0)
                .build();
    }

    public static ConversionResult converted(byte[] pdfContent, int attempts) {
        return ConversionResult.builder()
                .success(true)
                .pdfContent(pdfContent)
                .converted(true)
                .attempts(attempts)
                .build();
    }
}
