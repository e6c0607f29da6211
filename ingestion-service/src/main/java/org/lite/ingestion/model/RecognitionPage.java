package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

/**
 * What recognition made of one page.
 */
@Value
@Builder
public class RecognitionPage {
    int pageNumber;
    String text;
    boolean success;
    String errorMessage;
    int attempts;

    public static RecognitionPage recognized(int pageNumber, String text, int attempts) {
        return RecognitionPage.builder().pageNumber(pageNumber).text(text).success(true).attempts(attempts).build();
    }

    public static RecognitionPage failed(int pageNumber, String errorMessage, int attempts) {
        return RecognitionPage.builder().pageNumber(pageNumber).errorMessage(errorMessage).attempts(attempts).build();
    }
}
