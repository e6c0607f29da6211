package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

/**
 * Content returned to callers of the completion client. Failures are reported as a
 * placeholder content rather than an error signal.
 */
@Value
@Builder
public class CompletionResult {
    String content;
    boolean success;
    int attempts;
    boolean wasRetried;
    String errorMessage;

    public static CompletionResult succeeded(String content, int attempts) {
        return CompletionResult.builder()
                .content(content)
                .success(true)
                .attempts(attempts)
                .wasRetried(attempts > 1)
                .build();
    }

    public static CompletionResult placeholder(String errorMessage, int attempts) {
        String content = attempts > 1
                ? "[Content generation failed after " + attempts + " attempts: " + errorMessage + "]"
                : "[Content generation failed: " + errorMessage + "]";
        return CompletionResult.builder()
                .content(content)
                .success(false)
                .attempts(attempts)
                .wasRetried(attempts > 1)
                .errorMessage(errorMessage)
                .build();
    }
}
