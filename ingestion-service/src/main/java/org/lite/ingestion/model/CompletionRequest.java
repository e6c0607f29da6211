package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompletionRequest {
    String systemPrompt;
    String userPrompt;
    // Ask the provider for a JSON object response
    boolean jsonResponse;
    Integer maxTokens;
    // Short label used in log lines
    String label;
}
