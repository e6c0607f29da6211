package org.lite.ingestion.service;

import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.CompletionResult;
import reactor.core.publisher.Mono;

public interface CompletionClient {

    /**
     * Always completes with a result; failures come back as placeholder content.
     */
    Mono<CompletionResult> complete(CompletionRequest request);
}
