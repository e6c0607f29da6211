package org.lite.ingestion.service;

import org.lite.ingestion.model.CompletionRequest;
import reactor.core.publisher.Mono;

/**
 * One raw call to the completion service. Errors are signalled as-is; retrying is up to the caller.
 */
public interface CompletionTransport {

    /**
     * @return the text content of the first choice
     */
    Mono<String> send(CompletionRequest request);
}
