package org.lite.ingestion.service;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Store of processed document content, keyed by document identifier.
 */
public interface ContentIndexService {

    Mono<Boolean> exists(String identifier);

    /**
     * @return the stored content, or empty when nothing is indexed under the identifier
     */
    Mono<String> find(String identifier);

    /**
     * Stores content under the identifier, replacing any previous version.
     */
    Mono<Void> index(String identifier, String content, Map<String, Object> metadata);
}
