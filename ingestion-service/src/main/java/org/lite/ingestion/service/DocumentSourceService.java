package org.lite.ingestion.service;

import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.model.SourceDocument;
import reactor.core.publisher.Mono;

public interface DocumentSourceService {

    /**
     * Loads the bytes of an entry's document from its local path, the download directory or its URL,
     * and determines their type.
     */
    Mono<SourceDocument> resolve(QueueEntry entry);
}
