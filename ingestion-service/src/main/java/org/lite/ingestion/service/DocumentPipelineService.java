package org.lite.ingestion.service;

import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.model.DocumentOutcome;
import reactor.core.publisher.Mono;

public interface DocumentPipelineService {

    /**
     * Runs one entry through the whole pipeline and records its final status. Never errors:
     * every failure ends as a failed outcome of this entry alone.
     */
    Mono<DocumentOutcome> process(QueueEntry entry, String jobId);
}
