package org.lite.ingestion.service;

import org.lite.ingestion.dto.JobStatusResponse;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.dto.StartProcessingResponse;
import reactor.core.publisher.Mono;

public interface DocumentProcessingOrchestrator {

    /**
     * Queues and selects the documents of a run, records the job and starts processing it in the
     * background. Completes as soon as the job is recorded.
     */
    Mono<StartProcessingResponse> start(StartProcessingRequest request);

    /**
     * @return the job's counters, or empty for an unknown id
     */
    Mono<JobStatusResponse> status(String jobId);
}
