package org.lite.ingestion.service;

import org.lite.ingestion.dto.QueueStatsResponse;
import org.lite.ingestion.dto.SourceRef;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.model.RunPlan;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The only writer of queue entries. Every status transition goes through here.
 */
public interface DocumentQueueService {

    /**
     * Queues explicit sources under a contract, skipping those already queued for it.
     */
    Flux<QueueEntry> enqueueSources(String contractId, List<SourceRef> sources);

    /**
     * Queues the resource links of stored contracts, as bounded by the plan.
     */
    Flux<QueueEntry> enqueueFromContracts(RunPlan plan);

    Mono<Void> clearQueue();

    Mono<Long> countQueued(String contractId);

    Flux<QueueEntry> selectQueued(String contractId, int limit);

    /**
     * Takes a QUEUED entry for a job. Completes empty when the entry is no longer queued,
     * for example because an overlapping job took it first.
     */
    Mono<QueueEntry> markProcessing(QueueEntry entry, String jobId);

    Mono<QueueEntry> markCompleted(QueueEntry entry, String processedData);

    /**
     * Fails an entry unless it already reached a terminal state.
     */
    Mono<QueueEntry> markFailed(QueueEntry entry, String errorMessage);

    /**
     * Fails the entries of a job that are still processing.
     *
     * @return number of entries failed
     */
    Mono<Long> failInterrupted(String jobId);

    Flux<QueueEntry> findStale(LocalDateTime startedBefore);

    /**
     * Puts a failed entry with retries left back in the queue. Completes empty for unknown ids
     * and errors with {@link IllegalStateException} when the entry may not be requeued.
     */
    Mono<QueueEntry> requeue(String entryId);

    Mono<QueueStatsResponse> countByStatus();
}
