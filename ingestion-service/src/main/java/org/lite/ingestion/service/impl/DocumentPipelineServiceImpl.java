package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.lite.ingestion.exception.DocumentProcessingException;
import org.lite.ingestion.model.DocumentOutcome;
import org.lite.ingestion.model.GateResult;
import org.lite.ingestion.service.DocumentPipelineService;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.DocumentSourceService;
import org.lite.ingestion.service.IndexingGateService;
import org.lite.ingestion.service.SummarizationService;
import org.lite.ingestion.service.TextExtractionService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Per-document flow: index check, source resolution, conversion and extraction, summarization,
 * index write, status update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPipelineServiceImpl implements DocumentPipelineService {

    private final DocumentQueueService documentQueueService;
    private final IndexingGateService indexingGateService;
    private final DocumentSourceService documentSourceService;
    private final TextExtractionService textExtractionService;
    private final SummarizationService summarizationService;
    private final IngestionProperties properties;

    @Override
    public Mono<DocumentOutcome> process(QueueEntry entry, String jobId) {
        Duration timeout = properties.getPipeline().getDocumentTimeout();

        return documentQueueService.markProcessing(entry, jobId)
                .flatMap(processing -> run(processing)
                        .timeout(timeout)
                        .flatMap(gate -> documentQueueService.markCompleted(processing, gate.getContent())
                                .map(saved -> DocumentOutcome.builder()
                                        .entryId(saved.getId())
                                        .filename(saved.getFilename())
                                        .status(QueueEntryStatus.COMPLETED)
                                        .cached(gate.isCached())
                                        .build()))
                        .onErrorResume(error -> fail(processing, describe(error, timeout), error)))
                .switchIfEmpty(Mono.fromSupplier(() -> DocumentOutcome.claimedElsewhere(entry)))
                .onErrorResume(error -> {
                    log.error("❌ Could not start processing {}: {}", entry.getFilename(), error.getMessage());
                    return fail(entry, error.getMessage(), error);
                });
    }

    private Mono<GateResult> run(QueueEntry entry) {
        return Mono.defer(() -> indexingGateService.resolve(entry, () -> documentSourceService.resolve(entry)
                .flatMap(textExtractionService::extract)
                .flatMap(extraction -> summarizationService.summarize(extraction, entry.getContractNoticeId()))));
    }

    private Mono<DocumentOutcome> fail(QueueEntry entry, String message, Throwable error) {
        log.error("❌ {} failed [{}]: {}", entry.getFilename(), DocumentProcessingException.kindOf(error), message);
        DocumentOutcome outcome = DocumentOutcome.builder()
                .entryId(entry.getId())
                .filename(entry.getFilename())
                .status(QueueEntryStatus.FAILED)
                .errorMessage(message)
                .build();
        return documentQueueService.markFailed(entry, message)
                .thenReturn(outcome)
                .onErrorResume(persistError -> {
                    log.error("❌ Could not record failure of {}: {}", entry.getFilename(), persistError.getMessage());
                    return Mono.just(outcome);
                });
    }

    private String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "Timeout after " + timeout.toSeconds() + "s";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
