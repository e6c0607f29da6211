package org.lite.ingestion.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.service.DocumentProcessingOrchestrator;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.FormatConversionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/document-processing")
@RequiredArgsConstructor
@Tag(name = "Document Processing", description = "Queue contract documents, run processing jobs and follow their progress")
public class DocumentProcessingController {

    private final DocumentProcessingOrchestrator orchestrator;
    private final DocumentQueueService documentQueueService;
    private final FormatConversionService formatConversionService;

    @PostMapping
    @Operation(summary = "Start a processing job",
               description = "Queues the given sources (or the documents of stored contracts) and processes them in batches. " +
                           "Returns as soon as the job is recorded; poll the job for its counters.")
    public Mono<ResponseEntity<?>> startProcessing(@RequestBody(required = false) StartProcessingRequest request) {
        StartProcessingRequest effective = request != null ? request : new StartProcessingRequest();
        log.info("Received document processing request");

        return orchestrator.start(effective)
                .<ResponseEntity<?>>map(response -> ResponseEntity.status(HttpStatus.ACCEPTED).body(response))
                .onErrorResume(IllegalArgumentException.class, error -> Mono.just(ResponseEntity.badRequest()
                        .body(Map.of("error", error.getMessage()))))
                .onErrorResume(error -> {
                    log.error("Error starting document processing: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to start document processing: " + error.getMessage())));
                });
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get job status", description = "Counters of a processing job")
    public Mono<ResponseEntity<?>> getJobStatus(@PathVariable String jobId) {
        return orchestrator.status(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Job not found: " + jobId)))
                .onErrorResume(error -> {
                    log.error("Error reading job {}: {}", jobId, error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to read job status")));
                });
    }

    @GetMapping("/queue")
    @Operation(summary = "Queue statistics", description = "Number of queue entries per status")
    public Mono<ResponseEntity<?>> getQueueStats() {
        return documentQueueService.countByStatus()
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Error reading queue statistics: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to read queue statistics")));
                });
    }

    @GetMapping("/converter")
    @Operation(summary = "Converter pool status", description = "Running and waiting conversions")
    public Mono<ResponseEntity<?>> getConverterStatus() {
        return Mono.just(ResponseEntity.ok(formatConversionService.converterSnapshot()));
    }

    @PostMapping("/queue/{entryId}/requeue")
    @Operation(summary = "Requeue a failed entry", description = "Allowed only for failed entries with retries left")
    public Mono<ResponseEntity<?>> requeue(@PathVariable String entryId) {
        return documentQueueService.requeue(entryId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Queue entry not found: " + entryId)))
                .onErrorResume(IllegalStateException.class, error -> Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", error.getMessage()))))
                .onErrorResume(error -> {
                    log.error("Error requeueing entry {}: {}", entryId, error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to requeue entry")));
                });
    }
}
