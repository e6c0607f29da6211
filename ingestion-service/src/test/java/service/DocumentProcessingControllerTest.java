package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ingestion.concurrency.ResourcePool;
import org.lite.ingestion.controller.DocumentProcessingController;
import org.lite.ingestion.dto.JobStatusResponse;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.dto.StartProcessingResponse;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.lite.ingestion.service.DocumentProcessingOrchestrator;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.FormatConversionService;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingControllerTest {

    @Mock
    private DocumentProcessingOrchestrator orchestrator;

    @Mock
    private DocumentQueueService documentQueueService;

    @Mock
    private FormatConversionService formatConversionService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new DocumentProcessingController(orchestrator, documentQueueService, formatConversionService))
                .build();
    }

    @Test
    void testStartProcessing_Accepted() {
        when(orchestrator.start(any(StartProcessingRequest.class))).thenReturn(Mono.just(StartProcessingResponse.builder()
                .jobId("job-1")
                .documentsCount(3)
                .batchSize(1)
                .testMode(true)
                .processingMethod("sequential")
                .message("Processing started for 3 documents")
                .build()));

        webTestClient.post().uri("/api/document-processing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"limit\":3}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("job-1")
                .jsonPath("$.processingMethod").isEqualTo("sequential");
    }

    @Test
    void testStartProcessing_InvalidRequest() {
        when(orchestrator.start(any(StartProcessingRequest.class)))
                .thenReturn(Mono.error(new IllegalArgumentException("contractId is required when sources are given")));

        webTestClient.post().uri("/api/document-processing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"sources\":[{\"url\":\"https://sam.gov/files/sow.pdf\"}]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("contractId is required when sources are given");
    }

    @Test
    void testGetJobStatus() {
        when(orchestrator.status("job-1")).thenReturn(Mono.just(JobStatusResponse.builder()
                .jobId("job-1")
                .status("completed")
                .recordsProcessed(4)
                .errorsCount(1)
                .documentsCount(5)
                .build()));
        when(orchestrator.status("missing")).thenReturn(Mono.empty());

        webTestClient.get().uri("/api/document-processing/jobs/job-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("completed")
                .jsonPath("$.recordsProcessed").isEqualTo(4)
                .jsonPath("$.errorsCount").isEqualTo(1);

        webTestClient.get().uri("/api/document-processing/jobs/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Job not found: missing");
    }

    @Test
    void testRequeue() {
        when(documentQueueService.requeue("entry-1")).thenReturn(Mono.just(QueueEntry.builder()
                .id("entry-1")
                .status(QueueEntryStatus.QUEUED)
                .build()));
        when(documentQueueService.requeue("entry-2")).thenReturn(Mono.error(new IllegalStateException("Entry entry-2 cannot be requeued")));
        when(documentQueueService.requeue("entry-3")).thenReturn(Mono.empty());

        webTestClient.post().uri("/api/document-processing/queue/entry-1/requeue")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("QUEUED");
        webTestClient.post().uri("/api/document-processing/queue/entry-2/requeue")
                .exchange()
                .expectStatus().isEqualTo(409);
        webTestClient.post().uri("/api/document-processing/queue/entry-3/requeue")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testConverterStatus() {
        when(formatConversionService.converterSnapshot()).thenReturn(new ResourcePool.PoolSnapshot("converter", 1, 2, 2));

        webTestClient.get().uri("/api/document-processing/converter")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.running").isEqualTo(1)
                .jsonPath("$.queued").isEqualTo(2)
                .jsonPath("$.maxConcurrent").isEqualTo(2);
    }
}
