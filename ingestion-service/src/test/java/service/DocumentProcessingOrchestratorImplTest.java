package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.SourceRef;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.entity.ProcessingJob;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.JobStatus;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.lite.ingestion.model.DocumentOutcome;
import org.lite.ingestion.model.RunPlan;
import org.lite.ingestion.repository.ProcessingJobRepository;
import org.lite.ingestion.service.DocumentPipelineService;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.JobRegistry;
import org.lite.ingestion.service.RunPlanFactory;
import org.lite.ingestion.service.impl.DocumentProcessingOrchestratorImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentProcessingOrchestratorImplTest {

    @Mock
    private DocumentQueueService documentQueueService;

    @Mock
    private DocumentPipelineService documentPipelineService;

    @Mock
    private ProcessingJobRepository processingJobRepository;

    private final JobRegistry jobRegistry = new JobRegistry();
    private final List<ProcessingJob> savedJobs = new CopyOnWriteArrayList<>();
    private DocumentProcessingOrchestratorImpl orchestrator;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        orchestrator = new DocumentProcessingOrchestratorImpl(documentQueueService, documentPipelineService,
                processingJobRepository, new RunPlanFactory(properties), jobRegistry);
    }

    @Test
    void testStart_OneFailingDocumentDoesNotStopTheBatch() {
        // Given
        List<QueueEntry> entries = entries(5);
        stubJobSaves();
        when(documentQueueService.selectQueued(null, 10)).thenReturn(Flux.fromIterable(entries));
        when(documentQueueService.failInterrupted("job-1")).thenReturn(Mono.just(0L));
        when(documentPipelineService.process(any(), eq("job-1"))).thenAnswer(invocation -> {
            QueueEntry entry = invocation.getArgument(0);
            if (entry.getId().equals("entry-3")) {
                return Mono.error(new IllegalStateException("unexpected failure"));
            }
            return Mono.just(completed(entry, entry.getId().equals("entry-5")));
        });

        // When
        StepVerifier.create(orchestrator.start(request(10, 5)))
                .assertNext(response -> {
                    assertEquals("job-1", response.getJobId());
                    assertEquals(5, response.getDocumentsCount());
                    assertEquals(5, response.getBatchSize());
                    assertFalse(response.isTestMode());
                    assertEquals("parallel batches of 5", response.getProcessingMethod());
                    assertEquals("Processing started for 5 documents", response.getMessage());
                })
                .verifyComplete();

        // Then
        ProcessingJob job = savedJobs.get(savedJobs.size() - 1);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(4, job.getRecordsProcessed());
        assertEquals(1, job.getErrorsCount());
        assertEquals(1, job.getSkippedCount());
        assertNotNull(job.getCompletedAt());
        assertEquals(ProcessingJob.TYPE_PARALLEL, job.getJobType());
        assertFalse(jobRegistry.isActive("job-1"));
        verify(documentPipelineService, times(5)).process(any(), eq("job-1"));
    }

    @Test
    void testStart_EntriesTakenByAnotherJobAreNotCounted() {
        // Given
        List<QueueEntry> entries = entries(3);
        stubJobSaves();
        when(documentQueueService.selectQueued(null, 10)).thenReturn(Flux.fromIterable(entries));
        when(documentQueueService.failInterrupted("job-1")).thenReturn(Mono.just(0L));
        when(documentPipelineService.process(any(), eq("job-1"))).thenAnswer(invocation -> {
            QueueEntry entry = invocation.getArgument(0);
            return Mono.just(entry.getId().equals("entry-2")
                    ? DocumentOutcome.claimedElsewhere(entry)
                    : completed(entry, false));
        });

        // When
        StepVerifier.create(orchestrator.start(request(10, 5)))
                .assertNext(response -> assertEquals(3, response.getDocumentsCount()))
                .verifyComplete();

        // Then
        ProcessingJob job = savedJobs.get(savedJobs.size() - 1);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(2, job.getRecordsProcessed());
        assertEquals(0, job.getErrorsCount());
        assertEquals(0, job.getSkippedCount());
    }

    @Test
    void testStart_TestModeProcessesSequentially() {
        // Given
        List<QueueEntry> entries = entries(3);
        List<String> order = new ArrayList<>();
        stubJobSaves();
        when(documentQueueService.clearQueue()).thenReturn(Mono.empty());
        when(documentQueueService.enqueueFromContracts(any(RunPlan.class))).thenReturn(Flux.fromIterable(entries));
        when(documentQueueService.selectQueued(null, 3)).thenReturn(Flux.fromIterable(entries));
        when(documentQueueService.failInterrupted("job-1")).thenReturn(Mono.just(0L));
        when(documentPipelineService.process(any(), eq("job-1"))).thenAnswer(invocation -> {
            QueueEntry entry = invocation.getArgument(0);
            order.add(entry.getId());
            return Mono.just(completed(entry, false));
        });

        // When
        StepVerifier.create(orchestrator.start(StartProcessingRequest.builder().limit(3).build()))
                .assertNext(response -> {
                    assertTrue(response.isTestMode());
                    assertEquals(1, response.getBatchSize());
                    assertEquals("sequential", response.getProcessingMethod());
                })
                .verifyComplete();

        // Then
        assertEquals(List.of("entry-1", "entry-2", "entry-3"), order);
        ProcessingJob job = savedJobs.get(savedJobs.size() - 1);
        assertEquals(ProcessingJob.TYPE_TEST_MODE, job.getJobType());
        assertEquals(job.getDocumentsCount(), job.getRecordsProcessed() + job.getErrorsCount());
        verify(documentQueueService).clearQueue();
    }

    @Test
    void testStart_EmptyQueueCompletesImmediately() {
        // Given
        stubJobSaves();
        when(documentQueueService.selectQueued(null, 10)).thenReturn(Flux.empty());

        // When / Then
        StepVerifier.create(orchestrator.start(request(10, 5)))
                .assertNext(response -> {
                    assertEquals(0, response.getDocumentsCount());
                    assertEquals("No queued documents to process", response.getMessage());
                })
                .verifyComplete();

        ProcessingJob job = savedJobs.get(savedJobs.size() - 1);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(0, job.getRecordsProcessed());
        assertEquals(0, job.getErrorsCount());
        verifyNoInteractions(documentPipelineService);
    }

    @Test
    void testStart_AutoQueuesWhenNothingIsWaiting() {
        // Given
        stubJobSaves();
        when(documentQueueService.countQueued(null)).thenReturn(Mono.just(0L));
        when(documentQueueService.enqueueFromContracts(any(RunPlan.class))).thenReturn(Flux.empty());
        when(documentQueueService.selectQueued(null, 20)).thenReturn(Flux.empty());

        // When
        orchestrator.start(StartProcessingRequest.builder().limit(20).build()).block();

        // Then
        verify(documentQueueService).enqueueFromContracts(argThat(plan -> !plan.isTestMode() && plan.getLimit() == 20));
        verify(documentQueueService, never()).clearQueue();
    }

    @Test
    void testStart_SourcesRequireContract() {
        StartProcessingRequest request = StartProcessingRequest.builder()
                .sources(List.of(SourceRef.builder().url("https://sam.gov/files/sow.pdf").build()))
                .limit(10)
                .build();

        StepVerifier.create(orchestrator.start(request))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(processingJobRepository);
    }

    @Test
    void testStatus_UnknownJobIsEmpty() {
        when(processingJobRepository.findById("missing")).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.status("missing"))
                .verifyComplete();
    }

    private void stubJobSaves() {
        when(processingJobRepository.save(any(ProcessingJob.class))).thenAnswer(invocation -> {
            ProcessingJob job = invocation.getArgument(0);
            if (job.getId() == null) {
                job.setId("job-1");
            }
            savedJobs.add(job);
            return Mono.just(job);
        });
    }

    private StartProcessingRequest request(int limit, int concurrency) {
        return StartProcessingRequest.builder()
                .limit(limit)
                .concurrency(concurrency)
                .autoQueue(false)
                .build();
    }

    private List<QueueEntry> entries(int count) {
        List<QueueEntry> entries = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            entries.add(QueueEntry.builder()
                    .id("entry-" + i)
                    .contractNoticeId("C1")
                    .filename("C1_doc" + i + ".pdf")
                    .status(QueueEntryStatus.QUEUED)
                    .build());
        }
        return entries;
    }

    private DocumentOutcome completed(QueueEntry entry, boolean cached) {
        return DocumentOutcome.builder()
                .entryId(entry.getId())
                .filename(entry.getFilename())
                .status(QueueEntryStatus.COMPLETED)
                .cached(cached)
                .build();
    }
}
