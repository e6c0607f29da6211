package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.concurrency.Settled;
import org.lite.ingestion.dto.JobStatusResponse;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.dto.StartProcessingResponse;
import org.lite.ingestion.entity.ProcessingJob;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.JobStatus;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.lite.ingestion.model.DocumentOutcome;
import org.lite.ingestion.model.RunPlan;
import org.lite.ingestion.repository.ProcessingJobRepository;
import org.lite.ingestion.service.DocumentPipelineService;
import org.lite.ingestion.service.DocumentProcessingOrchestrator;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.JobRegistry;
import org.lite.ingestion.service.RunPlanFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Runs processing jobs: batches run one after another, the entries of a batch run concurrently
 * and every entry settles on its own. The job record is written once at the start and once at the end.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingOrchestratorImpl implements DocumentProcessingOrchestrator {

    private final DocumentQueueService documentQueueService;
    private final DocumentPipelineService documentPipelineService;
    private final ProcessingJobRepository processingJobRepository;
    private final RunPlanFactory runPlanFactory;
    private final JobRegistry jobRegistry;

    @Override
    public Mono<StartProcessingResponse> start(StartProcessingRequest request) {
        RunPlan plan = runPlanFactory.plan(request);
        log.info("🚀 Starting document processing: limit={}, batchSize={}, testMode={}, contract={}",
                plan.getLimit(), plan.getBatchSize(), plan.isTestMode(), plan.getContractId());

        if (request.getSources() != null && !request.getSources().isEmpty() && plan.getContractId() == null) {
            return Mono.error(new IllegalArgumentException("contractId is required when sources are given"));
        }

        Mono<Void> clear = plan.isClearQueue() ? documentQueueService.clearQueue() : Mono.empty();

        return clear
                .then(queueSources(request, plan))
                .thenMany(documentQueueService.selectQueued(plan.getContractId(), plan.getLimit()))
                .collectList()
                .flatMap(entries -> createJob(plan, entries.size())
                        .flatMap(job -> {
                            if (entries.isEmpty()) {
                                log.info("📭 Nothing to process for job {}", job.getId());
                                return finishJob(job, new JobCounts(0, 0, 0)).thenReturn(job);
                            }
                            launch(job, plan, entries);
                            return Mono.just(job);
                        })
                        .map(job -> StartProcessingResponse.builder()
                                .jobId(job.getId())
                                .documentsCount(entries.size())
                                .batchSize(plan.getBatchSize())
                                .testMode(plan.isTestMode())
                                .processingMethod(plan.isTestMode()
                                        ? "sequential"
                                        : "parallel batches of " + plan.getBatchSize())
                                .message(entries.isEmpty()
                                        ? "No queued documents to process"
                                        : "Processing started for " + entries.size() + " documents")
                                .build()));
    }

    @Override
    public Mono<JobStatusResponse> status(String jobId) {
        return processingJobRepository.findById(jobId)
                .map(JobStatusResponse::from);
    }

    private Mono<Long> queueSources(StartProcessingRequest request, RunPlan plan) {
        if (request.getSources() != null && !request.getSources().isEmpty()) {
            return documentQueueService.enqueueSources(plan.getContractId(), request.getSources()).count();
        }
        if (!plan.isAutoQueue()) {
            return Mono.just(0L);
        }
        if (plan.isTestMode()) {
            return documentQueueService.enqueueFromContracts(plan).count();
        }
        return documentQueueService.countQueued(plan.getContractId())
                .flatMap(queued -> queued > 0
                        ? Mono.just(0L)
                        : documentQueueService.enqueueFromContracts(plan).count())
                .doOnNext(added -> {
                    if (added > 0) {
                        log.info("📋 Auto-queued {} documents", added);
                    }
                });
    }

    private Mono<ProcessingJob> createJob(RunPlan plan, int documentsCount) {
        ProcessingJob job = ProcessingJob.builder()
                .jobType(plan.getJobType())
                .status(JobStatus.RUNNING)
                .startDate(now())
                .documentsCount(documentsCount)
                .batchSize(plan.getBatchSize())
                .testMode(plan.isTestMode())
                .build();
        return processingJobRepository.save(job)
                .doOnSuccess(saved -> log.info("🚀 Created job {} for {} documents", saved.getId(), documentsCount));
    }

    private void launch(ProcessingJob job, RunPlan plan, List<QueueEntry> entries) {
        Disposable run = runJob(job, plan, entries)
                .doFinally(signal -> jobRegistry.complete(job.getId()))
                .subscribe(
                        done -> { },
                        error -> log.error("❌ Job {} aborted: {}", job.getId(), error.getMessage()));
        jobRegistry.register(job.getId(), run);
    }

    Mono<ProcessingJob> runJob(ProcessingJob job, RunPlan plan, List<QueueEntry> entries) {
        int batchSize = plan.getBatchSize();
        int totalBatches = (entries.size() + batchSize - 1) / batchSize;

        return Flux.fromIterable(entries)
                .buffer(batchSize)
                .index()
                .concatMap(batch -> runBatch(job.getId(), batch.getT1().intValue() + 1, totalBatches, batch.getT2()))
                .collectList()
                .flatMap(batches -> documentQueueService.failInterrupted(job.getId())
                        .defaultIfEmpty(0L)
                        .map(interrupted -> count(batches)))
                .flatMap(counts -> finishJob(job, counts))
                .doOnCancel(() -> log.warn("🛑 Job {} cancelled before completion", job.getId()));
    }

    private Mono<List<DocumentOutcome>> runBatch(String jobId, int batchNumber, int totalBatches, List<QueueEntry> batch) {
        log.info("📦 Job {}: batch {}/{} with {} documents", jobId, batchNumber, totalBatches, batch.size());

        return Flux.fromIterable(batch)
                .flatMap(entry -> Settled.of(documentPipelineService.process(entry, jobId))
                        .map(settled -> settled.isSuccess()
                                ? settled.getValue()
                                : DocumentOutcome.builder()
                                        .entryId(entry.getId())
                                        .filename(entry.getFilename())
                                        .status(QueueEntryStatus.FAILED)
                                        .errorMessage(settled.getError().getMessage())
                                        .build()), batch.size())
                .collectList()
                .doOnNext(outcomes -> log.info("📦 Job {}: batch {}/{} settled, {} completed, {} failed",
                        jobId, batchNumber, totalBatches,
                        outcomes.stream().filter(DocumentOutcome::isCompleted).count(),
                        outcomes.stream().filter(DocumentOutcome::isFailed).count()));
    }

    private JobCounts count(List<List<DocumentOutcome>> batches) {
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        for (List<DocumentOutcome> batch : batches) {
            for (DocumentOutcome outcome : batch) {
                if (outcome.isClaimedElsewhere()) {
                    continue;
                }
                if (outcome.isCompleted()) {
                    completed++;
                    if (outcome.isCached()) {
                        skipped++;
                    }
                } else {
                    failed++;
                }
            }
        }
        return new JobCounts(completed, failed, skipped);
    }

    private Mono<ProcessingJob> finishJob(ProcessingJob job, JobCounts counts) {
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(now());
        job.setRecordsProcessed(counts.completed());
        job.setErrorsCount(counts.failed());
        job.setSkippedCount(counts.skipped());
        return processingJobRepository.save(job)
                .doOnSuccess(saved -> log.info("🏁 Job {} completed: {} processed, {} errors, {} skipped",
                        saved.getId(), counts.completed(), counts.failed(), counts.skipped()));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }

    private record JobCounts(int completed, int failed, int skipped) {
    }
}
