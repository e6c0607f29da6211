package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.QueueStatsResponse;
import org.lite.ingestion.dto.SourceRef;
import org.lite.ingestion.entity.Contract;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.lite.ingestion.model.RunPlan;
import org.lite.ingestion.repository.ContractRepository;
import org.lite.ingestion.repository.QueueEntryRepository;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.util.DocumentIdentifiers;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentQueueServiceImpl implements DocumentQueueService {

    static final String INTERRUPTED_MESSAGE = "Processing interrupted before completion";

    private final QueueEntryRepository queueEntryRepository;
    private final ContractRepository contractRepository;
    private final IngestionProperties properties;
    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Flux<QueueEntry> enqueueSources(String contractId, List<SourceRef> sources) {
        if (sources == null || sources.isEmpty()) {
            return Flux.empty();
        }
        return Flux.fromIterable(sources)
                .concatMap(source -> {
                    boolean local = source.getLocalPath() != null && !source.getLocalPath().isBlank();
                    String location = local ? source.getLocalPath() : source.getUrl();
                    if (location == null || location.isBlank()) {
                        log.warn("📋 Skipping source without URL or path for contract {}", contractId);
                        return Mono.empty();
                    }
                    String filename = source.getFilename() != null && !source.getFilename().isBlank()
                            ? source.getFilename()
                            : local ? Paths.get(location).getFileName().toString() : DocumentIdentifiers.filenameFor(contractId, location);
                    QueueEntry candidate = QueueEntry.builder()
                            .contractNoticeId(contractId)
                            .documentUrl(local ? null : location)
                            .localFilePath(local ? location : null)
                            .filename(filename)
                            .description(source.getDescription())
                            .build();
                    return enqueueIfAbsent(candidate);
                });
    }

    @Override
    public Flux<QueueEntry> enqueueFromContracts(RunPlan plan) {
        PageRequest page = PageRequest.of(0, Math.max(plan.getMaxContracts(), 1));
        Flux<Contract> contracts = plan.getContractId() != null
                ? contractRepository.findByNoticeIdWithResourceLinks(plan.getContractId(), page)
                : contractRepository.findWithResourceLinks(page);

        Flux<QueueEntry> queued = contracts
                .doOnNext(contract -> log.info("📋 Queueing {} documents of contract {}",
                        contract.getResourceLinks().size(), contract.getNoticeId()))
                .concatMap(contract -> Flux.fromIterable(contract.getResourceLinks())
                        .filter(url -> url != null && !url.isBlank())
                        .map(url -> QueueEntry.builder()
                                .contractNoticeId(contract.getNoticeId())
                                .documentUrl(url)
                                .filename(DocumentIdentifiers.filenameFor(contract.getNoticeId(), url))
                                .description("Auto-queued from contract " + contract.getNoticeId())
                                .build()))
                .concatMap(this::enqueueIfAbsent);

        return plan.isTestMode() ? queued.take(plan.getSourceLimit()) : queued;
    }

    private Mono<QueueEntry> enqueueIfAbsent(QueueEntry candidate) {
        Mono<QueueEntry> existing = candidate.getLocalFilePath() != null
                ? queueEntryRepository.findFirstByContractNoticeIdAndLocalFilePath(candidate.getContractNoticeId(), candidate.getLocalFilePath())
                : queueEntryRepository.findFirstByContractNoticeIdAndDocumentUrl(candidate.getContractNoticeId(), candidate.getDocumentUrl());

        return existing
                .doOnNext(found -> log.debug("📋 {} already queued as {}", candidate.getFilename(), found.getId()))
                .hasElement()
                .flatMap(present -> {
                    if (present) {
                        return Mono.<QueueEntry>empty();
                    }
                    QueueEntry entry = candidate.toBuilder()
                            .status(QueueEntryStatus.QUEUED)
                            .retryCount(0)
                            .maxRetries(properties.getPipeline().getDefaultMaxRetries())
                            .queuedAt(now())
                            .build();
                    return queueEntryRepository.save(entry)
                            .doOnSuccess(saved -> log.info("📋 Queued {} for contract {}", saved.getFilename(), saved.getContractNoticeId()));
                });
    }

    @Override
    public Mono<Void> clearQueue() {
        return queueEntryRepository.deleteAll()
                .doOnSuccess(done -> log.info("🧹 Cleared the processing queue"));
    }

    @Override
    public Mono<Long> countQueued(String contractId) {
        if (contractId != null) {
            return selectQueued(contractId, Integer.MAX_VALUE).count();
        }
        return queueEntryRepository.countByStatus(QueueEntryStatus.QUEUED);
    }

    @Override
    public Flux<QueueEntry> selectQueued(String contractId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(limit, 1));
        return contractId != null
                ? queueEntryRepository.findByContractNoticeIdAndStatusOrderByQueuedAtAsc(contractId, QueueEntryStatus.QUEUED, page)
                : queueEntryRepository.findByStatusOrderByQueuedAtAsc(QueueEntryStatus.QUEUED, page);
    }

    @Override
    public Mono<QueueEntry> markProcessing(QueueEntry entry, String jobId) {
        // Only a QUEUED entry can be taken, so overlapping jobs never share one
        Query queued = Query.query(Criteria.where("id").is(entry.getId())
                .and("status").is(QueueEntryStatus.QUEUED));
        Update take = new Update()
                .set("status", QueueEntryStatus.PROCESSING)
                .set("jobId", jobId)
                .set("startedAt", now())
                .unset("errorMessage");

        return reactiveMongoTemplate.findAndModify(queued, take, FindAndModifyOptions.options().returnNew(true), QueueEntry.class)
                .doOnNext(taken -> log.info("🔄 Processing {} ({})", taken.getFilename(), taken.getId()))
                .switchIfEmpty(Mono.<QueueEntry>fromRunnable(() ->
                        log.info("⏭️ {} ({}) is no longer queued, leaving it to its owner", entry.getFilename(), entry.getId())));
    }

    @Override
    public Mono<QueueEntry> markCompleted(QueueEntry entry, String processedData) {
        QueueEntry completed = entry.toBuilder()
                .status(QueueEntryStatus.COMPLETED)
                .completedAt(now())
                .processedData(processedData)
                .errorMessage(null)
                .build();
        return queueEntryRepository.save(completed)
                .doOnSuccess(saved -> log.info("✅ Completed {} ({})", saved.getFilename(), saved.getId()));
    }

    @Override
    public Mono<QueueEntry> markFailed(QueueEntry entry, String errorMessage) {
        return queueEntryRepository.findById(entry.getId())
                .defaultIfEmpty(entry)
                .flatMap(current -> {
                    if (current.getStatus() != null && current.getStatus().isTerminal()) {
                        log.debug("Entry {} already {}, not failing it", current.getId(), current.getStatus());
                        return Mono.just(current);
                    }
                    QueueEntry failed = current.toBuilder()
                            .status(QueueEntryStatus.FAILED)
                            .retryCount(current.getRetryCount() + 1)
                            .failedAt(now())
                            .errorMessage(errorMessage)
                            .build();
                    return queueEntryRepository.save(failed)
                            .doOnSuccess(saved -> log.error("❌ Failed {} ({}): {}", saved.getFilename(), saved.getId(), errorMessage));
                });
    }

    @Override
    public Mono<Long> failInterrupted(String jobId) {
        return queueEntryRepository.findByJobId(jobId)
                .filter(entry -> entry.getStatus() == QueueEntryStatus.PROCESSING)
                .concatMap(entry -> markFailed(entry, INTERRUPTED_MESSAGE))
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.warn("🧹 Failed {} interrupted entries of job {}", count, jobId);
                    }
                });
    }

    @Override
    public Flux<QueueEntry> findStale(LocalDateTime startedBefore) {
        return queueEntryRepository.findByStatusAndStartedAtBefore(QueueEntryStatus.PROCESSING, startedBefore);
    }

    @Override
    public Mono<QueueEntry> requeue(String entryId) {
        return queueEntryRepository.findById(entryId)
                .flatMap(entry -> {
                    if (!entry.canBeRequeued()) {
                        return Mono.error(new IllegalStateException("Entry " + entryId + " cannot be requeued (status "
                                + entry.getStatus() + ", retries " + entry.getRetryCount() + "/" + entry.getMaxRetries() + ")"));
                    }
                    QueueEntry requeued = entry.toBuilder()
                            .status(QueueEntryStatus.QUEUED)
                            .queuedAt(now())
                            .jobId(null)
                            .errorMessage(null)
                            .build();
                    return queueEntryRepository.save(requeued)
                            .doOnSuccess(saved -> log.info("📋 Requeued {} (attempt {} of {})",
                                    saved.getFilename(), saved.getRetryCount() + 1, saved.getMaxRetries()));
                });
    }

    @Override
    public Mono<QueueStatsResponse> countByStatus() {
        return Mono.zip(
                        queueEntryRepository.countByStatus(QueueEntryStatus.QUEUED),
                        queueEntryRepository.countByStatus(QueueEntryStatus.PROCESSING),
                        queueEntryRepository.countByStatus(QueueEntryStatus.COMPLETED),
                        queueEntryRepository.countByStatus(QueueEntryStatus.FAILED))
                .map(counts -> QueueStatsResponse.builder()
                        .queued(counts.getT1())
                        .processing(counts.getT2())
                        .completed(counts.getT3())
                        .failed(counts.getT4())
                        .build());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
