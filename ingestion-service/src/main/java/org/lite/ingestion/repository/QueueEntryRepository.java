package org.lite.ingestion.repository;

import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface QueueEntryRepository extends ReactiveMongoRepository<QueueEntry, String> {

    Flux<QueueEntry> findByStatusOrderByQueuedAtAsc(QueueEntryStatus status, Pageable pageable);

    Flux<QueueEntry> findByContractNoticeIdAndStatusOrderByQueuedAtAsc(String contractNoticeId, QueueEntryStatus status, Pageable pageable);

    Mono<QueueEntry> findFirstByContractNoticeIdAndDocumentUrl(String contractNoticeId, String documentUrl);

    Mono<QueueEntry> findFirstByContractNoticeIdAndLocalFilePath(String contractNoticeId, String localFilePath);

    Flux<QueueEntry> findByJobId(String jobId);

    Flux<QueueEntry> findByStatusAndStartedAtBefore(QueueEntryStatus status, LocalDateTime threshold);

    Mono<Long> countByStatus(QueueEntryStatus status);
}
