package org.lite.ingestion.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.service.DocumentQueueService;
import org.lite.ingestion.service.JobRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Fails entries left in processing by a run that no longer exists, e.g. after a restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleEntrySweeper {

    static final String STALE_MESSAGE = "Processing interrupted (no active job)";

    private final DocumentQueueService documentQueueService;
    private final JobRegistry jobRegistry;
    private final IngestionProperties properties;

    @Scheduled(fixedDelayString = "${ingestion.pipeline.sweep-interval:PT5M}",
               initialDelayString = "${ingestion.pipeline.sweep-initial-delay:PT1M}")
    public void sweepStaleEntries() {
        sweep().subscribe(
                count -> {
                    if (count > 0) {
                        log.info("🧹 Stale entry sweep failed {} entries", count);
                    }
                },
                error -> log.error("🧹 Stale entry sweep failed: {}", error.getMessage(), error));
    }

    public Mono<Long> sweep() {
        LocalDateTime threshold = LocalDateTime.now(ZoneOffset.UTC).minus(properties.getPipeline().getStaleAfter());
        return documentQueueService.findStale(threshold)
                .filter(entry -> !jobRegistry.isActive(entry.getJobId()))
                .concatMap(entry -> {
                    log.warn("🧹 Entry {} ({}) stuck in processing since {}", entry.getId(), entry.getFilename(), entry.getStartedAt());
                    return documentQueueService.markFailed(entry, STALE_MESSAGE)
                            .onErrorResume(e -> {
                                log.error("Failed to sweep entry {}: {}", entry.getId(), e.getMessage());
                                return Mono.empty();
                            });
                })
                .count();
    }
}
