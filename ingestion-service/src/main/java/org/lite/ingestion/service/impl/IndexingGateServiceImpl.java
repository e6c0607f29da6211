package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.model.GateResult;
import org.lite.ingestion.model.SummaryResult;
import org.lite.ingestion.service.ContentIndexService;
import org.lite.ingestion.service.IndexingGateService;
import org.lite.ingestion.util.DocumentIdentifiers;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class IndexingGateServiceImpl implements IndexingGateService {

    private final ContentIndexService contentIndexService;

    @Override
    public Mono<GateResult> resolve(QueueEntry entry, Supplier<Mono<SummaryResult>> processing) {
        String identifier = DocumentIdentifiers.of(entry.getContractNoticeId(), entry.getFilename());

        return contentIndexService.exists(identifier)
                .flatMap(hit -> hit ? reuse(identifier) : process(entry, identifier, processing));
    }

    private Mono<GateResult> reuse(String identifier) {
        return contentIndexService.find(identifier)
                .defaultIfEmpty("")
                .map(content -> {
                    log.info("♻️ {} already indexed, reusing stored content", identifier);
                    return GateResult.builder()
                            .identifier(identifier)
                            .content(content)
                            .cached(true)
                            .build();
                });
    }

    private Mono<GateResult> process(QueueEntry entry, String identifier, Supplier<Mono<SummaryResult>> processing) {
        return Mono.defer(processing::get)
                .flatMap(summary -> contentIndexService
                        .index(identifier, summary.getContent(), metadata(entry, summary))
                        .thenReturn(GateResult.builder()
                                .identifier(identifier)
                                .content(summary.getContent())
                                .cached(false)
                                .summary(summary)
                                .build()));
    }

    private Map<String, Object> metadata(QueueEntry entry, SummaryResult summary) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("contractId", entry.getContractNoticeId());
        metadata.put("filename", entry.getFilename());
        metadata.put("processedAt", LocalDateTime.now(ZoneOffset.UTC).toString());
        if (summary.getExtractionMethod() != null) {
            metadata.put("extractionMethod", summary.getExtractionMethod().name());
        }
        metadata.put("wordCount", summary.getWordCount());
        return metadata;
    }
}
