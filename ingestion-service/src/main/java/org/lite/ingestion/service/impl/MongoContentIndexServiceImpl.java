package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.entity.IndexedDocument;
import org.lite.ingestion.repository.IndexedDocumentRepository;
import org.lite.ingestion.service.ContentIndexService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class MongoContentIndexServiceImpl implements ContentIndexService {

    private final IndexedDocumentRepository indexedDocumentRepository;

    @Override
    public Mono<Boolean> exists(String identifier) {
        return indexedDocumentRepository.findByIdentifier(identifier)
                .hasElement();
    }

    @Override
    public Mono<String> find(String identifier) {
        return indexedDocumentRepository.findByIdentifier(identifier)
                .mapNotNull(IndexedDocument::getContent);
    }

    @Override
    public Mono<Void> index(String identifier, String content, Map<String, Object> metadata) {
        Map<String, Object> safeMetadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        return indexedDocumentRepository.findByIdentifier(identifier)
                .defaultIfEmpty(IndexedDocument.builder().identifier(identifier).build())
                .flatMap(document -> {
                    document.setContent(content);
                    document.setMetadata(safeMetadata);
                    document.setContractNoticeId(asString(safeMetadata.get("contractId")));
                    document.setFilename(asString(safeMetadata.get("filename")));
                    document.setIndexedAt(LocalDateTime.now(ZoneOffset.UTC));
                    return indexedDocumentRepository.save(document);
                })
                .doOnSuccess(saved -> log.info("🗂️ Indexed document {}", identifier))
                .doOnError(error -> log.error("🗂️ Failed to index document {}: {}", identifier, error.getMessage()))
                .then();
    }

    private String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
