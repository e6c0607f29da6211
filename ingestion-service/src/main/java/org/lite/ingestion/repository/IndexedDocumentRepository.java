package org.lite.ingestion.repository;

import org.lite.ingestion.entity.IndexedDocument;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface IndexedDocumentRepository extends ReactiveMongoRepository<IndexedDocument, String> {

    Mono<IndexedDocument> findByIdentifier(String identifier);
}
