package org.lite.ingestion.repository;

import org.lite.ingestion.entity.Contract;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ContractRepository extends ReactiveMongoRepository<Contract, String> {

    // Contracts that carry at least one resource link
    @Query("{ 'resourceLinks.0': { $exists: true } }")
    Flux<Contract> findWithResourceLinks(Pageable pageable);

    @Query("{ 'noticeId': ?0, 'resourceLinks.0': { $exists: true } }")
    Flux<Contract> findByNoticeIdWithResourceLinks(String noticeId, Pageable pageable);
}
