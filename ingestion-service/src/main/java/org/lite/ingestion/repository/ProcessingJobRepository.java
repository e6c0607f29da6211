package org.lite.ingestion.repository;

import org.lite.ingestion.entity.ProcessingJob;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessingJobRepository extends ReactiveMongoRepository<ProcessingJob, String> {
}
