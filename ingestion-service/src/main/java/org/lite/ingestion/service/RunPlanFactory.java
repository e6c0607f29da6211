package org.lite.ingestion.service;

import lombok.RequiredArgsConstructor;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.StartProcessingRequest;
import org.lite.ingestion.entity.ProcessingJob;
import org.lite.ingestion.model.RunPlan;
import org.springframework.stereotype.Component;

/**
 * Derives the parameters of a run from a start request. Small runs are treated as test runs:
 * the queue is cleared first and documents are processed one at a time.
 */
@Component
@RequiredArgsConstructor
public class RunPlanFactory {

    private final IngestionProperties properties;

    public RunPlan plan(StartProcessingRequest request) {
        IngestionProperties.Pipeline settings = properties.getPipeline();

        int limit = request.getLimit() != null && request.getLimit() > 0 ? request.getLimit() : settings.getDefaultLimit();
        int concurrency = request.getConcurrency() != null && request.getConcurrency() > 0
                ? request.getConcurrency()
                : settings.getDefaultConcurrency();
        boolean testMode = Boolean.TRUE.equals(request.getTestMode()) || limit <= settings.getTestModeThreshold();

        int batchSize = testMode ? settings.getTestModeBatchSize() : Math.min(concurrency, settings.getHardCap());
        int maxContracts = testMode ? Math.min(limit, settings.getTestModeMaxContracts()) : limit;

        return RunPlan.builder()
                .contractId(blankToNull(request.getContractId()))
                .testMode(testMode)
                .clearQueue(testMode)
                .autoQueue(request.getAutoQueue() == null || request.getAutoQueue())
                .limit(limit)
                .sourceLimit(limit)
                .maxContracts(Math.max(maxContracts, 1))
                .batchSize(Math.max(batchSize, 1))
                .jobType(testMode ? ProcessingJob.TYPE_TEST_MODE : ProcessingJob.TYPE_PARALLEL)
                .build();
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
