package org.lite.ingestion.service;

import org.lite.ingestion.model.ExtractionResult;
import org.lite.ingestion.model.SummaryResult;
import reactor.core.publisher.Mono;

public interface SummarizationService {

    /**
     * Produces the JSON analysis of an extracted document.
     */
    Mono<SummaryResult> summarize(ExtractionResult extraction, String contractId);
}
