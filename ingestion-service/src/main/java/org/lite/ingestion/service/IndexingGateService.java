package org.lite.ingestion.service;

import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.model.GateResult;
import org.lite.ingestion.model.SummaryResult;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

public interface IndexingGateService {

    /**
     * Returns the indexed content of the entry's document when present. Otherwise runs the
     * processing supplied, indexes its result and returns it.
     */
    Mono<GateResult> resolve(QueueEntry entry, Supplier<Mono<SummaryResult>> processing);
}
