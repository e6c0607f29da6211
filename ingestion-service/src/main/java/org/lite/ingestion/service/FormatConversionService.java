package org.lite.ingestion.service;

import org.lite.ingestion.concurrency.ResourcePool;
import org.lite.ingestion.model.ConversionResult;
import org.lite.ingestion.model.SourceDocument;
import reactor.core.publisher.Mono;

public interface FormatConversionService {

    /**
     * Produces the PDF form of a document. PDFs pass through untouched with {@code converted=false}.
     */
    Mono<ConversionResult> convert(SourceDocument source);

    ResourcePool.PoolSnapshot converterSnapshot();
}
