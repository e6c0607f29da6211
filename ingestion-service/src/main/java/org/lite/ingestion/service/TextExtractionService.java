package org.lite.ingestion.service;

import org.lite.ingestion.model.ExtractionResult;
import org.lite.ingestion.model.SourceDocument;
import reactor.core.publisher.Mono;

public interface TextExtractionService {

    /**
     * Extracts the text of a document, converting it to PDF first when needed and falling back
     * to optical recognition when the PDF carries too little text.
     */
    Mono<ExtractionResult> extract(SourceDocument source);
}
