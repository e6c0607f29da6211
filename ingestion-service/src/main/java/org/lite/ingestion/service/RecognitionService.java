package org.lite.ingestion.service;

import org.lite.ingestion.model.RecognitionResult;
import reactor.core.publisher.Mono;

public interface RecognitionService {

    /**
     * Recognizes the text of every page of a PDF. Fails only when no page could be recognized.
     */
    Mono<RecognitionResult> recognize(byte[] pdfContent, String label);
}
