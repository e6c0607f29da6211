package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.concurrency.BoundedWorkerPool;
import org.lite.ingestion.concurrency.Settled;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.exception.ExtractionException;
import org.lite.ingestion.exception.RecognitionException;
import org.lite.ingestion.exception.TransientWorkerException;
import org.lite.ingestion.model.RecognitionPage;
import org.lite.ingestion.model.RecognitionResult;
import org.lite.ingestion.service.PageRasterizer;
import org.lite.ingestion.service.RecognitionEngine;
import org.lite.ingestion.service.RecognitionService;
import org.lite.ingestion.service.RecognitionWorker;
import org.lite.ingestion.util.TextUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Optical recognition of scanned PDFs. Every call gets its own worker pool, sized to the page
 * count, and shuts it down before returning. Pages are rendered inside their own job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OcrRecognitionServiceImpl implements RecognitionService {

    private final PageRasterizer pageRasterizer;
    private final RecognitionEngine recognitionEngine;
    private final IngestionProperties properties;

    @Override
    public Mono<RecognitionResult> recognize(byte[] pdfContent, String label) {
        IngestionProperties.Recognition settings = properties.getRecognition();

        Mono<PageRasterizer.RasterizedDocument> opened = Mono
                .fromCallable(() -> pageRasterizer.open(pdfContent, settings.getDpi()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(IOException.class, e -> new ExtractionException("Could not render " + label + ": " + e.getMessage(), e));

        return Mono.usingWhen(
                opened,
                document -> recognizePages(document, label, settings),
                document -> close(document, label),
                (document, error) -> close(document, label),
                document -> close(document, label));
    }

    private Mono<RecognitionResult> recognizePages(PageRasterizer.RasterizedDocument document,
                                                   String label,
                                                   IngestionProperties.Recognition settings) {
        int pageCount = document.pageCount();
        if (pageCount == 0) {
            return Mono.error(new ExtractionException(label + " has no pages to recognize"));
        }
        int poolSize = Math.min(settings.getMaxWorkers(), pageCount);
        log.info("🔍 Recognizing {} pages of {} with {} workers", pageCount, label, poolSize);

        Mono<BoundedWorkerPool<RecognitionWorker>> poolFactory = BoundedWorkerPool
                .create("ocr-" + label, poolSize, recognitionEngine::createWorker, RecognitionWorker::terminate)
                .onErrorMap(IllegalStateException.class, e -> new RecognitionException(e.getMessage(), e));

        return BoundedWorkerPool.using(poolFactory, pool -> Flux.range(1, pageCount)
                .flatMap(pageNumber -> recognizePage(pool, document, pageNumber, settings), pool.size())
                .collectList()
                .flatMap(results -> assemble(results, pool.size(), label)));
    }

    private Mono<RecognitionPage> recognizePage(BoundedWorkerPool<RecognitionWorker> pool,
                                                PageRasterizer.RasterizedDocument document,
                                                int pageNumber,
                                                IngestionProperties.Recognition settings) {
        AtomicInteger attempts = new AtomicInteger();

        // The page image lives only while its worker holds it
        Mono<String> attempt = pool.run(worker -> Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    return worker.recognize(document.render(pageNumber));
                })
                .subscribeOn(Schedulers.boundedElastic()));

        Mono<String> withRetry = attempt.retryWhen(Retry.fixedDelay(Math.max(settings.getPageAttempts() - 1, 0), settings.getPageRetryDelay())
                .filter(TransientWorkerException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("🔄 Worker failure on page {} (attempt {}), retrying: {}",
                        pageNumber, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        return Settled.of(withRetry).map(outcome -> {
            if (outcome.isSuccess()) {
                return RecognitionPage.recognized(pageNumber, TextUtils.cleanRecognizedText(outcome.getValue()), attempts.get());
            }
            String message = outcome.getError().getMessage() != null
                    ? outcome.getError().getMessage()
                    : outcome.getError().getClass().getSimpleName();
            log.warn("❌ Recognition failed for page {}: {}", pageNumber, message);
            return RecognitionPage.failed(pageNumber, message, attempts.get());
        });
    }

    private Mono<Void> close(PageRasterizer.RasterizedDocument document, String label) {
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        document.close();
                    } catch (IOException e) {
                        log.warn("Failed to close rendered document {}: {}", label, e.getMessage());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<RecognitionResult> assemble(List<RecognitionPage> results, int workers, String label) {
        List<RecognitionPage> recognized = results.stream()
                .filter(RecognitionPage::isSuccess)
                .sorted(Comparator.comparingInt(RecognitionPage::getPageNumber))
                .collect(Collectors.toList());
        int failed = results.size() - recognized.size();

        if (recognized.isEmpty()) {
            return Mono.error(new RecognitionException("All OCR operations failed for " + label
                    + " (" + results.size() + " pages)"));
        }

        String text = recognized.stream()
                .map(page -> "\n--- Page " + page.getPageNumber() + " ---\n" + page.getText() + "\n")
                .collect(Collectors.joining());

        if (failed > 0) {
            log.warn("📊 OCR completed for {}: {}/{} pages successful", label, recognized.size(), results.size());
        } else {
            log.info("📊 OCR completed for {}: {}/{} pages successful", label, recognized.size(), results.size());
        }

        return Mono.just(RecognitionResult.builder()
                .text(text)
                .totalPages(results.size())
                .pagesRecognized(recognized.size())
                .pagesFailed(failed)
                .workers(workers)
                .build());
    }
}
