package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.concurrency.BackoffPolicy;
import org.lite.ingestion.concurrency.RetryExhaustedException;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.CompletionResult;
import org.lite.ingestion.service.CompletionClient;
import org.lite.ingestion.service.CompletionErrorClassifier;
import org.lite.ingestion.service.CompletionTransport;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completion client that repeats gateway, network and timeout failures with capped exponential
 * backoff and turns every remaining failure into placeholder content.
 */
@Service
@Slf4j
public class RetryingCompletionClient implements CompletionClient {

    private final CompletionTransport transport;
    private final CompletionErrorClassifier classifier;
    private final BackoffPolicy backoffPolicy;

    public RetryingCompletionClient(CompletionTransport transport,
                                    CompletionErrorClassifier classifier,
                                    IngestionProperties properties) {
        this.transport = transport;
        this.classifier = classifier;
        IngestionProperties.Completion completion = properties.getCompletion();
        this.backoffPolicy = new BackoffPolicy(
                completion.getMaxAttempts(), completion.getInitialBackoff(), completion.getMaxBackoff());
    }

    @Override
    public Mono<CompletionResult> complete(CompletionRequest request) {
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return transport.send(request);
                })
                .retryWhen(backoffPolicy.toRetrySpec(classifier::isRetryable)
                        .doBeforeRetry(signal -> log.warn("🔄 Completion [{}] attempt {} failed ({}), retrying in {}",
                                request.getLabel(),
                                signal.totalRetries() + 1,
                                classifier.classify(signal.failure()),
                                backoffPolicy.delayBeforeAttempt((int) signal.totalRetries() + 2))))
                .map(content -> {
                    if (attempts.get() > 1) {
                        log.info("✅ Completion [{}] succeeded after {} attempts", request.getLabel(), attempts.get());
                    }
                    return CompletionResult.succeeded(content, attempts.get());
                })
                .onErrorResume(error -> {
                    Throwable cause = error instanceof RetryExhaustedException && error.getCause() != null ? error.getCause() : error;
                    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                    log.error("❌ Completion [{}] failed after {} attempt(s): {}", request.getLabel(), attempts.get(), message);
                    return Mono.just(CompletionResult.placeholder(message, attempts.get()));
                });
    }

    BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }
}
