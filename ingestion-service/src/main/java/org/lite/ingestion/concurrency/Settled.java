package org.lite.ingestion.concurrency;

import reactor.core.publisher.Mono;

/**
 * Outcome of a unit of work that is allowed to fail without affecting its siblings.
 *
 * @param <T> value type
 */
public final class Settled<T> {

    private final T value;
    private final Throwable error;

    private Settled(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Settled<T> success(T value) {
        return new Settled<>(value, null);
    }

    public static <T> Settled<T> failure(Throwable error) {
        return new Settled<>(null, error);
    }

    /**
     * Never errors: a failed or empty source settles as a failure.
     */
    public static <T> Mono<Settled<T>> of(Mono<T> source) {
        return source
                .map(Settled::<T>success)
                .switchIfEmpty(Mono.fromSupplier(() -> Settled.<T>failure(new IllegalStateException("Completed without a result"))))
                .onErrorResume(error -> Mono.just(Settled.<T>failure(error)));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public Throwable getError() {
        return error;
    }
}
