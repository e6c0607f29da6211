package org.lite.ingestion.concurrency;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fixed set of expensive workers lent out one job at a time.
 * <p>
 * Each worker is owned by at most one job. {@link #shutdown()} terminates every worker
 * exactly once; use {@link #using} so teardown runs on success, error and cancellation alike.
 *
 * @param <W> worker type
 */
@Slf4j
public class BoundedWorkerPool<W> {

    private final String name;
    private final List<W> workers;
    private final Consumer<W> terminator;
    private final ResourcePool slots;
    private final ConcurrentLinkedDeque<W> idle;
    private final AtomicBoolean shutDown = new AtomicBoolean();

    private BoundedWorkerPool(String name, List<W> workers, Consumer<W> terminator) {
        this.name = name;
        this.workers = Collections.unmodifiableList(workers);
        this.terminator = terminator;
        this.slots = new ResourcePool(name, workers.size());
        this.idle = new ConcurrentLinkedDeque<>(workers);
    }

    /**
     * Starts up to {@code size} workers on a blocking-friendly scheduler. Workers that fail to
     * start are skipped; the pool errors only when none could be created.
     */
    public static <W> Mono<BoundedWorkerPool<W>> create(String name, int size, Callable<W> factory, Consumer<W> terminator) {
        return Flux.range(1, Math.max(size, 0))
                .concatMap(index -> Mono.fromCallable(factory)
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnError(error -> log.warn("⚙️ [{}] Worker {} failed to start: {}", name, index, error.getMessage()))
                        .onErrorResume(error -> Mono.empty()))
                .collectList()
                .flatMap(created -> {
                    if (created.isEmpty()) {
                        return Mono.error(new IllegalStateException("No worker of pool '" + name + "' could be started"));
                    }
                    log.info("⚙️ [{}] Started {}/{} workers", name, created.size(), size);
                    return Mono.just(new BoundedWorkerPool<>(name, new ArrayList<>(created), terminator));
                });
    }

    /**
     * Scoped use: creates the pool, runs the body and shuts the pool down on every exit path.
     */
    public static <W, T> Mono<T> using(Mono<BoundedWorkerPool<W>> poolFactory, Function<BoundedWorkerPool<W>, Mono<T>> body) {
        return Mono.usingWhen(
                poolFactory,
                body,
                BoundedWorkerPool::shutdownAsync,
                (pool, error) -> pool.shutdownAsync(),
                BoundedWorkerPool::shutdownAsync);
    }

    /**
     * Borrows an idle worker, waiting in arrival order when all are busy.
     */
    public Mono<Lease<W>> acquire() {
        return Mono.defer(() -> {
            if (shutDown.get()) {
                return Mono.error(new IllegalStateException("Pool '" + name + "' is shut down"));
            }
            return slots.acquire().map(permit -> new Lease<>(permit, idle.pollFirst()));
        });
    }

    /**
     * Returns the worker before its slot so the next borrower always finds one idle.
     */
    public void release(Lease<W> lease) {
        if (lease.returned.compareAndSet(false, true)) {
            idle.offerLast(lease.worker);
            slots.release(lease.permit);
        }
    }

    /**
     * Runs one job on a borrowed worker and gives the worker back however the job ends.
     */
    public <T> Mono<T> run(Function<W, Mono<T>> job) {
        return Mono.usingWhen(
                acquire(),
                lease -> job.apply(lease.worker()),
                lease -> Mono.fromRunnable(() -> release(lease)),
                (lease, error) -> Mono.fromRunnable(() -> release(lease)),
                lease -> Mono.fromRunnable(() -> release(lease)));
    }

    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        int failures = 0;
        for (W worker : workers) {
            try {
                terminator.accept(worker);
            } catch (RuntimeException e) {
                failures++;
                log.warn("⚙️ [{}] Failed to terminate worker: {}", name, e.getMessage());
            }
        }
        log.info("⚙️ [{}] Shut down {} workers ({} termination failures)", name, workers.size(), failures);
    }

    public Mono<Void> shutdownAsync() {
        return Mono.fromRunnable(this::shutdown)
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public int size() {
        return workers.size();
    }

    public boolean isShutDown() {
        return shutDown.get();
    }

    public static final class Lease<W> {
        private final ResourcePool.Permit permit;
        private final W worker;
        private final AtomicBoolean returned = new AtomicBoolean();

        private Lease(ResourcePool.Permit permit, W worker) {
            this.permit = permit;
            this.worker = worker;
        }

        public W worker() {
            return worker;
        }
    }
}
