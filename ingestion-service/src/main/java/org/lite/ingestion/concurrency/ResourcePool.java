package org.lite.ingestion.concurrency;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Counting semaphore for a scarce external resource, shared by every caller in the process.
 * <p>
 * Acquirers beyond {@code maxConcurrent} wait in arrival order. A released permit is handed
 * directly to the oldest waiter, so the running count never dips while others are queued.
 */
@Slf4j
public class ResourcePool {

    private final String name;
    private final int maxConcurrent;

    private final Object lock = new Object();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int running;

    public ResourcePool(String name, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Completes with a permit once one is free. Cancelling while queued removes the waiter;
     * a permit granted to a subscriber that has already cancelled goes back to the pool.
     */
    public Mono<Permit> acquire() {
        return Mono.<Permit>create(sink -> {
            Permit granted = null;
            synchronized (lock) {
                if (running < maxConcurrent) {
                    running++;
                    granted = new Permit();
                } else {
                    Waiter waiter = new Waiter(sink);
                    waiters.addLast(waiter);
                    sink.onCancel(() -> abandon(waiter));
                    log.debug("🔒 [{}] Waiting for a permit ({} queued)", name, waiters.size());
                }
            }
            if (granted != null) {
                sink.success(granted);
            }
        }).doOnDiscard(Permit.class, this::release);
    }

    /**
     * Returns a permit. Releasing the same permit twice has no effect.
     */
    public void release(Permit permit) {
        if (permit == null || !permit.markReleased()) {
            return;
        }
        Waiter next;
        Permit handed;
        synchronized (lock) {
            next = waiters.pollFirst();
            if (next == null) {
                running--;
                return;
            }
            handed = new Permit();
            next.granted = handed;
        }
        next.sink.success(handed);
    }

    /**
     * Runs the supplied work while holding a permit and releases it on completion, error or cancellation.
     */
    public <T> Mono<T> withPermit(Supplier<Mono<T>> work) {
        return Mono.usingWhen(
                acquire(),
                permit -> work.get(),
                permit -> Mono.fromRunnable(() -> release(permit)),
                (permit, error) -> Mono.fromRunnable(() -> release(permit)),
                permit -> Mono.fromRunnable(() -> release(permit)));
    }

    public PoolSnapshot snapshot() {
        synchronized (lock) {
            return new PoolSnapshot(name, running, waiters.size(), maxConcurrent);
        }
    }

    public String getName() {
        return name;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    private void abandon(Waiter waiter) {
        Permit orphan = null;
        synchronized (lock) {
            if (!waiters.remove(waiter)) {
                orphan = waiter.granted;
            }
        }
        if (orphan != null) {
            release(orphan);
        }
    }

    private static final class Waiter {
        private final MonoSink<Permit> sink;
        private Permit granted;

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }

    /**
     * Proof of holding one slot of the pool.
     */
    public static final class Permit {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        private boolean markReleased() {
            return released.compareAndSet(false, true);
        }

        public boolean isReleased() {
            return released.get();
        }
    }

    public record PoolSnapshot(String name, int running, int queued, int maxConcurrent) {
    }
}
