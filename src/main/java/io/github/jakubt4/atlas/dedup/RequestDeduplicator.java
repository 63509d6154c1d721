package io.github.jakubt4.atlas.dedup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Collapses concurrent requests for the same key into a single upstream call.
 *
 * <p>The first caller for a key claims the slot with an atomic insert-if-absent and is the only
 * one that invokes the work. Later callers attach to the shared future until it settles. The
 * slot is removed before the shared future is completed, so a caller arriving after completion
 * always starts a fresh call and never observes a settled entry.
 *
 * <p>Every caller gets its own {@link CompletableFuture#copy() copy}: cancelling it detaches that
 * caller only.
 */
@Slf4j
@Component
public class RequestDeduplicator {

    private final ConcurrentHashMap<String, PendingRequest<?>> pending = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public <T> CompletableFuture<T> dedupe(final String key, final Supplier<CompletableFuture<T>> fn) {
        final PendingRequest<T> candidate = PendingRequest.open(key);
        final var existing = pending.putIfAbsent(key, candidate);
        if (existing != null) {
            hits.incrementAndGet();
            final var waiters = existing.refCount().incrementAndGet();
            log.debug("[DEDUP_HIT] key={} waiters={}", key, waiters);
            // callers of one key share its result type
            @SuppressWarnings("unchecked")
            final var shared = (PendingRequest<T>) existing;
            return shared.sharedFuture().copy();
        }

        misses.incrementAndGet();
        log.debug("[DEDUP_MISS] key={}", key);
        CompletableFuture<T> work;
        try {
            work = Objects.requireNonNull(fn.get(), "dedupe supplier returned null");
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }
        work.whenComplete((value, error) -> {
            pending.remove(key, candidate);
            if (error != null) {
                candidate.sharedFuture().completeExceptionally(unwrap(error));
            } else {
                candidate.sharedFuture().complete(value);
            }
        });
        return candidate.sharedFuture().copy();
    }

    public boolean isPending(final String key) {
        return pending.containsKey(key);
    }

    public List<String> pendingKeys() {
        return List.copyOf(pending.keySet());
    }

    public DedupStats stats() {
        final var h = hits.get();
        final var m = misses.get();
        final var total = h + m;
        return new DedupStats(h, m, pending.size(), total == 0 ? 0.0 : (double) h / total);
    }

    private static Throwable unwrap(final Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
