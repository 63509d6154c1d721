package io.github.jakubt4.atlas.dedup;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-flight slot of the deduplicator. {@code refCount} counts every caller attached to the
 * shared future, the one that started the work included.
 */
record PendingRequest<T>(String key, CompletableFuture<T> sharedFuture, AtomicInteger refCount) {

    static <T> PendingRequest<T> open(final String key) {
        return new PendingRequest<>(key, new CompletableFuture<>(), new AtomicInteger(1));
    }
}
