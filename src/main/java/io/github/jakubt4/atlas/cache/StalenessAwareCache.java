package io.github.jakubt4.atlas.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Two-tier cache with a fresh/stale/miss read model.
 *
 * <p>The in-memory map is authoritative: {@link #put} publishes the new entry before it returns
 * and mirrors it to the {@link DiskStore} in the background. Readers never block on disk. When
 * storage fails once the cache logs it and keeps running memory-only for the rest of the
 * process lifetime.
 */
@Slf4j
public class StalenessAwareCache<T> {

    @Getter
    private final String name;
    @Getter
    private final CachePolicy policy;
    private final Class<T> payloadType;
    private final DiskStore diskStore;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final AtomicBoolean diskEnabled;
    private final AtomicLong freshHits = new AtomicLong();
    private final AtomicLong staleHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param diskStore persistent mirror, or {@code null} for a memory-only cache
     */
    public StalenessAwareCache(final String name,
                               final CachePolicy policy,
                               final Class<T> payloadType,
                               final DiskStore diskStore,
                               final ObjectMapper objectMapper,
                               final Executor ioExecutor,
                               final Clock clock) {
        this.name = name;
        this.policy = policy;
        this.payloadType = payloadType;
        this.diskStore = diskStore;
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.diskEnabled = new AtomicBoolean(diskStore != null);
    }

    public CacheLookup<T> get(final String key) {
        final var entry = currentEntry(key);
        if (entry.isEmpty()) {
            misses.incrementAndGet();
            log.debug("[CACHE_MISS] cache={} key={}", name, key);
            return CacheLookup.miss();
        }
        final var age = Duration.between(entry.get().storedAt(), clock.instant());
        if (age.compareTo(policy.maxAge()) <= 0) {
            freshHits.incrementAndGet();
            log.debug("[CACHE_HIT] cache={} key={} age={}s", name, key, age.toSeconds());
            return new CacheLookup.Fresh<>(entry.get().payload(), age);
        }
        if (age.compareTo(policy.staleWindow()) <= 0) {
            staleHits.incrementAndGet();
            log.debug("[CACHE_STALE] cache={} key={} age={}s", name, key, age.toSeconds());
            return new CacheLookup.Stale<>(entry.get().payload(), age);
        }
        misses.incrementAndGet();
        log.debug("[CACHE_EXPIRED] cache={} key={} age={}s", name, key, age.toSeconds());
        return CacheLookup.miss();
    }

    /**
     * Last stored entry of the current schema version, regardless of its age. Used as a last
     * resort when every upstream source is down.
     */
    public Optional<CacheEntry<T>> getIgnoringAge(final String key) {
        return currentEntry(key);
    }

    /**
     * Publishes {@code payload} in memory immediately. The returned future completes once the
     * disk mirror is written, or right away when the cache is memory-only.
     */
    public CompletableFuture<Void> put(final String key, final T payload) {
        final var entry = new CacheEntry<>(payload, clock.instant(), policy.schemaVersion());
        entries.put(key, entry);
        log.debug("[CACHE_STORE] cache={} key={}", name, key);
        return persist(key, entry);
    }

    public void invalidate(final String key) {
        final var removed = entries.remove(key) != null;
        log.info("[CACHE_INVALIDATE] cache={} key={} removed={}", name, key, removed);
        if (diskEnabled.get()) {
            submit(() -> {
                try {
                    diskStore.delete(pathFor(key));
                } catch (IOException e) {
                    disableDisk(e);
                }
            });
        }
    }

    public void clear() {
        final var keys = entries.keySet().toArray(String[]::new);
        for (final var key : keys) {
            invalidate(key);
        }
    }

    public boolean contains(final String key) {
        return currentEntry(key).isPresent();
    }

    public CacheStats stats() {
        return new CacheStats(name, entries.size(), freshHits.get(), staleHits.get(), misses.get(), diskEnabled.get());
    }

    /**
     * Loads persisted entries for {@code keys} into memory. Entries written under another schema
     * version, or older than what memory already holds, are skipped.
     *
     * @return future completing with the number of entries restored
     */
    public CompletableFuture<Integer> preload(final Collection<String> keys) {
        if (!diskEnabled.get()) {
            return CompletableFuture.completedFuture(0);
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                var restored = 0;
                for (final var key : keys) {
                    if (!diskEnabled.get()) {
                        break;
                    }
                    if (readPersisted(key).map(entry -> restore(key, entry)).orElse(false)) {
                        restored++;
                    }
                }
                log.info("[CACHE_PRELOAD] cache={} restored={}/{}", name, restored, keys.size());
                return restored;
            }, ioExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[CACHE_PRELOAD] cache={} skipped, executor rejected task: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(0);
        }
    }

    /**
     * Merges {@code entry} into memory unless a newer entry is already present.
     */
    boolean restore(final String key, final CacheEntry<T> entry) {
        if (entry.schemaVersion() != policy.schemaVersion()) {
            log.debug("Skipping {} in cache {}: schema version {} != {}",
                    key, name, entry.schemaVersion(), policy.schemaVersion());
            return false;
        }
        final var merged = entries.merge(key, entry,
                (existing, candidate) -> candidate.storedAt().isAfter(existing.storedAt()) ? candidate : existing);
        return merged == entry;
    }

    private Optional<CacheEntry<T>> currentEntry(final String key) {
        final var entry = entries.get(key);
        if (entry == null || entry.schemaVersion() != policy.schemaVersion()) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private CompletableFuture<Void> persist(final String key, final CacheEntry<T> entry) {
        if (!diskEnabled.get()) {
            return CompletableFuture.completedFuture(null);
        }
        return submit(() -> {
            // a newer put for the same key will write its own entry
            if (entries.get(key) != entry) {
                return;
            }
            final byte[] bytes;
            try {
                bytes = objectMapper.writeValueAsBytes(new PersistedEntry(
                        key, entry.storedAt(), entry.schemaVersion(), objectMapper.valueToTree(entry.payload())));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Cannot serialise {} for cache {}: {}", key, name, e.getMessage());
                return;
            }
            try {
                diskStore.writeBytes(pathFor(key), bytes);
            } catch (IOException e) {
                disableDisk(e);
            }
        });
    }

    private Optional<CacheEntry<T>> readPersisted(final String key) {
        final Optional<byte[]> bytes;
        try {
            bytes = diskStore.readBytes(pathFor(key));
        } catch (IOException e) {
            disableDisk(e);
            return Optional.empty();
        }
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            final var persisted = objectMapper.readValue(bytes.get(), PersistedEntry.class);
            if (!key.equals(persisted.key())) {
                log.warn("Persisted entry at {} belongs to key {}, ignoring", pathFor(key), persisted.key());
                return Optional.empty();
            }
            if (persisted.schemaVersion() != policy.schemaVersion()) {
                log.info("Discarding persisted {} in cache {}: schema version {} != {}",
                        key, name, persisted.schemaVersion(), policy.schemaVersion());
                return Optional.empty();
            }
            final var payload = objectMapper.treeToValue(persisted.payload(), payloadType);
            return Optional.of(new CacheEntry<>(payload, persisted.storedAt(), persisted.schemaVersion()));
        } catch (IOException e) {
            log.warn("Corrupt persisted entry {} in cache {}: {}", key, name, e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<Void> submit(final Runnable task) {
        try {
            return CompletableFuture.runAsync(task, ioExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Cache {} disk task rejected: {}", name, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private void disableDisk(final IOException cause) {
        if (diskEnabled.compareAndSet(true, false)) {
            log.error("[STORAGE_DEGRADED] cache={} continuing memory-only: {}", name, cause.getMessage());
        }
    }

    String pathFor(final String key) {
        return name + "/" + key.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }

    public record PersistedEntry(String key, Instant storedAt, int schemaVersion, JsonNode payload) {
    }
}
