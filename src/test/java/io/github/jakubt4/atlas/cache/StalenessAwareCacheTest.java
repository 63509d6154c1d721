package io.github.jakubt4.atlas.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.atlas.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class StalenessAwareCacheTest {

    private static final Instant START = Instant.parse("2025-10-01T00:00:00Z");
    private static final CachePolicy POLICY = new CachePolicy(Duration.ofMinutes(5), Duration.ofHours(48), 1);
    private static final Executor DIRECT = Runnable::run;

    record Sample(String name, int value) {
    }

    @TempDir
    Path cacheDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    @Test
    void entryIsFreshUpToMaxAgeInclusive() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("a", 1));

        clock.advance(Duration.ofMinutes(5));

        final var lookup = cache.get("k");
        assertThat(lookup).isInstanceOf(CacheLookup.Fresh.class);
        assertThat(((CacheLookup.Fresh<Sample>) lookup).value()).isEqualTo(new Sample("a", 1));
        assertThat(((CacheLookup.Fresh<Sample>) lookup).age()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void entryIsStaleBetweenMaxAgeAndStaleWindow() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("a", 1));

        clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        assertThat(cache.get("k")).isInstanceOf(CacheLookup.Stale.class);

        clock.set(START.plus(Duration.ofHours(48)));
        assertThat(cache.get("k")).isInstanceOf(CacheLookup.Stale.class);
    }

    @Test
    void entryBeyondStaleWindowIsAMissButStaysAvailableIgnoringAge() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("a", 1));

        clock.advance(Duration.ofHours(48).plusSeconds(1));

        assertThat(cache.get("k")).isInstanceOf(CacheLookup.Miss.class);
        assertThat(cache.getIgnoringAge("k")).hasValueSatisfying(entry -> {
            assertThat(entry.payload()).isEqualTo(new Sample("a", 1));
            assertThat(entry.storedAt()).isEqualTo(START);
        });
    }

    @Test
    void unknownKeyIsAMiss() {
        final var cache = memoryOnly(POLICY);

        assertThat(cache.get("nope")).isInstanceOf(CacheLookup.Miss.class);
        assertThat(cache.getIgnoringAge("nope")).isEmpty();
    }

    @Test
    void putReplacesEntryAndResetsAge() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("old", 1));
        clock.advance(Duration.ofHours(1));

        cache.put("k", new Sample("new", 2));

        final var lookup = cache.get("k");
        assertThat(lookup).isInstanceOf(CacheLookup.Fresh.class);
        assertThat(((CacheLookup.Fresh<Sample>) lookup).value().name()).isEqualTo("new");
    }

    @Test
    void statsCountEachKindOfRead() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("a", 1));

        cache.get("k");
        cache.get("missing");
        clock.advance(Duration.ofMinutes(10));
        cache.get("k");

        final var stats = cache.stats();
        assertThat(stats.name()).isEqualTo("test");
        assertThat(stats.entries()).isEqualTo(1);
        assertThat(stats.freshHits()).isEqualTo(1);
        assertThat(stats.staleHits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.persistent()).isFalse();
    }

    @Test
    void invalidateRemovesEntry() {
        final var cache = memoryOnly(POLICY);
        cache.put("k", new Sample("a", 1));

        cache.invalidate("k");

        assertThat(cache.contains("k")).isFalse();
        assertThat(cache.get("k")).isInstanceOf(CacheLookup.Miss.class);
    }

    @Test
    void persistedEntrySurvivesIntoNewInstanceWithOriginalTimestamp() {
        final var store = new FileSystemDiskStore(cacheDir);
        final var writer = persistent(store, POLICY);
        writer.put("cobs:3I", new Sample("a", 1)).join();

        clock.advance(Duration.ofMinutes(2));
        final var reader = persistent(store, POLICY);
        final var restored = reader.preload(List.of("cobs:3I", "absent")).join();

        assertThat(restored).isEqualTo(1);
        assertThat(reader.getIgnoringAge("cobs:3I")).hasValueSatisfying(entry -> {
            assertThat(entry.payload()).isEqualTo(new Sample("a", 1));
            assertThat(entry.storedAt()).isEqualTo(START);
        });
        assertThat(reader.get("cobs:3I")).isInstanceOf(CacheLookup.Fresh.class);
    }

    @Test
    void keyIsSanitisedIntoFileName() throws IOException {
        final var cache = persistent(new FileSystemDiskStore(cacheDir), POLICY);

        cache.put("cobs:C/2025 N1", new Sample("a", 1)).join();

        assertThat(cache.pathFor("cobs:C/2025 N1")).isEqualTo("test/cobs_C_2025_N1.json");
        assertThat(Files.exists(cacheDir.resolve("test/cobs_C_2025_N1.json"))).isTrue();
    }

    @Test
    void schemaVersionBumpMakesPersistedEntriesInvisible() {
        final var store = new FileSystemDiskStore(cacheDir);
        persistent(store, POLICY).put("k", new Sample("a", 1)).join();

        final var upgraded = persistent(store, new CachePolicy(Duration.ofMinutes(5), Duration.ofHours(48), 2));

        assertThat(upgraded.preload(List.of("k")).join()).isZero();
        assertThat(upgraded.get("k")).isInstanceOf(CacheLookup.Miss.class);
        assertThat(upgraded.getIgnoringAge("k")).isEmpty();
    }

    @Test
    void restoreRejectsOtherSchemaVersion() {
        final var cache = memoryOnly(POLICY);

        final var restored = cache.restore("k", new CacheEntry<>(new Sample("a", 1), START, 7));

        assertThat(restored).isFalse();
        assertThat(cache.contains("k")).isFalse();
    }

    @Test
    void restoreKeepsWhicheverEntryIsNewer() {
        final var cache = memoryOnly(POLICY);
        clock.advance(Duration.ofMinutes(1));
        cache.put("k", new Sample("memory", 2));

        final var older = cache.restore("k", new CacheEntry<>(new Sample("disk", 1), START, 1));
        final var newer = cache.restore("k", new CacheEntry<>(new Sample("newer", 3), START.plusSeconds(120), 1));

        assertThat(older).isFalse();
        assertThat(newer).isTrue();
        assertThat(cache.getIgnoringAge("k").orElseThrow().payload().name()).isEqualTo("newer");
    }

    @Test
    void failingStorageDegradesToMemoryOnlyAndLogsOnce() throws IOException {
        final var store = mock(DiskStore.class);
        doThrow(new IOException("disk full")).when(store).writeBytes(anyString(), any());
        final var cache = persistent(store, POLICY);

        cache.put("a", new Sample("a", 1)).join();
        cache.put("b", new Sample("b", 2)).join();

        verify(store, times(1)).writeBytes(anyString(), any());
        assertThat(cache.stats().persistent()).isFalse();
        assertThat(cache.get("a")).isInstanceOf(CacheLookup.Fresh.class);
        assertThat(cache.get("b")).isInstanceOf(CacheLookup.Fresh.class);
        assertThat(cache.preload(List.of("a")).join()).isZero();
    }

    @Test
    void corruptPersistedEntryIsIgnored() throws IOException {
        Files.createDirectories(cacheDir.resolve("test"));
        Files.writeString(cacheDir.resolve("test/k.json"), "{not json");
        final var cache = persistent(new FileSystemDiskStore(cacheDir), POLICY);

        assertThat(cache.preload(List.of("k")).join()).isZero();
        assertThat(cache.stats().persistent()).isTrue();
    }

    private StalenessAwareCache<Sample> memoryOnly(final CachePolicy policy) {
        return new StalenessAwareCache<>("test", policy, Sample.class, null, objectMapper, DIRECT, clock);
    }

    private StalenessAwareCache<Sample> persistent(final DiskStore store, final CachePolicy policy) {
        return new StalenessAwareCache<>("test", policy, Sample.class, store, objectMapper, DIRECT, clock);
    }
}
