package com.catalog.browser.cache;

import com.catalog.browser.core.CatalogJson;
import com.catalog.browser.lock.LocalKeyedLock;
import com.catalog.browser.lock.LockConfig;
import com.catalog.browser.metrics.MicrometerMetricsService;
import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileResultCacheTest {

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private static final CallSignature ARTIST = CallSignature.of("artist", Map.of("artist_id", "abc"));

    @TempDir
    Path tempDir;

    private Path root;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("cache");
    }

    private FileResultCache newCache() {
        return new FileResultCache(CacheConfig.at(root));
    }

    private static Map<String, Object> artistRecord() {
        return Map.of("id", "abc", "name", "The Beatles");
    }

    private List<Path> filesUnderRoot() throws IOException {
        try (Stream<Path> files = Files.list(root)) {
            return files.toList();
        }
    }

    @Nested
    @DisplayName("NoOpResultCache")
    class NoOpTests {

        @Test
        @DisplayName("Should compute on every call")
        void testAlwaysComputes() {
            NoOpResultCache cache = new NoOpResultCache();
            AtomicInteger calls = new AtomicInteger();

            cache.getOrCompute(ARTIST, RECORD, () -> { calls.incrementAndGet(); return artistRecord(); });
            cache.getOrCompute(ARTIST, RECORD, () -> { calls.incrementAndGet(); return artistRecord(); });

            assertEquals(2, calls.get());
            assertFalse(cache.isEnabled());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("Hits and misses")
    class HitMissTests {

        @Test
        @DisplayName("Should compute once and serve the stored value afterwards")
        void testComputeOnce() {
            FileResultCache cache = newCache();
            AtomicInteger calls = new AtomicInteger();

            Map<String, Object> first = cache.getOrCompute(ARTIST, RECORD, () -> {
                calls.incrementAndGet();
                return artistRecord();
            });
            Map<String, Object> second = cache.getOrCompute(ARTIST, RECORD, () -> {
                calls.incrementAndGet();
                return Map.of("id", "other");
            });

            assertEquals(1, calls.get());
            assertEquals(first, second);
            assertTrue(Files.isRegularFile(cache.entryPath(ARTIST)));
        }

        @Test
        @DisplayName("Should serve entries written by an earlier instance from disk")
        void testPersistentAcrossInstances() {
            newCache().getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord);

            FileResultCache restarted = newCache();
            Map<String, Object> value = restarted.getOrCompute(ARTIST, RECORD, () -> {
                throw new AssertionError("should not compute");
            });

            assertEquals("The Beatles", value.get("name"));
            assertEquals(1, restarted.getStats().hitCount());
            assertEquals(0, restarted.getStats().missCount());
        }

        @Test
        @DisplayName("Should preserve list order and nested values")
        void testListValues() {
            FileResultCache cache = newCache();
            CallSignature tracks = CallSignature.of("album_tracks", Map.of("album_id", "help"));
            List<Map<String, Object>> records = List.of(
                    Map.of("id", "t1", "name", "Help!", "track_number", 1),
                    Map.of("id", "t2", "name", "The Night Before", "track_number", 2));

            cache.getOrCompute(tracks, RECORDS, () -> records);
            List<Map<String, Object>> stored = newCache().getOrCompute(tracks, RECORDS, List::of);

            assertEquals(records, stored);
        }

        @Test
        @DisplayName("Should keep distinct signatures apart")
        void testDistinctSignatures() {
            FileResultCache cache = newCache();
            CallSignature other = CallSignature.of("artist", Map.of("artist_id", "ABC"));

            cache.getOrCompute(ARTIST, RECORD, () -> Map.of("id", "abc"));
            cache.getOrCompute(other, RECORD, () -> Map.of("id", "ABC"));

            assertEquals("abc", newCache().getOrCompute(ARTIST, RECORD, Map::of).get("id"));
            assertEquals("ABC", newCache().getOrCompute(other, RECORD, Map::of).get("id"));
            assertEquals(2, cache.getStats().size());
        }

        @Test
        @DisplayName("Should report hits, misses and entry count")
        void testStats() {
            FileResultCache cache = newCache();

            cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord); // miss
            cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord); // hit

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0, stats.corruptionCount());
            assertEquals(1, stats.size());
            assertEquals(0.5, stats.hitRate(), 0.001);
        }

        @Test
        @DisplayName("Should propagate compute failures without writing an entry")
        void testComputeFailure() throws IOException {
            FileResultCache cache = newCache();

            assertThrows(IllegalStateException.class, () -> cache.getOrCompute(ARTIST, RECORD, () -> {
                throw new IllegalStateException("remote down");
            }));

            assertTrue(filesUnderRoot().isEmpty());
            assertEquals("The Beatles",
                    cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord).get("name"));
        }

        @Test
        @DisplayName("Modifying a returned value should not change later hits")
        void testReturnedValuesAreCopies() throws IOException {
            FileResultCache cache = newCache();
            CallSignature search = CallSignature.of("search", Map.of("query", "Yesterday", "types", List.of("track")));
            List<Map<String, Object>> records = List.of(Map.of("id", "a1", "name", "Yesterday"));

            List<Map<String, Object>> first = cache.getOrCompute(search, RECORDS, () -> records);
            first.get(0).put("name", "Changed");
            first.add(Map.of("id", "x"));

            List<Map<String, Object>> second = cache.getOrCompute(search, RECORDS, List::of);
            second.clear();
            List<Map<String, Object>> third = cache.getOrCompute(search, RECORDS, List::of);

            assertEquals(records, third);
            assertEquals(records, newCache().getOrCompute(search, RECORDS, List::of));
            assertEquals(2, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Should leave no temporary files behind")
        void testNoTempFiles() throws IOException {
            FileResultCache cache = newCache();
            for (int i = 0; i < 5; i++) {
                CallSignature signature = CallSignature.of("artist", Map.of("artist_id", "id" + i));
                cache.getOrCompute(signature, RECORD, FileResultCacheTest::artistRecord);
            }

            List<Path> files = filesUnderRoot();
            assertEquals(5, files.size());
            assertTrue(files.stream().allMatch(p -> p.getFileName().toString().endsWith(".json")));
        }
    }

    @Nested
    @DisplayName("Corrupt entries")
    class CorruptionTests {

        @Test
        @DisplayName("Should treat an unparseable entry as a miss and overwrite it")
        void testUnparseableEntry() throws IOException {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            FileResultCache cache = new FileResultCache(CacheConfig.at(root), new LocalKeyedLock(),
                    new MicrometerMetricsService(registry), CatalogJson.newMapper());
            Files.writeString(cache.entryPath(ARTIST), "{\"id\": \"abc\", \"name\": ");

            Map<String, Object> value = cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord);

            assertEquals("The Beatles", value.get("name"));
            assertEquals(1, cache.getStats().corruptionCount());
            assertEquals(1.0, registry.counter("catalog.cache.corruption").count());
            assertEquals("The Beatles", newCache().getOrCompute(ARTIST, RECORD, Map::of).get("name"));
        }

        @Test
        @DisplayName("One call over a corrupt entry should count one corruption")
        void testCorruptionCountedOnce() throws IOException {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            FileResultCache cache = new FileResultCache(CacheConfig.at(root), new LocalKeyedLock(),
                    new MicrometerMetricsService(registry), CatalogJson.newMapper());
            Files.writeString(cache.entryPath(ARTIST), "{not json");

            cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord);

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.corruptionCount());
            assertEquals(1, stats.missCount());
            assertEquals(0, stats.hitCount());
            assertEquals(1.0, registry.counter("catalog.cache.corruption").count());
        }

        @Test
        @DisplayName("Should treat an entry of the wrong shape as a miss")
        void testWrongShape() throws IOException {
            FileResultCache cache = newCache();
            Files.writeString(cache.entryPath(ARTIST), "[1, 2, 3]");
            AtomicInteger calls = new AtomicInteger();

            cache.getOrCompute(ARTIST, RECORD, () -> {
                calls.incrementAndGet();
                return artistRecord();
            });

            assertEquals(1, calls.get());
            assertEquals(1, cache.getStats().corruptionCount());
            assertEquals(1, cache.getStats().missCount());
        }
    }

    @Nested
    @DisplayName("Clear")
    class ClearTests {

        @Test
        @DisplayName("Should remove the root and disable further writes")
        void testClearDisables() {
            FileResultCache cache = newCache();
            cache.getOrCompute(ARTIST, RECORD, FileResultCacheTest::artistRecord);

            cache.clear();

            assertFalse(Files.exists(root));
            assertFalse(cache.isEnabled());

            AtomicInteger calls = new AtomicInteger();
            cache.getOrCompute(ARTIST, RECORD, () -> { calls.incrementAndGet(); return artistRecord(); });
            cache.getOrCompute(ARTIST, RECORD, () -> { calls.incrementAndGet(); return artistRecord(); });

            assertEquals(2, calls.get());
            assertFalse(Files.exists(root));
            assertEquals(0, cache.getStats().size());
        }

        @Test
        @DisplayName("Should tolerate clearing twice")
        void testClearTwice() {
            FileResultCache cache = newCache();
            cache.clear();
            assertDoesNotThrow(cache::clear);
        }
    }

    @Nested
    @DisplayName("Single-flight")
    class SingleFlightTests {

        @Test
        @DisplayName("Concurrent callers of one signature should trigger one computation")
        void testConcurrentSameSignature() throws Exception {
            FileResultCache cache = new FileResultCache(CacheConfig.at(root),
                    new LocalKeyedLock(new LockConfig(10_000)), new MicrometerMetricsService(new SimpleMeterRegistry()),
                    CatalogJson.newMapper());
            AtomicInteger calls = new AtomicInteger();
            int threadCount = 8;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(threadCount);
            try {
                List<Future<Map<String, Object>>> futures = new ArrayList<>();
                for (int i = 0; i < threadCount; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return cache.getOrCompute(ARTIST, RECORD, () -> {
                            calls.incrementAndGet();
                            sleep(100);
                            return artistRecord();
                        });
                    }));
                }
                start.countDown();
                for (Future<Map<String, Object>> future : futures) {
                    assertEquals("The Beatles", future.get(10, TimeUnit.SECONDS).get("name"));
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, calls.get());
            assertEquals(1, cache.getStats().missCount());
            assertEquals(threadCount - 1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("A slow computation should not block other signatures")
        void testOtherSignaturesNotBlocked() throws Exception {
            FileResultCache cache = newCache();
            CallSignature other = CallSignature.of("artist", Map.of("artist_id", "xyz"));
            CountDownLatch slowStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<Map<String, Object>> slow = pool.submit(() -> cache.getOrCompute(ARTIST, RECORD, () -> {
                    slowStarted.countDown();
                    await(release);
                    return artistRecord();
                }));
                assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

                Map<String, Object> fast = cache.getOrCompute(other, RECORD, () -> Map.of("id", "xyz"));

                assertEquals("xyz", fast.get("id"));
                release.countDown();
                assertEquals("abc", slow.get(5, TimeUnit.SECONDS).get("id"));
            } finally {
                release.countDown();
                pool.shutdownNow();
            }
        }

        private void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void await(CountDownLatch latch) {
            try {
                latch.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should provide defaults")
        void testDefaults() {
            CacheConfig config = CacheConfig.defaults();
            assertEquals(CacheConfig.DEFAULT_ROOT, config.root());
            assertEquals(256, config.memoryEntries());
            assertTrue(config.enabled());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void testValidation() {
            assertThrows(NullPointerException.class, () -> new CacheConfig(null, 10, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(root, 0, true));
        }

        @Test
        @DisplayName("Should create the root directory")
        void testCreatesRoot() {
            FileResultCache cache = new FileResultCache(CacheConfig.at(root.resolve("nested")));
            assertTrue(Files.isDirectory(cache.getRoot()));
        }
    }
}
