package com.catalog.browser.cache;

import com.catalog.browser.core.CatalogJson;
import com.catalog.browser.lock.KeyedLock;
import com.catalog.browser.lock.LocalKeyedLock;
import com.catalog.browser.metrics.MetricsService;
import com.catalog.browser.metrics.NoOpMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Disk-backed result cache: one JSON file per {@link CallSignature} under a cache root.
 *
 * <ul>
 *   <li>Entries never expire; an entry is only replaced by a recomputation.</li>
 *   <li>Writes go to a temp file in the root and are renamed into place, so readers
 *       never see a partial entry.</li>
 *   <li>An entry that exists but cannot be decoded is treated as a miss: it is
 *       recomputed and overwritten instead of failing the call.</li>
 *   <li>Fills are single-flight per signature via a {@link KeyedLock}; callers that
 *       waited re-read the disk and get the first caller's result.</li>
 *   <li>A bounded Caffeine tier keeps the encoded bytes of recent entries in memory.</li>
 * </ul>
 *
 * <p>Each call returns its own decoded copy; callers may modify it freely.</p>
 */
public class FileResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(FileResultCache.class);

    static final String ENTRY_SUFFIX = ".json";
    private static final Pattern ENTRY_NAME = Pattern.compile(".*-[0-9a-f]{8}\\.json");

    private final Path root;
    private final KeyedLock lock;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Cache<CallSignature, byte[]> memory;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong corruptions = new AtomicLong();
    private volatile boolean enabled = true;

    public FileResultCache(CacheConfig config) {
        this(config, new LocalKeyedLock(), new NoOpMetricsService(), CatalogJson.newMapper());
    }

    public FileResultCache(CacheConfig config, KeyedLock lock, MetricsService metricsService,
                           ObjectMapper objectMapper) {
        this.root = config.root();
        this.lock = lock;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.memory = Caffeine.newBuilder()
                .maximumSize(config.memoryEntries())
                .build();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache root " + root.toAbsolutePath(), e);
        }
        log.info("FileResultCache initialized: root={}, memoryEntries={}",
                root.toAbsolutePath(), config.memoryEntries());
    }

    @Override
    public <T> T getOrCompute(CallSignature signature, TypeReference<T> type, Supplier<T> compute) {
        if (!enabled) {
            return compute.get();
        }

        byte[] remembered = memory.getIfPresent(signature);
        if (remembered != null) {
            Optional<T> value = decodeRemembered(signature, remembered, type);
            if (value.isPresent()) {
                recordHit();
                return value.get();
            }
        }

        Path entry = entryPath(signature);
        log.debug("cache name resolved as {}", entry.getFileName());

        boolean corruptionReported = false;
        Optional<T> stored;
        try {
            stored = read(signature, entry, type);
        } catch (CacheCorruptionException e) {
            reportCorruption(e);
            corruptionReported = true;
            stored = Optional.empty();
        }
        if (stored.isPresent()) {
            log.info("retrieved {} from cache", entry.getFileName());
            recordHit();
            return stored.get();
        }

        String key = signature.slug();
        lock.tryLock(key);
        try {
            // a concurrent caller may have filled the entry while we waited
            stored = lookup(signature, entry, type, !corruptionReported);
            if (stored.isPresent()) {
                log.info("retrieved {} from cache after waiting", entry.getFileName());
                recordHit();
                return stored.get();
            }

            misses.incrementAndGet();
            metricsService.recordCacheMiss();
            T value = compute.get();
            if (value == null || !enabled) {
                return value;
            }
            byte[] encoded = encode(entry, value);
            if (encoded == null) {
                return value;
            }
            write(entry, encoded);
            log.info("cached new {} from remote call", entry.getFileName());
            memory.put(signature, encoded);
            return decode(encoded, type).orElse(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot decode value just encoded for " + signature.slug(), e);
        } finally {
            lock.unlock(key);
        }
    }

    @Override
    public void clear() {
        enabled = false;
        memory.invalidateAll();
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException e) {
            log.warn("Could not fully remove cache root {}: {}", root.toAbsolutePath(), e.getMessage());
        }
        log.info("Cache cleared and disabled: {}", root.toAbsolutePath());
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), corruptions.get(), countEntries());
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Returns the file an entry for the given signature is stored in.
     */
    public Path entryPath(CallSignature signature) {
        return root.resolve(signature.slug() + ENTRY_SUFFIX);
    }

    private void recordHit() {
        hits.incrementAndGet();
        metricsService.recordCacheHit();
    }

    private void reportCorruption(CacheCorruptionException e) {
        corruptions.incrementAndGet();
        metricsService.recordCacheCorruption();
        log.warn("{}, recomputing: {}", e.getMessage(), e.getCause().getMessage());
    }

    private <T> Optional<T> lookup(CallSignature signature, Path entry, TypeReference<T> type, boolean report) {
        try {
            return read(signature, entry, type);
        } catch (CacheCorruptionException e) {
            if (report) {
                reportCorruption(e);
            } else {
                log.debug("{} still unreadable", entry.getFileName());
            }
            return Optional.empty();
        }
    }

    /**
     * Reads an entry from disk and keeps its bytes in the memory tier.
     * Every caller decodes its own copy, so a caller mutating its result never
     * changes what later hits see.
     */
    private <T> Optional<T> read(CallSignature signature, Path entry, TypeReference<T> type) {
        if (!Files.isRegularFile(entry)) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(entry);
            Optional<T> value = decode(bytes, type);
            value.ifPresent(v -> memory.put(signature, bytes));
            return value;
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheCorruptionException(entry, e);
        }
    }

    private <T> Optional<T> decodeRemembered(CallSignature signature, byte[] bytes, TypeReference<T> type) {
        try {
            return decode(bytes, type);
        } catch (IOException e) {
            log.warn("Dropping undecodable memory entry {}: {}", signature.slug(), e.getMessage());
            memory.invalidate(signature);
            return Optional.empty();
        }
    }

    private <T> Optional<T> decode(byte[] bytes, TypeReference<T> type) throws IOException {
        return Optional.ofNullable(objectMapper.readValue(bytes, type));
    }

    private byte[] encode(Path entry, Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            // the computed value is still returned; only memoization is lost
            log.warn("Could not encode cache entry {}: {}", entry.getFileName(), e.getMessage());
            return null;
        }
    }

    private void write(Path entry, byte[] encoded) {
        Path temp = null;
        try {
            temp = Files.createTempFile(root, "entry-", ".tmp");
            Files.write(temp, encoded);
            try {
                Files.move(temp, entry, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, entry, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // the computed value is still returned; only memoization is lost
            log.warn("Could not write cache entry {}: {}", entry.getFileName(), e.getMessage());
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private long countEntries() {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(p -> ENTRY_NAME.matcher(p.getFileName().toString()).matches()).count();
        } catch (IOException e) {
            log.debug("Could not list cache root: {}", e.getMessage());
            return 0;
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
