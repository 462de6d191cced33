package com.catalog.browser.cache;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the result cache.
 *
 * <p>Disk entries are permanent: there is no TTL and no size bound on the cache
 * root. Only the in-memory tier in front of the disk is bounded.</p>
 *
 * @param root          directory holding one file per call signature
 * @param memoryEntries maximum number of decoded results kept in memory
 * @param enabled       whether memoization is enabled; when false the root is erased
 */
public record CacheConfig(Path root, int memoryEntries, boolean enabled) {

    public static final Path DEFAULT_ROOT = Path.of("cache");

    public CacheConfig {
        Objects.requireNonNull(root, "root is required");
        if (memoryEntries <= 0) {
            throw new IllegalArgumentException("memoryEntries must be > 0");
        }
    }

    /**
     * Default cache configuration: {@code ./cache}, 256 entries in memory, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_ROOT, 256, true);
    }

    /**
     * Cache configuration rooted at the given directory.
     */
    public static CacheConfig at(Path root) {
        return new CacheConfig(root, 256, true);
    }

    /**
     * Disabled cache configuration for the given root.
     */
    public static CacheConfig disabled(Path root) {
        return new CacheConfig(root, 1, false);
    }
}
