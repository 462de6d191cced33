package com.catalog.browser.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.function.Supplier;

/**
 * Memoization store for remote call results, keyed by {@link CallSignature}.
 */
public interface ResultCache {

    /**
     * Returns the stored value for the signature, computing and storing it on a miss.
     * On a hit {@code compute} is not invoked. Concurrent callers for the same
     * uncached signature share a single computation.
     *
     * @param signature the call signature
     * @param type      the type the stored value decodes to
     * @param compute   produces the value on a miss; exceptions propagate unchanged
     * @return the cached or freshly computed value
     */
    <T> T getOrCompute(CallSignature signature, TypeReference<T> type, Supplier<T> compute);

    /**
     * Removes every entry and disables further writes for the lifetime of this instance.
     */
    void clear();

    /**
     * Returns whether results are being memoized.
     */
    boolean isEnabled();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
