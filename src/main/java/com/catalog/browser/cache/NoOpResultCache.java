package com.catalog.browser.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.function.Supplier;

/**
 * No-op cache implementation. Every call computes.
 * Used when memoization is turned off.
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public <T> T getOrCompute(CallSignature signature, TypeReference<T> type, Supplier<T> compute) {
        return compute.get();
    }

    @Override
    public void clear() {
        // no-op
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
