package com.catalog.browser.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheCorruption() {
    }

    @Override
    public void recordRemoteCall(String operation, Duration duration, boolean success) {
    }

    @Override
    public void recordTokenRefresh(boolean success) {
    }
}
