package com.catalog.browser.metrics;

import java.time.Duration;

/**
 * Interface for recording catalog core metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheCorruption();

    /**
     * Records the wall time of one remote catalog call.
     *
     * @param operation the remote operation name, e.g. {@code search}
     * @param duration  elapsed time
     * @param success   false if the call failed or timed out
     */
    void recordRemoteCall(String operation, Duration duration, boolean success);

    void recordTokenRefresh(boolean success);
}
