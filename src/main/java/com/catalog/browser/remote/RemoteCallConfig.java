package com.catalog.browser.remote;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for remote call execution.
 *
 * @param timeout       maximum time a caller waits for one remote call
 * @param workerThreads number of threads running remote calls
 */
public record RemoteCallConfig(Duration timeout, int workerThreads) {

    public RemoteCallConfig {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
    }

    /**
     * Default configuration: 60s timeout, 8 worker threads.
     */
    public static RemoteCallConfig defaults() {
        return new RemoteCallConfig(Duration.ofSeconds(60), 8);
    }
}
