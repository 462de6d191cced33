package com.catalog.browser.lock;

import java.time.Duration;

/**
 * Configuration for {@link KeyedLock} implementations.
 *
 * @param timeoutMs maximum time to wait for another caller's in-flight work on the same key
 */
public record LockConfig(long timeoutMs) {

    static final Duration MARGIN = Duration.ofSeconds(5);

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 125s, covering two 60s remote calls.
     */
    public static LockConfig defaults() {
        return new LockConfig(125_000);
    }

    /**
     * Wait long enough for a holder that refreshes the token and then makes the remote
     * call, each bounded by {@code remoteTimeout}: twice the timeout plus a margin.
     */
    public static LockConfig coveringRemoteCalls(Duration remoteTimeout) {
        return new LockConfig(remoteTimeout.multipliedBy(2).plus(MARGIN).toMillis());
    }
}
