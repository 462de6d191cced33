package com.catalog.browser.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.cache.hit} - Counter</li>
 *   <li>{@code catalog.cache.miss} - Counter</li>
 *   <li>{@code catalog.cache.corruption} - Counter</li>
 *   <li>{@code catalog.remote.duration} - Timer (tags: operation, outcome)</li>
 *   <li>{@code catalog.token.refresh} - Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheCorruptionCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("catalog.cache.hit")
                .description("Number of result cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.cache.miss")
                .description("Number of result cache misses")
                .register(registry);
        this.cacheCorruptionCounter = Counter.builder("catalog.cache.corruption")
                .description("Number of unreadable cache entries treated as misses")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheCorruption() {
        cacheCorruptionCounter.increment();
    }

    @Override
    public void recordRemoteCall(String operation, Duration duration, boolean success) {
        String outcome = outcome(success);
        Timer timer = timerCache.computeIfAbsent(operation + ":" + outcome, k ->
                Timer.builder("catalog.remote.duration")
                        .description("Duration of remote catalog calls")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordTokenRefresh(boolean success) {
        String outcome = outcome(success);
        Counter counter = counterCache.computeIfAbsent("token:" + outcome, k ->
                Counter.builder("catalog.token.refresh")
                        .description("Number of client token requests")
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment();
    }

    private static String outcome(boolean success) {
        return success ? "success" : "failure";
    }
}
