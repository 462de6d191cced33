package com.catalog.browser.api;

import com.catalog.browser.cache.CacheConfig;
import com.catalog.browser.cache.CacheStats;
import com.catalog.browser.cache.FileResultCache;
import com.catalog.browser.core.CatalogJson;
import com.catalog.browser.core.model.EntityType;
import com.catalog.browser.lock.KeyedLock;
import com.catalog.browser.lock.LocalKeyedLock;
import com.catalog.browser.lock.LockConfig;
import com.catalog.browser.logging.LogContext;
import com.catalog.browser.metrics.MetricsService;
import com.catalog.browser.metrics.NoOpMetricsService;
import com.catalog.browser.remote.CatalogClient;
import com.catalog.browser.remote.RemoteCallConfig;
import com.catalog.browser.remote.RemoteCallExecutor;
import com.catalog.browser.token.CredentialsSource;
import com.catalog.browser.token.TokenConfig;
import com.catalog.browser.token.TokenManager;
import com.catalog.browser.token.TokenState;
import com.catalog.browser.view.Flattener;
import com.catalog.browser.view.ViewBuilder;
import com.catalog.browser.view.ViewSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Main entry point of the catalog browser core.
 * Wires the result cache, token manager, remote executor and view builder around a
 * {@link CatalogClient} and exposes the search and detail queries.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (CatalogProvider provider = CatalogProvider.builder()
 *         .catalogClient(client)
 *         .cacheConfig(CacheConfig.at(Path.of("cache")))
 *         .build()) {
 *
 *     List&lt;Map&lt;String, Object&gt;&gt; tracks = provider.search(EntityType.TRACK, "Yesterday");
 *     EntityDetail artist = provider.entityDetail(EntityType.ARTIST, "3WrFJ7ztbogyGnTHbHJFl2");
 * }
 * </pre>
 *
 * <p>Construction loads or requests the access token. Missing credentials are fatal
 * and surface from {@link Builder#build()} as
 * {@link com.catalog.browser.token.CredentialsMissingException}.</p>
 */
public class CatalogProvider implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CatalogProvider.class);

    private final CatalogQueryService service;
    private final FileResultCache cache;
    private final TokenManager tokenManager;
    private final RemoteCallExecutor executor;

    private CatalogProvider(Builder builder) {
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        ObjectMapper objectMapper = CatalogJson.newMapper();

        KeyedLock lock = builder.keyedLock != null
                ? builder.keyedLock : new LocalKeyedLock(builder.effectiveLockConfig());

        // Memoization off: drop everything persisted by earlier sessions
        this.cache = new FileResultCache(builder.cacheConfig, lock, metricsService, objectMapper);
        if (!builder.cacheConfig.enabled()) {
            cache.clear();
        }
        this.executor = new RemoteCallExecutor(builder.remoteCallConfig, metricsService);

        TokenConfig tokenConfig = builder.tokenConfig != null
                ? builder.tokenConfig : TokenConfig.in(builder.cacheConfig.root(), TokenConfig.DEFAULT_CREDENTIALS_FILE);
        CredentialsSource credentialsSource = builder.credentialsSource != null
                ? builder.credentialsSource : CredentialsSource.fromFile(tokenConfig.credentialsFile(), objectMapper);
        this.tokenManager = new TokenManager(tokenConfig, builder.catalogClient, executor, credentialsSource,
                lock, metricsService, objectMapper, builder.clock);

        try (LogContext ctx = LogContext.forToken(LogContext.generateCorrelationId())) {
            tokenManager.initialize();
        } catch (RuntimeException e) {
            executor.close();
            throw e;
        }

        ViewSchema schema = builder.viewSchema != null ? builder.viewSchema : ViewSchema.standard();
        this.service = new CatalogQueryService(builder.catalogClient, tokenManager, cache, executor,
                new ViewBuilder(schema, new Flattener()));

        log.info("CatalogProvider initialized with cache root {} (memoize={})",
                cache.getRoot(), builder.cacheConfig.enabled());
    }

    // ========== Query API ==========

    /**
     * Searches the catalog for one entity type.
     */
    public List<Map<String, Object>> search(EntityType type, String query) {
        return service.search(type, query);
    }

    /**
     * Searches the catalog and returns the records keyed by type label.
     */
    public Map<String, Object> searchPayload(EntityType type, String query) {
        return service.searchPayload(type, query);
    }

    /**
     * Fetches an artist with its albums or an album with its tracks.
     */
    public EntityDetail entityDetail(EntityType type, String id) {
        return service.entityDetail(type, id);
    }

    /**
     * Fetches a track with its audio features.
     */
    public TrackDetail trackDetail(String id) {
        return service.trackDetail(id);
    }

    // ========== Service Access ==========

    public CatalogQueryService getService() {
        return service;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public boolean isMemoizing() {
        return cache.isEnabled();
    }

    public TokenState getTokenState() {
        return tokenManager.getState();
    }

    @Override
    public void close() {
        executor.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogClient catalogClient;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private LockConfig lockConfig;
        private TokenConfig tokenConfig;
        private RemoteCallConfig remoteCallConfig = RemoteCallConfig.defaults();
        private CredentialsSource credentialsSource;
        private KeyedLock keyedLock;
        private MetricsService metricsService;
        private ViewSchema viewSchema;
        private Clock clock = Clock.systemUTC();

        /**
         * Sets the remote catalog client. Required.
         */
        public Builder catalogClient(CatalogClient catalogClient) {
            this.catalogClient = catalogClient;
            return this;
        }

        /**
         * Sets the cache location and memory tier size.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Shortcut for turning memoization on or off while keeping the configured root.
         * Turning it off removes the cache root on construction.
         */
        public Builder memoize(boolean memoize) {
            this.cacheConfig = new CacheConfig(cacheConfig.root(), cacheConfig.memoryEntries(), memoize);
            return this;
        }

        /**
         * Sets how long a caller waits for another caller's in-flight work on the same
         * signature or on the token. Defaults to
         * {@link LockConfig#coveringRemoteCalls(java.time.Duration)} of the remote timeout,
         * since the holder may refresh the token and then make the remote call.
         * A shorter wait lets waiters fail with
         * {@link com.catalog.browser.lock.LockAcquisitionException} while the call is still running.
         */
        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        LockConfig effectiveLockConfig() {
            LockConfig covering = LockConfig.coveringRemoteCalls(remoteCallConfig.timeout());
            if (lockConfig == null) {
                return covering;
            }
            if (lockConfig.timeoutMs() < covering.timeoutMs()) {
                log.warn("Lock wait of {}ms is shorter than {}ms, waiters may give up on in-flight remote calls",
                        lockConfig.timeoutMs(), covering.timeoutMs());
            }
            return lockConfig;
        }

        /**
         * Sets token and credentials file locations.
         * Defaults to {@code token.json} inside the cache root and {@code credentials.json}.
         */
        public Builder tokenConfig(TokenConfig tokenConfig) {
            this.tokenConfig = tokenConfig;
            return this;
        }

        public Builder remoteCallConfig(RemoteCallConfig remoteCallConfig) {
            this.remoteCallConfig = remoteCallConfig;
            return this;
        }

        /**
         * Sets where client credentials come from.
         * Defaults to the credentials file of the {@link TokenConfig}.
         */
        public Builder credentialsSource(CredentialsSource credentialsSource) {
            this.credentialsSource = credentialsSource;
            return this;
        }

        /**
         * Sets a custom keyed lock for single-flight fills and token refreshes.
         * Defaults to {@link LocalKeyedLock} with the configured {@link LockConfig}.
         */
        public Builder keyedLock(KeyedLock keyedLock) {
            this.keyedLock = keyedLock;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder viewSchema(ViewSchema viewSchema) {
            this.viewSchema = viewSchema;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CatalogProvider build() {
            if (catalogClient == null) {
                throw new IllegalStateException("CatalogClient is required");
            }
            return new CatalogProvider(this);
        }
    }
}
