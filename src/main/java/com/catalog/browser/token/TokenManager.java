package com.catalog.browser.token;

import com.catalog.browser.core.CatalogJson;
import com.catalog.browser.lock.KeyedLock;
import com.catalog.browser.lock.LocalKeyedLock;
import com.catalog.browser.metrics.MetricsService;
import com.catalog.browser.metrics.NoOpMetricsService;
import com.catalog.browser.remote.CatalogClient;
import com.catalog.browser.remote.RemoteCallExecutor;
import com.catalog.browser.remote.RemoteCallFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;

/**
 * Persists, restores and refreshes the client token.
 *
 * <p>State transitions: {@code MISSING | CORRUPT | INVALID -> refresh -> REFRESHED -> persist},
 * and on the next process start the persisted token loads as {@code LOADED}.</p>
 *
 * <ul>
 *   <li>Refresh is single-flight process-wide: concurrent callers wait for the
 *       outstanding request and receive its token.</li>
 *   <li>A refreshed token is always persisted before it is returned.</li>
 *   <li>Persistence failures are logged and swallowed; the in-memory token stays usable.</li>
 * </ul>
 */
public class TokenManager {
    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    static final String REFRESH_LOCK_KEY = "token-refresh";
    static final String REQUEST_OPERATION = "request_client_token";

    private final TokenConfig config;
    private final CatalogClient client;
    private final RemoteCallExecutor executor;
    private final CredentialsSource credentialsSource;
    private final KeyedLock lock;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile AccessToken current;
    private volatile TokenState state = TokenState.MISSING;

    public TokenManager(TokenConfig config, CatalogClient client, RemoteCallExecutor executor) {
        this(config, client, executor,
                CredentialsSource.fromFile(config.credentialsFile(), CatalogJson.newMapper()),
                new LocalKeyedLock(), new NoOpMetricsService(), CatalogJson.newMapper(), Clock.systemUTC());
    }

    public TokenManager(TokenConfig config, CatalogClient client, RemoteCallExecutor executor,
                        CredentialsSource credentialsSource, KeyedLock lock, MetricsService metricsService,
                        ObjectMapper objectMapper, Clock clock) {
        this.config = config;
        this.client = client;
        this.executor = executor;
        this.credentialsSource = credentialsSource;
        this.lock = lock;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Loads the persisted token, or requests a new one if none is usable.
     * An acquisition failure leaves the manager without a token; the next
     * {@link #currentToken()} call tries again.
     *
     * @return the token, or empty if acquisition failed
     * @throws CredentialsMissingException if a token is needed and no credentials exist
     */
    public Optional<AccessToken> initialize() {
        TokenLoadResult loaded = load();
        state = loaded.state();
        if (!loaded.state().needsRefresh()) {
            current = loaded.token();
            persist(current);
            return Optional.of(current);
        }
        try {
            return Optional.of(refresh(credentialsSource));
        } catch (TokenAcquisitionException e) {
            log.error("{} requesting token", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads and validates the persisted token. Never throws for absent or damaged files.
     */
    public TokenLoadResult load() {
        Path file = config.tokenFile();
        AccessToken token;
        try (InputStream in = Files.newInputStream(file)) {
            token = objectMapper.readValue(in, AccessToken.class);
        } catch (NoSuchFileException e) {
            log.warn("no token file found, requesting new");
            return TokenLoadResult.missing();
        } catch (IOException e) {
            log.error("{} reading token, requesting new", e.getMessage());
            return TokenLoadResult.corrupt();
        }

        if (token == null || !token.isWellFormed()) {
            log.error("token file {} does not hold a token, requesting new", file.getFileName());
            return TokenLoadResult.corrupt();
        }
        if (token.isExpiring(clock.instant(), config.expiryMargin())) {
            log.info("token {}... from file has expired, requesting new", token.prefix());
            return TokenLoadResult.invalid(token);
        }
        log.info("obtained token {}... from file", token.prefix());
        return TokenLoadResult.loaded(token);
    }

    /**
     * Requests a new token. If another caller completed a refresh while this one
     * waited, that token is returned instead of issuing a second request.
     *
     * @throws CredentialsMissingException if the source has no credentials
     * @throws TokenAcquisitionException   if the request failed
     */
    public AccessToken refresh(CredentialsSource source) {
        AccessToken seen = current;
        lock.tryLock(REFRESH_LOCK_KEY);
        try {
            AccessToken latest = current;
            if (latest != seen && isUsable(latest)) {
                log.debug("token {}... was refreshed by a concurrent caller", latest.prefix());
                return latest;
            }

            Credentials credentials = source.load();
            AccessToken token;
            try {
                token = executor.execute(REQUEST_OPERATION, () -> client.requestClientToken(credentials));
            } catch (RemoteCallFailureException e) {
                metricsService.recordTokenRefresh(false);
                throw new TokenAcquisitionException("Token request failed: " + e.getMessage(), e);
            }
            if (token == null || !token.isWellFormed()) {
                metricsService.recordTokenRefresh(false);
                throw new TokenAcquisitionException("Token endpoint returned no usable token");
            }

            persist(token);
            current = token;
            state = TokenState.REFRESHED;
            metricsService.recordTokenRefresh(true);
            log.info("obtained token {}... with client credentials", token.prefix());
            return token;
        } finally {
            lock.unlock(REFRESH_LOCK_KEY);
        }
    }

    /**
     * Writes the token for the next process lifetime. Failures are logged, not thrown.
     */
    public void persist(AccessToken token) {
        Path file = config.tokenFile().toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(file.getParent(), "token-", ".tmp");
            objectMapper.writeValue(temp.toFile(), token);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("saved token to file");
        } catch (NoSuchFileException e) {
            log.debug("no directory for {}, token not saved", file);
        } catch (IOException e) {
            log.warn("token not saved to {}: {}", file, e.getMessage());
            deleteQuietly(temp);
        }
    }

    /**
     * Returns a token that is not about to expire, refreshing it if necessary.
     *
     * @throws CredentialsMissingException if a refresh is needed and no credentials exist
     * @throws TokenAcquisitionException   if a needed refresh failed
     */
    public AccessToken currentToken() {
        AccessToken token = current;
        if (!isUsable(token)) {
            token = refresh(credentialsSource);
        }
        return token;
    }

    public TokenState getState() {
        return state;
    }

    private boolean isUsable(AccessToken token) {
        return token != null && !token.isExpiring(clock.instant(), config.expiryMargin());
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
