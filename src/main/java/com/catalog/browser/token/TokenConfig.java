package com.catalog.browser.token;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for token persistence and refresh.
 *
 * @param tokenFile       where the token is persisted between runs
 * @param credentialsFile JSON file holding client_id and client_secret
 * @param expiryMargin    tokens expiring within this margin are refreshed
 */
public record TokenConfig(Path tokenFile, Path credentialsFile, Duration expiryMargin) {

    public static final Path DEFAULT_CREDENTIALS_FILE = Path.of("credentials.json");
    static final Duration DEFAULT_EXPIRY_MARGIN = Duration.ofSeconds(60);

    public TokenConfig {
        Objects.requireNonNull(tokenFile, "tokenFile is required");
        Objects.requireNonNull(credentialsFile, "credentialsFile is required");
        Objects.requireNonNull(expiryMargin, "expiryMargin is required");
        if (expiryMargin.isNegative()) {
            throw new IllegalArgumentException("expiryMargin must be >= 0");
        }
    }

    /**
     * Default configuration: token in {@code ./cache/token.json}, credentials in
     * {@code ./credentials.json}, refreshed 60s before expiry.
     */
    public static TokenConfig defaults() {
        return in(Path.of("cache"), DEFAULT_CREDENTIALS_FILE);
    }

    /**
     * Token stored in {@code cacheRoot/token.json} with the given credentials file.
     */
    public static TokenConfig in(Path cacheRoot, Path credentialsFile) {
        return new TokenConfig(cacheRoot.resolve("token.json"), credentialsFile, DEFAULT_EXPIRY_MARGIN);
    }
}
