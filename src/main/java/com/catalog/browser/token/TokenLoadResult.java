package com.catalog.browser.token;

import java.util.Objects;

/**
 * Outcome of reading the persisted token.
 *
 * @param state the resulting state
 * @param token the decoded token; null for MISSING and CORRUPT
 */
public record TokenLoadResult(TokenState state, AccessToken token) {

    public TokenLoadResult {
        Objects.requireNonNull(state, "state is required");
    }

    public static TokenLoadResult missing() {
        return new TokenLoadResult(TokenState.MISSING, null);
    }

    public static TokenLoadResult corrupt() {
        return new TokenLoadResult(TokenState.CORRUPT, null);
    }

    public static TokenLoadResult invalid(AccessToken token) {
        return new TokenLoadResult(TokenState.INVALID, token);
    }

    public static TokenLoadResult loaded(AccessToken token) {
        return new TokenLoadResult(TokenState.LOADED, token);
    }
}
