package com.catalog.browser.token;

/**
 * Lifecycle of the persisted token.
 */
public enum TokenState {
    /** No token file exists. */
    MISSING,
    /** The token file exists but does not decode to a token. */
    CORRUPT,
    /** The token file decodes but the token has expired. */
    INVALID,
    /** A usable token was read from the token file. */
    LOADED,
    /** A new token was obtained with client credentials. */
    REFRESHED;

    /**
     * Returns true if a new token has to be requested.
     */
    public boolean needsRefresh() {
        return this == MISSING || this == CORRUPT || this == INVALID;
    }
}
