package com.catalog.browser.core;

/**
 * Classification of core failures. The HTTP layer maps each kind to a response status.
 */
public enum ErrorKind {
    CACHE_CORRUPTION,
    CREDENTIALS_MISSING,
    TOKEN_ACQUISITION,
    UNSUPPORTED_MODEL,
    MALFORMED_RESULT,
    REMOTE_CALL
}
