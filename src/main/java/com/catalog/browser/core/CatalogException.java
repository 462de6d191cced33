package com.catalog.browser.core;

/**
 * Base class for all failures raised by the catalog core.
 * Each subclass reports a fixed {@link ErrorKind} so callers can react without
 * matching on concrete exception types.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }

    protected CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the kind of failure.
     */
    public abstract ErrorKind getKind();
}
