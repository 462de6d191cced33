package com.catalog.browser.lock;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;

/**
 * Thrown when a keyed lock cannot be acquired within the configured timeout.
 * This only happens while another caller's remote call for the same key is still
 * outstanding, so it is reported as a remote call failure.
 */
public class LockAcquisitionException extends CatalogException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.REMOTE_CALL;
    }
}
