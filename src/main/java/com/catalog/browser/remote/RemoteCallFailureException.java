package com.catalog.browser.remote;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;

/**
 * A remote catalog call failed, timed out, or was interrupted.
 * The core never retries; callers may retry under their own policy.
 */
public class RemoteCallFailureException extends CatalogException {

    private final String operation;

    public RemoteCallFailureException(String operation, String message, Throwable cause) {
        super("Remote call '" + operation + "' failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.REMOTE_CALL;
    }
}
