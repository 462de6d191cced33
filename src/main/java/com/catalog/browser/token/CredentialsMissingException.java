package com.catalog.browser.token;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;

import java.nio.file.Path;

/**
 * No usable client credentials exist, so no token can ever be obtained.
 * This is fatal: it propagates out of provider construction.
 */
public class CredentialsMissingException extends CatalogException {

    private final transient Path location;

    public CredentialsMissingException(Path location, String reason, Throwable cause) {
        super("Credentials unavailable" + (location != null ? " at " + location.toAbsolutePath() : "")
                + ": " + reason, cause);
        this.location = location;
    }

    /**
     * Returns where credentials were expected, or null if they were supplied directly.
     */
    public Path getLocation() {
        return location;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CREDENTIALS_MISSING;
    }
}
