package com.catalog.browser.token;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;

/**
 * Requesting a token with valid credentials failed. The caller may retry on a later request.
 */
public class TokenAcquisitionException extends CatalogException {

    public TokenAcquisitionException(String message) {
        super(message);
    }

    public TokenAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TOKEN_ACQUISITION;
    }
}
