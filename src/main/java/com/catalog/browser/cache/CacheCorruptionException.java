package com.catalog.browser.cache;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;

import java.nio.file.Path;

/**
 * A cache entry exists but cannot be decoded. {@link FileResultCache} recovers
 * from this locally by recomputing and overwriting the entry.
 */
public class CacheCorruptionException extends CatalogException {

    private final transient Path entry;

    public CacheCorruptionException(Path entry, Throwable cause) {
        super("Unreadable cache entry " + entry.getFileName(), cause);
        this.entry = entry;
    }

    public Path getEntry() {
        return entry;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CACHE_CORRUPTION;
    }
}
