package com.catalog.browser.view;

/**
 * Output shapes produced from catalog models.
 */
public enum View {
    /** Summary record, one per list entry. */
    SEARCH,
    /** Richer record for a single object. */
    DETAIL
}
