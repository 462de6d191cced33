package com.catalog.browser.core.model;

/**
 * Structural discriminant of a {@link CatalogModel}. Flattening dispatches on this value.
 */
public enum ModelKind {
    /** Ordered, cursor-paged container of items. */
    PAGING,
    /** Bare ordered container. */
    COLLECTION,
    /** Reference to an image by URL. */
    IMAGE,
    /** Identified catalog object with id, type and usually a name. */
    ITEM,
    /** Structured model that is not an item. */
    RECORD
}
