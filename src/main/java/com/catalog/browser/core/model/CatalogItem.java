package com.catalog.browser.core.model;

/**
 * A catalog object with an identity. Nested items flatten to {@code {id, type, name}}.
 */
public interface CatalogItem extends CatalogModel {

    String id();

    String name();

    default String type() {
        return modelType().getTypeName();
    }
}
