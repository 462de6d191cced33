package com.catalog.browser.core.model;

import java.util.Map;

/**
 * Artist as linked from albums and tracks.
 */
public record SimpleArtist(String id, String name) implements CatalogItem {

    @Override
    public ModelType modelType() {
        return ModelType.SIMPLE_ARTIST;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap("id", id, "type", type(), "name", name);
    }
}
