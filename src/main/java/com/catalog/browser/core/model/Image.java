package com.catalog.browser.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Image reference. Flattens to its URL.
 */
public record Image(String url, Integer height, Integer width) implements CatalogModel {

    public Image {
        Objects.requireNonNull(url, "url is required");
    }

    public static Image of(String url) {
        return new Image(url, null, null);
    }

    @Override
    public ModelType modelType() {
        return ModelType.IMAGE;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap("url", url, "height", height, "width", width);
    }
}
