package com.catalog.browser.core.model;

import java.util.List;
import java.util.Map;

/**
 * Bare ordered container of models, such as the images of an artist or the artists of a track.
 */
public record ModelList<T extends CatalogModel>(List<T> items) implements CatalogModel {

    public ModelList {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @SafeVarargs
    public static <T extends CatalogModel> ModelList<T> of(T... items) {
        return new ModelList<>(List.of(items));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public ModelType modelType() {
        return ModelType.COLLECTION;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap("items", items);
    }
}
