package com.catalog.browser.core.model;

import java.util.List;
import java.util.Map;

/**
 * One page of results. Only iteration order is meaningful to the core; {@code total}
 * and {@code next} are carried through untouched.
 */
public record Paging<T extends CatalogModel>(List<T> items, Integer total, String next) implements CatalogModel {

    public Paging {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T extends CatalogModel> Paging<T> of(List<T> items) {
        return new Paging<>(items, items == null ? 0 : items.size(), null);
    }

    @Override
    public ModelType modelType() {
        return ModelType.PAGING;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap("items", items, "total", total, "next", next);
    }
}
