package com.catalog.browser.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A response object returned by the remote catalog service.
 *
 * <p>Every model reports its {@link ModelType} and exposes its raw fields as an
 * ordered map keyed by the catalog's snake_case field names. Field values are
 * scalars, plain lists, or other models.</p>
 */
public interface CatalogModel {

    ModelType modelType();

    /**
     * Returns the raw fields of this model, in declaration order. Values may be null.
     */
    Map<String, Object> fields();

    default ModelKind kind() {
        return modelType().getKind();
    }

    /**
     * Builds an ordered field map from alternating key/value arguments. Null values are kept.
     */
    static Map<String, Object> fieldMap(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return fields;
    }
}
