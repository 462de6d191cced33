package com.catalog.browser.view;

import com.catalog.browser.core.model.CatalogItem;
import com.catalog.browser.core.model.CatalogModel;
import com.catalog.browser.core.model.Image;
import com.catalog.browser.core.model.ModelList;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a field value of a catalog model to a JSON-safe value.
 *
 * <p>Models are dispatched on their {@link com.catalog.browser.core.model.ModelKind}:</p>
 * <ul>
 *   <li>COLLECTION - the first element, flattened; an empty collection is {@code null}</li>
 *   <li>IMAGE - the image URL</li>
 *   <li>ITEM - {@code {id, type, name}}, omitting absent type and name</li>
 *   <li>RECORD - all fields, flattened</li>
 *   <li>PAGING - not flattenable below the top level of a view</li>
 * </ul>
 * <p>Other values: scalars pass through, enums become their name, temporal values
 * their ISO text, plain lists and maps are flattened element-wise, and anything
 * else is returned unchanged.</p>
 */
public class Flattener {

    public Object flatten(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CatalogModel model) {
            return flattenModel(model);
        }
        return flattenLeaf(value);
    }

    private Object flattenModel(CatalogModel model) {
        switch (model.kind()) {
            case COLLECTION:
                if (model instanceof ModelList<?> list) {
                    return list.isEmpty() ? null : flatten(list.items().get(0));
                }
                break;
            case IMAGE:
                if (model instanceof Image image) {
                    return image.url();
                }
                break;
            case ITEM:
                if (model instanceof CatalogItem item) {
                    return flattenItem(item);
                }
                break;
            case RECORD:
                return flattenMap(model.fields());
            case PAGING:
                throw new UnsupportedModelException(model.modelType(), "paged results cannot be nested in a record");
        }
        throw new UnsupportedModelException(model.modelType(),
                model.getClass().getSimpleName() + " does not match kind " + model.kind());
    }

    private Map<String, Object> flattenItem(CatalogItem item) {
        if (item.id() == null) {
            throw new MalformedRemoteResultException(item.modelType(), "id");
        }
        Map<String, Object> reference = new LinkedHashMap<>();
        reference.put("id", item.id());
        if (item.type() != null) {
            reference.put("type", item.type());
        }
        if (item.name() != null) {
            reference.put("name", item.name());
        }
        return reference;
    }

    private Object flattenLeaf(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            List<Object> flattened = new ArrayList<>(values.size());
            for (Object element : values) {
                flattened.add(flatten(element));
            }
            return flattened;
        }
        if (value instanceof Map<?, ?> map) {
            return flattenMap(map);
        }
        return value;
    }

    private Map<String, Object> flattenMap(Map<?, ?> map) {
        Map<String, Object> flattened = new LinkedHashMap<>();
        map.forEach((key, v) -> flattened.put(String.valueOf(key), flatten(v)));
        return flattened;
    }
}
