package com.catalog.browser.view;

import com.catalog.browser.core.model.CatalogModel;
import com.catalog.browser.core.model.Paging;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds search and detail records from catalog models using a {@link ViewSchema}.
 * Every allowed field is flattened with {@link Flattener} before it is included.
 */
public class ViewBuilder {

    private static final Set<String> REQUIRED_FIELDS = Set.of("id", "name");

    private final ViewSchema schema;
    private final Flattener flattener;

    public ViewBuilder() {
        this(ViewSchema.standard(), new Flattener());
    }

    public ViewBuilder(ViewSchema schema, Flattener flattener) {
        this.schema = schema;
        this.flattener = flattener;
    }

    /**
     * Maps every item of the page to its search record, preserving order.
     *
     * @throws UnsupportedModelException if there is no page or an item has no search view
     */
    public List<Map<String, Object>> searchView(Paging<?> page) {
        if (page == null) {
            throw new UnsupportedModelException("remote call returned no page");
        }
        List<Map<String, Object>> records = new ArrayList<>(page.items().size());
        for (CatalogModel item : page.items()) {
            records.add(searchRecord(item));
        }
        return records;
    }

    /**
     * Builds the search record of a single model.
     *
     * @throws UnsupportedModelException      if the model type has no search view
     * @throws MalformedRemoteResultException if the record lacks its id or name
     */
    public Map<String, Object> searchRecord(CatalogModel model) {
        return record(View.SEARCH, model);
    }

    /**
     * Builds the detail record of a single model.
     *
     * @throws UnsupportedModelException      if the model type has no detail view
     * @throws MalformedRemoteResultException if the record lacks its id or name
     */
    public Map<String, Object> detailView(CatalogModel model) {
        return record(View.DETAIL, model);
    }

    private Map<String, Object> record(View view, CatalogModel model) {
        if (model == null) {
            throw new UnsupportedModelException("remote call returned no " + view.name().toLowerCase() + " model");
        }
        List<String> fields = schema.fieldsFor(view, model.modelType())
                .orElseThrow(() -> new UnsupportedModelException(model.modelType(),
                        "no " + view.name().toLowerCase() + " view defined"));

        Map<String, Object> raw = model.fields();
        Map<String, Object> record = new LinkedHashMap<>();
        for (String field : fields) {
            Object value = flattener.flatten(raw.get(field));
            if (value == null && REQUIRED_FIELDS.contains(field)) {
                throw new MalformedRemoteResultException(model.modelType(), field);
            }
            record.put(field, value);
        }
        return record;
    }
}
