package com.catalog.browser.view;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;
import com.catalog.browser.core.model.ModelType;

/**
 * A field the output contract requires (such as an item's id or a record's name)
 * is missing from the remote result.
 */
public class MalformedRemoteResultException extends CatalogException {

    private final ModelType modelType;
    private final String field;

    public MalformedRemoteResultException(ModelType modelType, String field) {
        super(modelType + " is missing required field '" + field + "'");
        this.modelType = modelType;
        this.field = field;
    }

    public ModelType getModelType() {
        return modelType;
    }

    public String getField() {
        return field;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.MALFORMED_RESULT;
    }
}
