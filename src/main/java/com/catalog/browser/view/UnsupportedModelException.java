package com.catalog.browser.view;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.core.ErrorKind;
import com.catalog.browser.core.model.ModelType;

/**
 * The remote service returned a model shape the core has no rule for, or an answer
 * that breaks the call's contract. Indicates schema drift; never swallowed.
 */
public class UnsupportedModelException extends CatalogException {

    private final ModelType modelType;

    public UnsupportedModelException(String message) {
        super(message);
        this.modelType = null;
    }

    public UnsupportedModelException(ModelType modelType, String message) {
        super(modelType + ": " + message);
        this.modelType = modelType;
    }

    /**
     * Returns the offending model type, or null for contract violations not tied to one model.
     */
    public ModelType getModelType() {
        return modelType;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNSUPPORTED_MODEL;
    }
}
