package com.catalog.browser.core.model;

/**
 * Concrete schema type of a {@link CatalogModel}. View allow-lists are keyed by this value.
 */
public enum ModelType {
    PAGING(ModelKind.PAGING, null),
    COLLECTION(ModelKind.COLLECTION, null),
    IMAGE(ModelKind.IMAGE, null),
    SIMPLE_ARTIST(ModelKind.ITEM, "artist"),
    FULL_ARTIST(ModelKind.ITEM, "artist"),
    SIMPLE_ALBUM(ModelKind.ITEM, "album"),
    FULL_ALBUM(ModelKind.ITEM, "album"),
    SIMPLE_TRACK(ModelKind.ITEM, "track"),
    FULL_TRACK(ModelKind.ITEM, "track"),
    AUDIO_FEATURES(ModelKind.RECORD, "audio_features");

    private final ModelKind kind;
    private final String typeName;

    ModelType(ModelKind kind, String typeName) {
        this.kind = kind;
        this.typeName = typeName;
    }

    public ModelKind getKind() {
        return kind;
    }

    /**
     * Returns the catalog's own type label ({@code artist}, {@code album}, ...), or null for containers.
     */
    public String getTypeName() {
        return typeName;
    }
}
