package com.catalog.browser.core.model;

import java.util.Map;

/**
 * Track as listed on an album.
 */
public record SimpleTrack(
        String id,
        String name,
        Integer discNumber,
        Integer trackNumber,
        Integer durationMs,
        ModelList<SimpleArtist> artists
) implements CatalogItem {

    @Override
    public ModelType modelType() {
        return ModelType.SIMPLE_TRACK;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", type(),
                "name", name,
                "disc_number", discNumber,
                "track_number", trackNumber,
                "duration_ms", durationMs,
                "artists", artists);
    }
}
