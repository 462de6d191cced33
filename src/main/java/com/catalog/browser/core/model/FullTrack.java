package com.catalog.browser.core.model;

import java.util.Map;

/**
 * Complete track object with its album.
 */
public record FullTrack(
        String id,
        String name,
        Integer popularity,
        Integer discNumber,
        Integer trackNumber,
        Integer durationMs,
        ModelList<SimpleArtist> artists,
        SimpleAlbum album
) implements CatalogItem {

    @Override
    public ModelType modelType() {
        return ModelType.FULL_TRACK;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", type(),
                "name", name,
                "popularity", popularity,
                "disc_number", discNumber,
                "track_number", trackNumber,
                "duration_ms", durationMs,
                "artists", artists,
                "album", album);
    }
}
