package com.catalog.browser.core.model;

import java.util.Map;

/**
 * Album summary, as returned by search, artist albums, and nested in tracks.
 */
public record SimpleAlbum(
        String id,
        String name,
        String albumType,
        ModelList<SimpleArtist> artists,
        String releaseDate,
        Integer totalTracks,
        ModelList<Image> images
) implements CatalogItem {

    @Override
    public ModelType modelType() {
        return ModelType.SIMPLE_ALBUM;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", type(),
                "name", name,
                "album_type", albumType,
                "artists", artists,
                "release_date", releaseDate,
                "total_tracks", totalTracks,
                "images", images);
    }
}
