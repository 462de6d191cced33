package com.catalog.browser.core.model;

import java.util.List;
import java.util.Map;

/**
 * Complete album object including the first page of its tracks.
 */
public record FullAlbum(
        String id,
        String name,
        String albumType,
        Integer popularity,
        List<String> genres,
        String releaseDate,
        Integer totalTracks,
        String label,
        ModelList<SimpleArtist> artists,
        ModelList<Image> images,
        Paging<SimpleTrack> tracks
) implements CatalogItem {

    public FullAlbum {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    @Override
    public ModelType modelType() {
        return ModelType.FULL_ALBUM;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", type(),
                "name", name,
                "album_type", albumType,
                "popularity", popularity,
                "genres", genres,
                "release_date", releaseDate,
                "total_tracks", totalTracks,
                "label", label,
                "artists", artists,
                "images", images,
                "tracks", tracks);
    }
}
