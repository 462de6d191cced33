package com.catalog.browser.core.model;

import java.util.List;
import java.util.Map;

/**
 * Complete artist object, as returned by search and artist lookup.
 */
public record FullArtist(
        String id,
        String name,
        Integer popularity,
        List<String> genres,
        ModelList<Image> images,
        Integer followers
) implements CatalogItem {

    public FullArtist {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    @Override
    public ModelType modelType() {
        return ModelType.FULL_ARTIST;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", type(),
                "name", name,
                "popularity", popularity,
                "genres", genres,
                "images", images,
                "followers", followers);
    }
}
