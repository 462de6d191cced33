package com.catalog.browser.core.model;

import java.util.Map;

/**
 * Audio analysis summary of a track. Values are in {@code [0.0, 1.0]} except tempo (BPM).
 */
public record AudioFeatures(
        String id,
        Double danceability,
        Double energy,
        Double valence,
        Double acousticness,
        Double instrumentalness,
        Double liveness,
        Double tempo
) implements CatalogModel {

    @Override
    public ModelType modelType() {
        return ModelType.AUDIO_FEATURES;
    }

    @Override
    public Map<String, Object> fields() {
        return CatalogModel.fieldMap(
                "id", id,
                "type", modelType().getTypeName(),
                "danceability", danceability,
                "energy", energy,
                "valence", valence,
                "acousticness", acousticness,
                "instrumentalness", instrumentalness,
                "liveness", liveness,
                "tempo", tempo);
    }
}
