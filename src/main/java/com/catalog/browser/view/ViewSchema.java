package com.catalog.browser.view;

import com.catalog.browser.core.model.ModelType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Allow-list of output fields per (view, model type). A model type without an
 * entry for a view cannot be rendered in that view.
 */
public final class ViewSchema {

    private final Map<View, Map<ModelType, List<String>>> table;

    private ViewSchema(Builder builder) {
        Map<View, Map<ModelType, List<String>>> copy = new EnumMap<>(View.class);
        builder.table.forEach((view, byType) ->
                copy.put(view, Collections.unmodifiableMap(new EnumMap<>(byType))));
        this.table = Collections.unmodifiableMap(copy);
    }

    /**
     * The allow-list table used by the browser.
     */
    public static ViewSchema standard() {
        return builder()
                .allow(View.SEARCH, ModelType.FULL_ARTIST, "id", "name", "genres", "images")
                .allow(View.SEARCH, ModelType.SIMPLE_ALBUM, "id", "name", "artists", "release_date", "images")
                .allow(View.SEARCH, ModelType.FULL_TRACK, "id", "name", "artists", "album")
                .allow(View.SEARCH, ModelType.SIMPLE_TRACK, "id", "name", "disc_number", "track_number", "duration_ms")
                .allow(View.DETAIL, ModelType.FULL_ARTIST, "id", "name", "popularity", "genres", "images")
                .allow(View.DETAIL, ModelType.FULL_ALBUM, "id", "name", "popularity", "genres", "release_date",
                        "total_tracks", "label", "artists", "images")
                .allow(View.DETAIL, ModelType.FULL_TRACK, "id", "name", "popularity", "disc_number", "track_number",
                        "artists", "album", "duration_ms")
                .allow(View.DETAIL, ModelType.AUDIO_FEATURES, "danceability", "energy", "valence")
                .build();
    }

    /**
     * Returns the allowed fields, in output order, or empty if the type has no entry for the view.
     */
    public Optional<List<String>> fieldsFor(View view, ModelType modelType) {
        Map<ModelType, List<String>> byType = table.get(view);
        return byType == null ? Optional.empty() : Optional.ofNullable(byType.get(modelType));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<View, Map<ModelType, List<String>>> table = new EnumMap<>(View.class);

        public Builder allow(View view, ModelType modelType, String... fields) {
            if (fields.length == 0) {
                throw new IllegalArgumentException("At least one field is required for " + view + "/" + modelType);
            }
            table.computeIfAbsent(view, v -> new EnumMap<>(ModelType.class)).put(modelType, List.of(fields));
            return this;
        }

        public ViewSchema build() {
            return new ViewSchema(this);
        }
    }
}
