package com.catalog.browser.core.model;

import java.util.Locale;

/**
 * Entity types that can be searched for and browsed.
 */
public enum EntityType {
    ARTIST("artist", "albums"),
    ALBUM("album", "tracks"),
    TRACK("track", "audio");

    private final String label;
    private final String relatedLabel;

    EntityType(String label, String relatedLabel) {
        this.label = label;
        this.relatedLabel = relatedLabel;
    }

    /**
     * Returns the lower-case name used by the catalog service and in payload keys.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns the payload key of the secondary data shown on this type's detail page.
     */
    public String getRelatedLabel() {
        return relatedLabel;
    }

    /**
     * Parses a type name such as {@code artist} or the plural {@code artists} used by detail links.
     *
     * @throws IllegalArgumentException if the name is not a known entity type
     */
    public static EntityType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.label.equals(normalized) || (type.label + "s").equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + name);
    }
}
