package com.catalog.browser.api;

import com.catalog.browser.core.model.EntityType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Detail page data for an artist or album: the entity's detail record plus the
 * search records of its albums (artist) or tracks (album).
 *
 * @param type    the entity type
 * @param primary detail record of the entity
 * @param related search records of the related entities, in catalog order
 */
public record EntityDetail(EntityType type, Map<String, Object> primary, List<Map<String, Object>> related) {

    public EntityDetail {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(primary, "primary is required");
        Objects.requireNonNull(related, "related is required");
    }

    /**
     * Returns the JSON body served for this entity, e.g. {@code {"artist": {...}, "albums": [...]}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(type.getLabel(), primary);
        payload.put(type.getRelatedLabel(), related);
        return payload;
    }
}
