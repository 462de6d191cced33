package com.catalog.browser.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Detail page data for a track.
 *
 * @param track detail record of the track
 * @param audio detail record of its audio features
 */
public record TrackDetail(Map<String, Object> track, Map<String, Object> audio) {

    public TrackDetail {
        Objects.requireNonNull(track, "track is required");
        Objects.requireNonNull(audio, "audio is required");
    }

    /**
     * Returns the JSON body served for this track: {@code {"track": {...}, "audio": {...}}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("track", track);
        payload.put("audio", audio);
        return payload;
    }
}
