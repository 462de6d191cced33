package com.catalog.browser.api;

import com.catalog.browser.cache.CallSignature;
import com.catalog.browser.cache.ResultCache;
import com.catalog.browser.core.model.EntityType;
import com.catalog.browser.core.model.Paging;
import com.catalog.browser.logging.LogContext;
import com.catalog.browser.remote.CatalogClient;
import com.catalog.browser.remote.RemoteCallExecutor;
import com.catalog.browser.token.AccessToken;
import com.catalog.browser.token.TokenManager;
import com.catalog.browser.view.UnsupportedModelException;
import com.catalog.browser.view.ViewBuilder;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Search and detail queries against the remote catalog.
 *
 * <p>Every remote call is memoized by {@link ResultCache} under a {@link CallSignature}
 * built from the operation name and its named parameters. On a miss the call is made
 * with the current access token on the {@link RemoteCallExecutor}, and the raw model is
 * reduced by the {@link ViewBuilder} before it is stored. Cached values are therefore
 * always the JSON-safe records, never raw models.</p>
 */
public class CatalogQueryService {
    private static final Logger log = LoggerFactory.getLogger(CatalogQueryService.class);

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private final CatalogClient client;
    private final TokenManager tokenManager;
    private final ResultCache cache;
    private final RemoteCallExecutor executor;
    private final ViewBuilder viewBuilder;

    public CatalogQueryService(CatalogClient client, TokenManager tokenManager, ResultCache cache,
                               RemoteCallExecutor executor, ViewBuilder viewBuilder) {
        this.client = client;
        this.tokenManager = tokenManager;
        this.cache = cache;
        this.executor = executor;
        this.viewBuilder = viewBuilder;
    }

    /**
     * Searches the catalog for one entity type.
     *
     * @param type  the entity type to search
     * @param query the query, including optional field filters
     * @return search records in the order the catalog ranked them
     * @throws UnsupportedModelException if the catalog answered with other or additional types
     */
    public List<Map<String, Object>> search(EntityType type, String query) {
        InputValidator.validateQuery(query);
        List<String> types = List.of(type.getLabel());
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "search", type.getLabel())) {
            log.info("search invoked with ({}, {})", type.getLabel(), query);
            List<Map<String, Object>> records = cachedCall("search", Map.of("query", query, "types", types),
                    RECORDS, token -> client.search(token, query, types), result -> searchRecords(type, result));
            log.debug("search returned {} {} records", records.size(), type.getLabel());
            return records;
        }
    }

    /**
     * Returns the search records keyed by the type label, e.g. {@code {"track": [...]}}.
     */
    public Map<String, Object> searchPayload(EntityType type, String query) {
        return Map.of(type.getLabel(), search(type, query));
    }

    /**
     * Fetches an artist with its albums, or an album with its tracks.
     *
     * @throws IllegalArgumentException if {@code type} is {@link EntityType#TRACK}; use {@link #trackDetail(String)}
     */
    public EntityDetail entityDetail(EntityType type, String id) {
        InputValidator.validateId(id);
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "detail", type.getLabel())
                .with("catalogId", id)) {
            log.info("detail invoked with ({}, {})", type.getLabel(), id);
            switch (type) {
                case ARTIST -> {
                    Map<String, Object> artist = cachedCall("artist", Map.of("artist_id", id), RECORD,
                            token -> client.artist(token, id), viewBuilder::detailView);
                    List<Map<String, Object>> albums = cachedCall("artist_albums", Map.of("artist_id", id), RECORDS,
                            token -> client.artistAlbums(token, id), viewBuilder::searchView);
                    return new EntityDetail(type, artist, albums);
                }
                case ALBUM -> {
                    Map<String, Object> album = cachedCall("album", Map.of("album_id", id), RECORD,
                            token -> client.album(token, id), viewBuilder::detailView);
                    List<Map<String, Object>> tracks = cachedCall("album_tracks", Map.of("album_id", id), RECORDS,
                            token -> client.albumTracks(token, id), viewBuilder::searchView);
                    return new EntityDetail(type, album, tracks);
                }
                default -> throw new IllegalArgumentException(
                        "No entity detail for type '" + type.getLabel() + "', use track detail");
            }
        }
    }

    /**
     * Fetches a track with its audio features.
     */
    public TrackDetail trackDetail(String id) {
        InputValidator.validateId(id);
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "detail",
                EntityType.TRACK.getLabel()).with("catalogId", id)) {
            log.info("track detail invoked with ({})", id);
            Map<String, Object> track = cachedCall("track", Map.of("track_id", id), RECORD,
                    token -> client.track(token, id), viewBuilder::detailView);
            Map<String, Object> audio = cachedCall("track_audio_features", Map.of("track_id", id), RECORD,
                    token -> client.trackAudioFeatures(token, id), viewBuilder::detailView);
            return new TrackDetail(track, audio);
        }
    }

    /**
     * Memoizes one remote operation. Only {@code namedParameters} form the signature;
     * anything else the remote function captures is not part of the key.
     *
     * @param operation       operation name, first part of the signature
     * @param namedParameters parameters identifying the call
     * @param type            type of the cached value
     * @param remoteFn        the remote call, given the current token
     * @param view            reduction of the raw model to the cached value
     */
    <M, T> T cachedCall(String operation, Map<String, ?> namedParameters, TypeReference<T> type,
                        AuthenticatedCall<M> remoteFn, Function<? super M, T> view) {
        CallSignature signature = CallSignature.of(operation, namedParameters);
        log.debug("resolved signature {}", signature.canonical());
        return cache.getOrCompute(signature, type, () -> {
            AccessToken token = tokenManager.currentToken();
            M model = executor.execute(operation, () -> remoteFn.call(token));
            return view.apply(model);
        });
    }

    private List<Map<String, Object>> searchRecords(EntityType type, Map<String, Paging<?>> result) {
        if (result == null || result.isEmpty()) {
            throw new UnsupportedModelException("search for " + type.getLabel() + " returned no results object");
        }
        if (result.size() != 1 || !result.containsKey(type.getLabel())) {
            throw new UnsupportedModelException("search for " + type.getLabel()
                    + " returned result types " + result.keySet());
        }
        return viewBuilder.searchView(result.get(type.getLabel()));
    }

    /**
     * A remote call that needs an access token.
     */
    @FunctionalInterface
    interface AuthenticatedCall<M> {
        M call(AccessToken token) throws Exception;
    }
}
