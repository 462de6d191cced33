package com.catalog.browser.remote;

import com.catalog.browser.core.model.AudioFeatures;
import com.catalog.browser.core.model.FullAlbum;
import com.catalog.browser.core.model.FullArtist;
import com.catalog.browser.core.model.FullTrack;
import com.catalog.browser.core.model.Paging;
import com.catalog.browser.core.model.SimpleAlbum;
import com.catalog.browser.core.model.SimpleTrack;
import com.catalog.browser.token.AccessToken;
import com.catalog.browser.token.Credentials;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Operations of the remote catalog service consumed by the core.
 *
 * <p>Transport, paging cursors and authentication headers are the implementation's
 * concern. Implementations should apply their own socket timeouts; the core
 * additionally bounds every call with {@link RemoteCallExecutor}.</p>
 */
public interface CatalogClient {

    /**
     * Searches the catalog.
     *
     * @param token access token
     * @param query query string including optional field filters
     * @param types catalog type labels to search, e.g. {@code ["track"]}
     * @return one page of results per returned type, keyed by type label
     */
    Map<String, Paging<?>> search(AccessToken token, String query, List<String> types) throws IOException;

    FullArtist artist(AccessToken token, String artistId) throws IOException;

    Paging<SimpleAlbum> artistAlbums(AccessToken token, String artistId) throws IOException;

    FullAlbum album(AccessToken token, String albumId) throws IOException;

    Paging<SimpleTrack> albumTracks(AccessToken token, String albumId) throws IOException;

    FullTrack track(AccessToken token, String trackId) throws IOException;

    AudioFeatures trackAudioFeatures(AccessToken token, String trackId) throws IOException;

    /**
     * Requests a client-credentials token.
     */
    AccessToken requestClientToken(Credentials credentials) throws IOException;
}
