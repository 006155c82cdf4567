package app.walkupmusic.sdk.catalog;

import app.walkupmusic.sdk.SpotifyException;

import java.util.List;

/**
 * Searches the streaming catalog for walk-up songs.
 */
public interface TrackCatalog {

    int DEFAULT_LIMIT = 20;
    int MAX_LIMIT = 50;

    /**
     * @param query free-text query; empty or whitespace-only queries return an empty list without any request
     * @param limit maximum results, clamped to {@link #MAX_LIMIT}
     */
    List<SearchTrack> searchTracks(String query, int limit) throws SpotifyException;

    default List<SearchTrack> searchTracks(String query) throws SpotifyException {
        return searchTracks(query, DEFAULT_LIMIT);
    }

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
