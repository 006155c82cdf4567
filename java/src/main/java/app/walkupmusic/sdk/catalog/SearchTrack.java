package app.walkupmusic.sdk.catalog;

import java.util.List;

/**
 * A track returned by a catalog search. Built fresh per response and never persisted.
 *
 * @param artists    artist names in the order Spotify lists them
 * @param albumArt   URL of the album image closest to 300px, or empty when the album has none
 * @param previewUrl 30-second preview URL, or empty when Spotify offers none
 */
public record SearchTrack(
    String id,
    String name,
    List<String> artists,
    String album,
    String albumArt,
    String previewUrl,
    long durationMs,
    String uri
) {

    public SearchTrack {
        artists = artists == null ? List.of() : List.copyOf(artists);
        albumArt = albumArt == null ? "" : albumArt;
        previewUrl = previewUrl == null ? "" : previewUrl;
    }
}
