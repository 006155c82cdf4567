package app.walkupmusic.sdk.catalog;

import java.util.List;
import java.util.Locale;

/**
 * Offline catalog of classic walk-up songs, used in mock mode.
 */
public final class MockTrackCatalog implements TrackCatalog {

    static final List<SearchTrack> TRACKS = List.of(
        track("track1", "Eye of the Tiger", "Survivor", "Eye of the Tiger", 245000, "2KH16WveTQWT6KOG9Rg6e2"),
        track("track2", "We Will Rock You", "Queen", "News of the World", 122000, "4fzsfWzRhPawzqhX8Qt9F3"),
        track("track3", "Thunderstruck", "AC/DC", "The Razors Edge", 292000, "57bgtoPSgt236HzfBOd8kj"),
        track("track4", "Welcome to the Jungle", "Guns N' Roses", "Appetite for Destruction", 267000, "0G3fbTaUlkPz5zUFuJ3UKB"),
        track("track5", "Enter Sandman", "Metallica", "Metallica (The Black Album)", 331000, "5QO79kh1waicV47BqGRL3g"),
        track("track6", "Sweet Caroline", "Neil Diamond", "Brother Love's Travelling Salvation Show", 201000, "1mea3bSkSGXuIRvnydlB5b")
    );

    @Override
    public List<SearchTrack> searchTracks(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return TRACKS.stream()
            .filter(track -> matches(track, needle))
            .limit(TrackCatalog.clampLimit(limit))
            .toList();
    }

    private static boolean matches(SearchTrack track, String needle) {
        if (track.name().toLowerCase(Locale.ROOT).contains(needle)
            || track.album().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return track.artists().stream().anyMatch(artist -> artist.toLowerCase(Locale.ROOT).contains(needle));
    }

    private static SearchTrack track(String id, String name, String artist, String album, long durationMs, String spotifyId) {
        return new SearchTrack(
            id,
            name,
            List.of(artist),
            album,
            "",
            "https://p.scdn.co/mp3-preview/" + id,
            durationMs,
            "spotify:track:" + spotifyId
        );
    }
}
