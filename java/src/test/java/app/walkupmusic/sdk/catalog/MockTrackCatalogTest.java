package app.walkupmusic.sdk.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MockTrackCatalogTest {

    private final MockTrackCatalog catalog = new MockTrackCatalog();

    @Test
    void matchesNameArtistOrAlbumIgnoringCase() throws Exception {
        assertEquals(List.of("Eye of the Tiger"), names(catalog.searchTracks("TIGER")));
        assertEquals(List.of("We Will Rock You"), names(catalog.searchTracks("queen")));
        assertEquals(List.of("Enter Sandman"), names(catalog.searchTracks("black album")));
    }

    @Test
    void blankQueryReturnsNothing() throws Exception {
        assertTrue(catalog.searchTracks("   ").isEmpty());
        assertTrue(catalog.searchTracks(null).isEmpty());
    }

    @Test
    void respectsLimit() throws Exception {
        assertEquals(6, catalog.searchTracks("e", 50).size());
        assertEquals(2, catalog.searchTracks("e", 2).size());
        assertEquals(1, catalog.searchTracks("e", 0).size());
    }

    @Test
    void tracksCarryPlayableUris() throws Exception {
        SearchTrack track = catalog.searchTracks("thunderstruck").get(0);
        assertEquals(List.of("AC/DC"), track.artists());
        assertTrue(track.uri().startsWith("spotify:track:"));
        assertEquals("", track.albumArt());
        assertEquals(292000, track.durationMs());
    }

    private static List<String> names(List<SearchTrack> tracks) {
        return tracks.stream().map(SearchTrack::name).toList();
    }
}
