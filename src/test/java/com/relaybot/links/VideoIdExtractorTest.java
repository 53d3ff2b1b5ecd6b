package com.relaybot.links;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VideoIdExtractorTest {

    private final VideoIdExtractor extractor = new VideoIdExtractor();

    @Test
    void watchUrlStopsAtAmpersand() {
        assertEquals(Optional.of("ABC123"), extractor.extract("https://www.youtube.com/watch?v=ABC123&t=5"));
    }

    @Test
    void shortsUrlStopsAtQuery() {
        assertEquals(Optional.of("XYZ789"), extractor.extract("https://youtube.com/shorts/XYZ789?feature=share"));
    }

    @Test
    void shortLinkStopsAtQuery() {
        assertEquals(Optional.of("Q1W2E3"), extractor.extract("youtu.be/Q1W2E3"));
        assertEquals(Optional.of("Q1W2E3"), extractor.extract("https://youtu.be/Q1W2E3?si=abc"));
    }

    @Test
    void idRunsToEndWithoutEndMarker() {
        assertEquals(Optional.of("ABC123"), extractor.extract("https://www.youtube.com/watch?v=ABC123"));
    }

    @Test
    void firstMarkerInTableWins() {
        // watch?v= is checked before /shorts/
        assertEquals(Optional.of("W1"), extractor.extract("https://youtube.com/shorts/S1/watch?v=W1"));
    }

    @Test
    void noMarkerMeansNoId() {
        assertTrue(extractor.extract("https://www.youtube.com/channel/UC123").isEmpty());
        assertTrue(extractor.extract("https://www.youtube.com/").isEmpty());
    }

    @Test
    void emptyIdIsAbsent() {
        assertTrue(extractor.extract("https://www.youtube.com/watch?v=&t=5").isEmpty());
    }

    @Test
    void customMarkerTable() {
        var custom = new VideoIdExtractor(List.of(new VideoIdExtractor.Marker("/video/", "/")));
        assertEquals(Optional.of("42"), custom.extract("https://vimeo.example/video/42/details"));
    }
}
