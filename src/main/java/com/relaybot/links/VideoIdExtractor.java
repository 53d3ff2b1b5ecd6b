package com.relaybot.links;

import java.util.List;
import java.util.Optional;

/**
 * Finds a video id in a link using an ordered table of markers. The first
 * marker present in the URL wins; the id runs from the marker to the next end
 * marker or the end of the string.
 */
public class VideoIdExtractor {

    public record Marker(String start, String end) {}

    public static final List<Marker> YOUTUBE_MARKERS = List.of(
            new Marker("watch?v=", "&"),
            new Marker("/shorts/", "?"),
            new Marker("youtu.be/", "?")
    );

    private final List<Marker> markers;

    public VideoIdExtractor() {
        this(YOUTUBE_MARKERS);
    }

    public VideoIdExtractor(List<Marker> markers) {
        this.markers = List.copyOf(markers);
    }

    public Optional<String> extract(String url) {
        if (url == null) return Optional.empty();
        for (var marker : markers) {
            int at = url.indexOf(marker.start());
            if (at < 0) continue;
            var rest = url.substring(at + marker.start().length());
            int end = rest.indexOf(marker.end());
            var id = end >= 0 ? rest.substring(0, end) : rest;
            return id.isEmpty() ? Optional.empty() : Optional.of(id);
        }
        return Optional.empty();
    }
}
