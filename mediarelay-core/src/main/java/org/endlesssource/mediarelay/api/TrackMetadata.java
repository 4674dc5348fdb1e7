package org.endlesssource.mediarelay.api;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Information about the media a player currently has loaded.
 * Any field except {@code additional} may be null when the player does not report it.
 */
public record TrackMetadata(String trackId,
                            String title,
                            String artist,
                            String album,
                            Duration length,
                            String artUrl,
                            Map<String, String> additional) {

    public static final TrackMetadata EMPTY = new TrackMetadata(null, null, null, null, null, null, Map.of());

    public TrackMetadata {
        additional = additional == null ? Map.of() : Map.copyOf(additional);
    }

    public Optional<String> getTrackId() {
        return Optional.ofNullable(trackId);
    }

    public Optional<Duration> getLength() {
        return Optional.ofNullable(length);
    }

    public boolean isEmpty() {
        return trackId == null && title == null && artist == null && album == null
                && length == null && artUrl == null && additional.isEmpty();
    }
}
