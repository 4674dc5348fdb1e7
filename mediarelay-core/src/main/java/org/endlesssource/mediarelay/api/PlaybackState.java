package org.endlesssource.mediarelay.api;

import java.util.Locale;

/**
 * Playback state enumeration
 */
public enum PlaybackState {
    PLAYING,
    PAUSED,
    STOPPED,
    UNKNOWN;

    /**
     * Parse an MPRIS {@code PlaybackStatus} value.
     * @param status raw status ("Playing", "Paused", "Stopped"), may be null
     * @return matching state, or {@link #UNKNOWN} for null or unrecognized values
     */
    public static PlaybackState fromMpris(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "playing" -> PLAYING;
            case "paused" -> PAUSED;
            case "stopped" -> STOPPED;
            default -> UNKNOWN;
        };
    }
}
