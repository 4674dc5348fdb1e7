package org.endlesssource.mediarelay.facade;

import org.endlesssource.mediarelay.api.TrackMetadata;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts unwrapped MPRIS property values into the canonical model.
 */
public final class MprisMetadata {
    static final String TRACK_ID = "mpris:trackid";
    static final String LENGTH = "mpris:length";
    static final String ART_URL = "mpris:artUrl";
    static final String TITLE = "xesam:title";
    static final String ARTIST = "xesam:artist";
    static final String ALBUM = "xesam:album";

    private static final Set<String> WELL_KNOWN = Set.of(TRACK_ID, LENGTH, ART_URL, TITLE, ARTIST, ALBUM);

    private MprisMetadata() {
    }

    /**
     * @param raw value of the {@code Metadata} property, may be null
     * @return parsed metadata, {@link TrackMetadata#EMPTY} when nothing usable is present
     */
    public static TrackMetadata parse(Object raw) {
        if (!(raw instanceof Map<?, ?> map) || map.isEmpty()) {
            return TrackMetadata.EMPTY;
        }

        String trackId = asString(map.get(TRACK_ID));
        if (MprisNames.NO_TRACK.equals(trackId)) {
            trackId = null;
        }
        Duration length = null;
        long lengthMicros = asLong(map.get(LENGTH), -1L);
        if (lengthMicros > 0) {
            length = Duration.of(lengthMicros, ChronoUnit.MICROS);
        }

        Map<String, String> additional = new HashMap<>();
        map.forEach((key, value) -> {
            if (key instanceof String name && !WELL_KNOWN.contains(name)) {
                String text = asText(value);
                if (text != null) {
                    additional.put(name, text);
                }
            }
        });

        TrackMetadata metadata = new TrackMetadata(
                trackId,
                asString(map.get(TITLE)),
                asText(map.get(ARTIST)),
                asString(map.get(ALBUM)),
                length,
                asString(map.get(ART_URL)),
                additional);
        return metadata.isEmpty() ? TrackMetadata.EMPTY : metadata;
    }

    /**
     * Non-blank string value or null.
     */
    public static String asString(Object value) {
        if (value instanceof String str && !str.isBlank()) {
            return str;
        }
        return null;
    }

    public static boolean asBoolean(Object value, boolean fallback) {
        return value instanceof Boolean bool ? bool : fallback;
    }

    public static double asDouble(Object value, double fallback) {
        if (value instanceof Number number) {
            double result = number.doubleValue();
            return Double.isFinite(result) ? result : fallback;
        }
        return fallback;
    }

    public static long asLong(Object value, long fallback) {
        return value instanceof Number number ? number.longValue() : fallback;
    }

    // Lists (xesam:artist, xesam:genre) are joined, scalars stringified.
    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> collection) {
            String joined = collection.stream()
                    .map(MprisMetadata::asText)
                    .filter(text -> text != null)
                    .collect(Collectors.joining(", "));
            return joined.isBlank() ? null : joined;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
