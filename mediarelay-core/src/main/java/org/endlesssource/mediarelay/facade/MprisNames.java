package org.endlesssource.mediarelay.facade;

import java.util.Map;

/**
 * Well-known MPRIS names and the rules for turning them into display names.
 */
public final class MprisNames {
    public static final String BUS_NAME_PREFIX = "org.mpris.MediaPlayer2.";
    public static final String OBJECT_PATH = "/org/mpris/MediaPlayer2";
    public static final String ROOT_INTERFACE = "org.mpris.MediaPlayer2";
    public static final String PLAYER_INTERFACE = "org.mpris.MediaPlayer2.Player";
    public static final String NO_TRACK = "/org/mpris/MediaPlayer2/TrackList/NoTrack";

    public static final String IDENTITY = "Identity";
    public static final String DESKTOP_ENTRY = "DesktopEntry";

    public static final String PLAYBACK_STATUS = "PlaybackStatus";
    public static final String METADATA = "Metadata";
    public static final String POSITION = "Position";
    public static final String RATE = "Rate";
    public static final String MINIMUM_RATE = "MinimumRate";
    public static final String MAXIMUM_RATE = "MaximumRate";
    public static final String CAN_CONTROL = "CanControl";
    public static final String CAN_PLAY = "CanPlay";
    public static final String CAN_PAUSE = "CanPause";
    public static final String CAN_GO_NEXT = "CanGoNext";
    public static final String CAN_GO_PREVIOUS = "CanGoPrevious";
    public static final String CAN_SEEK = "CanSeek";

    private MprisNames() {
    }

    public static boolean isPlayerBusName(String busName) {
        return busName != null && busName.startsWith(BUS_NAME_PREFIX) && busName.length() > BUS_NAME_PREFIX.length();
    }

    /**
     * The player part of a bus name without instance suffix.
     * {@code org.mpris.MediaPlayer2.vlc.instance4242} gives {@code vlc}.
     */
    public static String shortName(String busName) {
        String rest = busName.startsWith(BUS_NAME_PREFIX) ? busName.substring(BUS_NAME_PREFIX.length()) : busName;
        int dot = rest.indexOf('.');
        return dot < 0 ? rest : rest.substring(0, dot);
    }

    /**
     * Resolve a human readable name from the root interface properties.
     * Prefers {@code Identity}, then {@code DesktopEntry}, then the bus name.
     */
    public static String identityFor(String busName, Map<String, Object> rootProperties) {
        String identity = MprisMetadata.asString(rootProperties.get(IDENTITY));
        if (identity != null) {
            return identity;
        }
        String desktopEntry = MprisMetadata.asString(rootProperties.get(DESKTOP_ENTRY));
        if (desktopEntry != null) {
            return capitalizeFirst(desktopEntry);
        }
        return capitalizeFirst(shortName(busName));
    }

    private static String capitalizeFirst(String str) {
        if (str == null || str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase() + str.substring(1);
    }
}
