package org.endlesssource.mediarelay.spi;

import java.util.List;
import java.util.Map;

/**
 * Signals emitted by one player object.
 */
public interface PlayerSignalListener {

    /**
     * {@code org.freedesktop.DBus.Properties.PropertiesChanged}.
     * @param interfaceName interface whose properties changed
     * @param changed       new values, already unwrapped into plain Java values
     * @param invalidated   names of properties whose value is no longer known
     */
    void onPropertiesChanged(String interfaceName, Map<String, Object> changed, List<String> invalidated);

    /**
     * {@code org.mpris.MediaPlayer2.Player.Seeked}.
     * @param positionMicros new position in microseconds
     */
    default void onSeeked(long positionMicros) {}
}
