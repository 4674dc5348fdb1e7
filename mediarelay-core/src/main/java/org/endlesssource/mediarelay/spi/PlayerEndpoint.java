package org.endlesssource.mediarelay.spi;

import java.util.Map;

/**
 * One MPRIS player object as reached through the object bus.
 * Property values are returned unwrapped: strings, booleans, numbers, lists and maps.
 * Object paths are returned as their string form.
 */
public interface PlayerEndpoint extends AutoCloseable {

    /**
     * @return the bus name this endpoint talks to
     */
    String busName();

    /**
     * Read all properties of one interface.
     * @param interfaceName e.g. {@code org.mpris.MediaPlayer2.Player}
     * @return property values keyed by name
     * @throws BusException if the call fails
     */
    Map<String, Object> getAllProperties(String interfaceName) throws BusException;

    /**
     * Read one property.
     * @return the current value, unwrapped
     * @throws BusException if the call fails
     */
    Object getProperty(String interfaceName, String property) throws BusException;

    /**
     * Write one property.
     * @throws BusException if the call fails
     */
    void setProperty(String interfaceName, String property, Object value) throws BusException;

    void play() throws BusException;

    void pause() throws BusException;

    void playPause() throws BusException;

    void stop() throws BusException;

    void next() throws BusException;

    void previous() throws BusException;

    /**
     * Relative seek.
     * @param offsetMicros offset in microseconds, may be negative
     */
    void seek(long offsetMicros) throws BusException;

    /**
     * Absolute seek within the given track.
     * @param trackId       object path of the current track
     * @param positionMicros target position in microseconds
     */
    void setPosition(String trackId, long positionMicros) throws BusException;

    /**
     * Start delivering this player's signals to the listener. Only one listener is supported.
     * @throws BusException if the subscription cannot be made
     */
    void subscribe(PlayerSignalListener listener) throws BusException;

    /**
     * Stop delivering signals and release the remote object.
     */
    @Override
    void close();
}
