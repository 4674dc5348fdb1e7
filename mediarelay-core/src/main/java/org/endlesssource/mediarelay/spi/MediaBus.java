package org.endlesssource.mediarelay.spi;

import java.util.List;

/**
 * Client side of the session object bus, reduced to what player monitoring needs.
 * A bus may be connected again after it was lost.
 */
public interface MediaBus extends AutoCloseable {

    /**
     * Connect (or reconnect) to the bus and start delivering name notifications.
     * @throws BusException if the bus is not reachable
     */
    void connect() throws BusException;

    /**
     * @return true while the bus connection is usable
     */
    boolean isConnected();

    /**
     * @return bus names of all currently published media players
     * @throws BusException if the bus cannot be queried
     */
    List<String> listPlayerNames() throws BusException;

    /**
     * Open the player object published under the given name.
     * @throws BusException if the object cannot be reached
     */
    PlayerEndpoint openPlayer(String busName) throws BusException;

    /**
     * Set the listener receiving name and connection notifications.
     */
    void setListener(BusListener listener);

    /**
     * Unsubscribe from the bus and release the connection.
     */
    @Override
    void close();
}
