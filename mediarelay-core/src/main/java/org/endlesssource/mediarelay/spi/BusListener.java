package org.endlesssource.mediarelay.spi;

/**
 * Bus-level notifications. Called from bus threads; implementations hand off quickly.
 */
public interface BusListener {

    /**
     * A media player service was published on the bus.
     * @param busName the player's well-known bus name
     */
    void onPlayerNameAppeared(String busName);

    /**
     * A media player service left the bus.
     * @param busName the player's well-known bus name
     */
    void onPlayerNameVanished(String busName);

    /**
     * The connection to the bus was lost. No further name notifications arrive
     * until {@link MediaBus#connect()} succeeds again.
     * @param cause what went wrong, may be null
     */
    void onBusLost(Throwable cause);
}
