package org.endlesssource.mediarelay.api;

/**
 * Listener for the player monitor's event stream.
 */
@FunctionalInterface
public interface PlayerEventListener {

    /**
     * Called for every event, in the order the monitor produced them.
     * Implementations must not block; they run on the monitor's dispatch thread.
     * @param event the event
     */
    void onPlayerEvent(PlayerEvent event);
}
