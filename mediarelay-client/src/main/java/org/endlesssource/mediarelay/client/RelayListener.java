package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.message.ErrorCode;
import org.endlesssource.mediarelay.protocol.message.EventMessage;

/**
 * Receives what the agent pushes without being asked. Called on the client's reader thread, in
 * the order the agent sent the messages.
 */
public interface RelayListener {

    void onEvent(EventMessage event);

    /**
     * The connection ended.
     *
     * @param reason the agent's error code, or null when the connection simply closed
     */
    default void onClosed(ErrorCode reason) {
    }
}
