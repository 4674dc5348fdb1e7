package org.endlesssource.mediarelay.monitor;

/**
 * Lifecycle of a {@link PlayerMonitor}.
 */
public enum MonitorState {
    NEW,
    /** Initial bus connection attempts in progress. */
    CONNECTING,
    RUNNING,
    /** Bus was lost; all players were reported gone and reconnection is in progress. */
    RECONNECTING,
    /** The bus could not be reached at startup. Players are not monitored. */
    FAILED,
    CLOSED
}
