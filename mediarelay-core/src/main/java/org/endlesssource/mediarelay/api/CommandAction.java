package org.endlesssource.mediarelay.api;

/**
 * The canonical subset of player commands.
 */
public enum CommandAction {
    PLAY,
    PAUSE,
    STOP,
    NEXT,
    PREVIOUS,
    SEEK,
    SET_RATE
}
