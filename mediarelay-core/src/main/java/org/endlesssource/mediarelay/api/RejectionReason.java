package org.endlesssource.mediarelay.api;

/**
 * Why a command was not applied.
 */
public enum RejectionReason {
    /** The target player does not exist (any more). */
    NOT_FOUND,
    /** The player does not support the command. */
    UNSUPPORTED,
    /** Too many commands are already queued for the player. */
    PLAYER_BUSY,
    /** The command's argument is outside what the player accepts. */
    INVALID_ARGUMENT,
    /** The player failed while executing the command. */
    FAILED
}
