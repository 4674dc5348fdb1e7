package org.endlesssource.mediarelay.api;

/**
 * Health of a player's facade.
 */
public enum PlayerStatus {
    /** State was retrieved from the player and is kept current. */
    HEALTHY,
    /** The player is present on the bus but its state could not be retrieved. */
    DEGRADED
}
