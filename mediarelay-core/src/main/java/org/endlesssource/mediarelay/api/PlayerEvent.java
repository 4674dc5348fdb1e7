package org.endlesssource.mediarelay.api;

import java.util.Objects;

/**
 * A change in the set of players or in one player's state.
 * {@code snapshot} is null for {@link Type#PLAYER_DISAPPEARED}.
 */
public record PlayerEvent(Type type, String playerId, PlayerSnapshot snapshot) {

    public enum Type {
        PLAYER_APPEARED,
        STATE_CHANGED,
        PLAYER_DISAPPEARED
    }

    public PlayerEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(playerId, "playerId must not be null");
        if (type != Type.PLAYER_DISAPPEARED) {
            Objects.requireNonNull(snapshot, type + " requires a snapshot");
        }
    }

    public static PlayerEvent appeared(PlayerSnapshot snapshot) {
        return new PlayerEvent(Type.PLAYER_APPEARED, snapshot.playerId(), snapshot);
    }

    public static PlayerEvent changed(PlayerSnapshot snapshot) {
        return new PlayerEvent(Type.STATE_CHANGED, snapshot.playerId(), snapshot);
    }

    public static PlayerEvent disappeared(String playerId) {
        return new PlayerEvent(Type.PLAYER_DISAPPEARED, playerId, null);
    }
}
