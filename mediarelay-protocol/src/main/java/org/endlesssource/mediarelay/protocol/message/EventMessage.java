package org.endlesssource.mediarelay.protocol.message;

/**
 * A change to a subscribed player. {@code player} is absent for {@link EventKind#PLAYER_DISAPPEARED}.
 */
public record EventMessage(EventKind kind, String playerId, PlayerState player) implements Message {
}
