package org.endlesssource.mediarelay.protocol.message;

import java.util.List;

/**
 * Drop the all-players subscription ({@code all}) or the listed players. Answered with {@link Ack}.
 */
public record Unsubscribe(String requestId, boolean all, List<String> players) implements Message {

    public Unsubscribe {
        players = players == null ? List.of() : List.copyOf(players);
    }
}
