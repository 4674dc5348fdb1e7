package org.endlesssource.mediarelay.protocol.message;

import java.util.List;

/**
 * Answer to {@link Subscribe}: the current state of each player the request newly subscribed to.
 * Events for those players follow.
 */
public record Snapshot(String requestId, List<PlayerState> players) implements Message {

    public Snapshot {
        players = players == null ? List.of() : List.copyOf(players);
    }
}
