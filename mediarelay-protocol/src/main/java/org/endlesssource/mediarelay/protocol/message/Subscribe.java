package org.endlesssource.mediarelay.protocol.message;

import java.util.List;

/**
 * Subscribe to every player ({@code all}) or to the listed player ids or identities.
 */
public record Subscribe(String requestId, boolean all, List<String> players) implements Message {

    public Subscribe {
        players = players == null ? List.of() : List.copyOf(players);
    }

    public static Subscribe all(String requestId) {
        return new Subscribe(requestId, true, List.of());
    }

    public static Subscribe players(String requestId, List<String> players) {
        return new Subscribe(requestId, false, players);
    }
}
