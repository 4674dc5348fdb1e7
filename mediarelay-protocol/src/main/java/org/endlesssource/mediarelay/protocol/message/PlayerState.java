package org.endlesssource.mediarelay.protocol.message;

import java.util.List;

/**
 * Wire form of a player snapshot. Enumerated values travel as their names so that a client can
 * keep working when a newer agent adds values.
 *
 * @param playerId      stable player id
 * @param identity      unique display name
 * @param playbackState PLAYING, PAUSED, STOPPED or UNKNOWN
 * @param status        HEALTHY or DEGRADED
 * @param lengthMs      track length, absent when unknown
 * @param positionMs    last known position
 * @param capabilities  commands the player accepts
 */
public record PlayerState(String playerId,
                          String identity,
                          String playbackState,
                          String status,
                          String trackId,
                          String title,
                          String artist,
                          String album,
                          Long lengthMs,
                          String artUrl,
                          long positionMs,
                          double rate,
                          List<String> capabilities) {

    public PlayerState {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }
}
