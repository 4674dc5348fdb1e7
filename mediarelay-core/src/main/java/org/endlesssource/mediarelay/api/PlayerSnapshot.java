package org.endlesssource.mediarelay.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable canonical view of one local media player.
 *
 * @param playerId      stable identifier (the player's bus name)
 * @param identity      human readable, unique display name
 * @param playbackState current playback state
 * @param status        whether the state could be retrieved
 * @param metadata      current track metadata, {@link TrackMetadata#EMPTY} when nothing is loaded
 * @param position      last known playback position
 * @param rate          playback rate, 1.0 when unknown
 * @param capabilities  supported commands
 * @param updatedAt     when this snapshot was taken
 */
public record PlayerSnapshot(String playerId,
                             String identity,
                             PlaybackState playbackState,
                             PlayerStatus status,
                             TrackMetadata metadata,
                             Duration position,
                             double rate,
                             TransportCapabilities capabilities,
                             Instant updatedAt) {

    /**
     * Position drift tolerated between a projected and a reported position.
     */
    public static final Duration POSITION_TOLERANCE = Duration.ofMillis(1500);

    public PlayerSnapshot {
        Objects.requireNonNull(playerId, "playerId must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(playbackState, "playbackState must not be null");
        Objects.requireNonNull(status, "status must not be null");
        metadata = metadata == null ? TrackMetadata.EMPTY : metadata;
        position = position == null ? Duration.ZERO : position;
        capabilities = capabilities == null ? TransportCapabilities.NONE : capabilities;
        updatedAt = updatedAt == null ? Instant.now() : updatedAt;
    }

    public static PlayerSnapshot degraded(String playerId, String identity) {
        return new PlayerSnapshot(playerId, identity, PlaybackState.UNKNOWN, PlayerStatus.DEGRADED,
                TrackMetadata.EMPTY, Duration.ZERO, 1.0d, TransportCapabilities.NONE, Instant.now());
    }

    public PlayerSnapshot withIdentity(String newIdentity) {
        return new PlayerSnapshot(playerId, newIdentity, playbackState, status, metadata, position, rate,
                capabilities, updatedAt);
    }

    /**
     * Compare everything except {@link #updatedAt()}. While {@code other} was playing its position
     * is projected to this snapshot's time and compared within {@link #POSITION_TOLERANCE}.
     */
    public boolean sameStateAs(PlayerSnapshot other) {
        return other != null
                && playerId.equals(other.playerId)
                && identity.equals(other.identity)
                && playbackState == other.playbackState
                && status == other.status
                && metadata.equals(other.metadata)
                && samePositionAs(other)
                && Double.compare(rate, other.rate) == 0
                && capabilities.equals(other.capabilities);
    }

    private boolean samePositionAs(PlayerSnapshot other) {
        if (other.playbackState != PlaybackState.PLAYING || playbackState != PlaybackState.PLAYING) {
            return position.equals(other.position);
        }
        Duration elapsed = Duration.between(other.updatedAt, updatedAt);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        long expectedNanos = other.position.toNanos() + Math.round(elapsed.toNanos() * other.rate);
        return Math.abs(position.toNanos() - expectedNanos) <= POSITION_TOLERANCE.toNanos();
    }

    public boolean isDegraded() {
        return status == PlayerStatus.DEGRADED;
    }
}
