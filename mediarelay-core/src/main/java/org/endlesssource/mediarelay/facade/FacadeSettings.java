package org.endlesssource.mediarelay.facade;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-façade tuning.
 *
 * @param commandQueueCapacity commands that may wait behind the one in flight
 * @param refreshDelay         delay before re-reading state for players that under-report changes
 * @param positionSyncInterval how often {@code Position} is re-read to correct the projection, zero disables
 */
public record FacadeSettings(int commandQueueCapacity, Duration refreshDelay, Duration positionSyncInterval) {
    public static final Duration DEFAULT_POSITION_SYNC = Duration.ofSeconds(5);
    public static final FacadeSettings DEFAULT = new FacadeSettings(16, Duration.ofMillis(50));

    public FacadeSettings {
        if (commandQueueCapacity < 1) {
            throw new IllegalArgumentException("commandQueueCapacity must be positive");
        }
        Objects.requireNonNull(refreshDelay, "refreshDelay must not be null");
        if (refreshDelay.isNegative()) {
            throw new IllegalArgumentException("refreshDelay must not be negative");
        }
        Objects.requireNonNull(positionSyncInterval, "positionSyncInterval must not be null");
        if (positionSyncInterval.isNegative()) {
            throw new IllegalArgumentException("positionSyncInterval must not be negative");
        }
    }

    public FacadeSettings(int commandQueueCapacity, Duration refreshDelay) {
        this(commandQueueCapacity, refreshDelay, DEFAULT_POSITION_SYNC);
    }
}
