package org.endlesssource.mediarelay.api;

import java.time.Duration;
import java.util.Objects;

/**
 * A request to change a player's state. {@code position} is only meaningful for
 * {@link CommandAction#SEEK}, {@code rate} only for {@link CommandAction#SET_RATE}.
 */
public record PlayerCommand(CommandAction action, Duration position, Double rate) {

    public PlayerCommand {
        Objects.requireNonNull(action, "action must not be null");
        if (action == CommandAction.SEEK) {
            Objects.requireNonNull(position, "seek requires a position");
            if (position.isNegative()) {
                throw new IllegalArgumentException("seek position must not be negative");
            }
        }
        if (action == CommandAction.SET_RATE) {
            Objects.requireNonNull(rate, "set-rate requires a rate");
            if (rate.isNaN() || rate.isInfinite()) {
                throw new IllegalArgumentException("rate must be finite");
            }
        }
    }

    public static PlayerCommand of(CommandAction action) {
        return new PlayerCommand(action, null, null);
    }

    public static PlayerCommand play() {
        return of(CommandAction.PLAY);
    }

    public static PlayerCommand pause() {
        return of(CommandAction.PAUSE);
    }

    public static PlayerCommand stop() {
        return of(CommandAction.STOP);
    }

    public static PlayerCommand next() {
        return of(CommandAction.NEXT);
    }

    public static PlayerCommand previous() {
        return of(CommandAction.PREVIOUS);
    }

    public static PlayerCommand seek(Duration position) {
        return new PlayerCommand(CommandAction.SEEK, position, null);
    }

    public static PlayerCommand setRate(double rate) {
        return new PlayerCommand(CommandAction.SET_RATE, null, rate);
    }
}
