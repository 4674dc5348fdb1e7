package org.endlesssource.mediarelay.protocol.message;

/**
 * Control request for one player. Always answered with a {@link CommandResultMessage}.
 *
 * @param playerId   player id or display identity
 * @param action     one of PLAY, PAUSE, STOP, NEXT, PREVIOUS, SEEK, SET_RATE
 * @param positionMs absolute target position for SEEK
 * @param rate       playback rate for SET_RATE
 */
public record Command(String requestId, String playerId, String action, Long positionMs, Double rate)
        implements Message {

    public static Command of(String requestId, String playerId, String action) {
        return new Command(requestId, playerId, action, null, null);
    }

    public static Command seek(String requestId, String playerId, long positionMs) {
        return new Command(requestId, playerId, "SEEK", positionMs, null);
    }

    public static Command setRate(String requestId, String playerId, double rate) {
        return new Command(requestId, playerId, "SET_RATE", null, rate);
    }
}
