package org.endlesssource.mediarelay.protocol.message;

/**
 * @param reason NOT_FOUND, UNSUPPORTED, PLAYER_BUSY, INVALID_ARGUMENT or FAILED; null when accepted
 */
public record CommandResultMessage(String requestId, boolean accepted, String reason, String message)
        implements Message {
}
