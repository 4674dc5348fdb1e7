package org.endlesssource.mediarelay.protocol.message;

/**
 * Terminal error; the sender closes the connection right after it.
 */
public record ErrorMessage(ErrorCode code, String message) implements Message {
}
