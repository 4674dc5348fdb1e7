package org.endlesssource.mediarelay.protocol.message;

/**
 * Agent's answer to {@link PairHello}: the session it opened and its own ephemeral key.
 *
 * @param sasDigits length of the short authentication string both sides display
 */
public record PairChallenge(String sessionId, byte[] ephemeralKey, int sasDigits) implements Message {
}
