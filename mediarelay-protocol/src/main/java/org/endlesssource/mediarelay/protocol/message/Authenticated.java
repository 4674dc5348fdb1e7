package org.endlesssource.mediarelay.protocol.message;

/**
 * Sent once the client's proof verified. {@code proof} lets the client check that it talks to
 * the agent it paired with.
 */
public record Authenticated(byte[] proof) implements Message {
}
