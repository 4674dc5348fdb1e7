package org.endlesssource.mediarelay.protocol.message;

/**
 * First message on a relay connection: the agent's nonce the client must prove its token over.
 */
public record Challenge(int protocolVersion, byte[] nonce) implements Message {
}
