package org.endlesssource.mediarelay.protocol.message;

/**
 * First message of a pairing attempt, sent by the client.
 *
 * @param protocolVersion version the client speaks
 * @param clientName      name shown to the operator
 * @param identity        identity derived from {@code identityKey}
 * @param identityKey     client's long-term Ed25519 public key
 * @param ephemeralKey    client's X25519 public key for this attempt
 */
public record PairHello(int protocolVersion, String clientName, String identity, byte[] identityKey,
                        byte[] ephemeralKey) implements Message {
}
