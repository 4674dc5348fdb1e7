package org.endlesssource.mediarelay.protocol.message;

/**
 * Client's verdict after its user compared the short authentication string.
 *
 * @param accepted     whether the client's user confirmed the code
 * @param confirmation MAC over the pairing transcript with the client confirmation key
 * @param signature    Ed25519 signature over the transcript with the client identity key
 */
public record PairConfirm(String sessionId, boolean accepted, byte[] confirmation, byte[] signature)
        implements Message {
}
