package org.endlesssource.mediarelay.protocol.message;

/**
 * Client's proof of possession of the trust token issued when it paired.
 *
 * @param nonce client nonce mixed into both proofs
 * @param proof client proof over identity and both nonces
 */
public record Authenticate(int protocolVersion, String identity, byte[] nonce, byte[] proof) implements Message {
}
