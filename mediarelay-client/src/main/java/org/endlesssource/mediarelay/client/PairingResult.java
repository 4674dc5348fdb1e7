package org.endlesssource.mediarelay.client;

/**
 * @param identity         the identity the agent stored
 * @param trustToken       token to present on the relay port
 * @param sas              the code both sides confirmed
 * @param agentFingerprint SHA-256 of the agent's TLS certificate, pinned on the relay port
 */
public record PairingResult(String identity, byte[] trustToken, String sas, byte[] agentFingerprint) {
}
