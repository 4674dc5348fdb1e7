package org.endlesssource.mediarelay.protocol.crypto;

import org.endlesssource.mediarelay.protocol.Protocol;

/**
 * The bytes both sides bind the pairing outcome to: session, both ephemeral keys, the client's
 * identity key and the fingerprint of the TLS certificate the agent presented. A TLS interceptor
 * shows the client a different certificate, so both sides derive different codes.
 */
public final class PairingTranscript {
    private static final byte[] CONTEXT = CryptoPrimitives.utf8("mediarelay-pair-v" + Protocol.VERSION);

    private PairingTranscript() {
    }

    public static byte[] of(String sessionId, byte[] clientEphemeralKey, byte[] agentEphemeralKey,
                            byte[] clientIdentityKey, byte[] agentCertificateFingerprint) {
        return CryptoPrimitives.lengthPrefixed(CONTEXT, CryptoPrimitives.utf8(sessionId),
                clientEphemeralKey, agentEphemeralKey, clientIdentityKey, agentCertificateFingerprint);
    }
}
