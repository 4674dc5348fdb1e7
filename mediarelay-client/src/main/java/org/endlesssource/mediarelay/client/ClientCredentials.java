package org.endlesssource.mediarelay.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.endlesssource.mediarelay.protocol.crypto.IdentityKeyPair;

import java.util.Objects;

/**
 * What a client keeps after pairing: its long-term identity key, the trust token the agent
 * issued, where the agent's relay port is and which certificate the agent presents there.
 *
 * @param identityPrivateKey Ed25519 private key, 32 bytes
 * @param trustToken         token issued by the agent, absent before pairing
 * @param agentFingerprint   SHA-256 of the agent's TLS certificate, absent before pairing
 */
public record ClientCredentials(String clientName, byte[] identityPrivateKey, byte[] trustToken,
                                String agentHost, int relayPort, byte[] agentFingerprint) {

    public ClientCredentials {
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(identityPrivateKey, "identityPrivateKey must not be null");
    }

    /**
     * Credentials with a fresh identity key and no pairing.
     */
    public static ClientCredentials newIdentity(String clientName) {
        return new ClientCredentials(clientName, IdentityKeyPair.generate().privateKey(), null, null, 0, null);
    }

    public IdentityKeyPair identityKeyPair() {
        return IdentityKeyPair.fromPrivateKey(identityPrivateKey);
    }

    public String identity() {
        return identityKeyPair().identity();
    }

    @JsonIgnore
    public boolean isPaired() {
        return trustToken != null && agentHost != null && relayPort > 0 && agentFingerprint != null;
    }

    public ClientCredentials paired(PairingResult result, String host, int port) {
        return new ClientCredentials(clientName, identityPrivateKey, result.trustToken(), host, port,
                result.agentFingerprint());
    }
}
