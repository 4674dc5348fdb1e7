package org.endlesssource.mediarelay.agent.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable proof that a client completed pairing. Never modified after creation.
 *
 * @param identity    client identity, derived from {@code identityKey}
 * @param identityKey client's long-term public key
 * @param clientName  name the client announced when pairing
 * @param trustToken  secret the client proves possession of on every relay connection
 * @param createdAt   when pairing completed
 */
public record TrustRecord(String identity, byte[] identityKey, String clientName, byte[] trustToken,
                          Instant createdAt) {

    public TrustRecord {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(identityKey, "identityKey must not be null");
        Objects.requireNonNull(trustToken, "trustToken must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        identityKey = identityKey.clone();
        trustToken = trustToken.clone();
        clientName = clientName == null ? "" : clientName;
    }

    @Override
    public byte[] identityKey() {
        return identityKey.clone();
    }

    @Override
    public byte[] trustToken() {
        return trustToken.clone();
    }

    @Override
    public String toString() {
        return "TrustRecord[identity=" + identity + ", clientName=" + clientName + ", createdAt=" + createdAt + "]";
    }
}
