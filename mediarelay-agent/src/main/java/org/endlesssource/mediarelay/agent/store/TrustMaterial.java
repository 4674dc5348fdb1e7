package org.endlesssource.mediarelay.agent.store;

import java.util.Objects;

/**
 * What a successful pairing hands to the store.
 */
public record TrustMaterial(byte[] identityKey, String clientName, byte[] trustToken) {

    public TrustMaterial {
        Objects.requireNonNull(identityKey, "identityKey must not be null");
        Objects.requireNonNull(trustToken, "trustToken must not be null");
    }
}
