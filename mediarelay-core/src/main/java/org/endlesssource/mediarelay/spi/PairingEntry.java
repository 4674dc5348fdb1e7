package org.endlesssource.mediarelay.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A paired client as reported through {@link AgentControl}.
 */
public record PairingEntry(String identity, String clientName, Instant pairedAt) {
    public PairingEntry {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(pairedAt, "pairedAt must not be null");
    }
}
