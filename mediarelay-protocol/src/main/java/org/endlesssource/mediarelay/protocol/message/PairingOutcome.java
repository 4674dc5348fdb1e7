package org.endlesssource.mediarelay.protocol.message;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Terminal state of a pairing attempt as reported to the client.
 */
public enum PairingOutcome {
    ESTABLISHED,
    REJECTED,
    TIMED_OUT,
    @JsonEnumDefaultValue
    ABORTED
}
