package org.endlesssource.mediarelay.agent.pairing;

import org.endlesssource.mediarelay.protocol.message.PairingFailure;

/**
 * Lifecycle of a {@link PairingSession}.
 */
public enum PairingState {
    /** Session created, local ephemeral key generated. */
    INIT,
    /** Remote ephemeral key received, keys and code derived. */
    KEY_EXCHANGE,
    /** Code shown, waiting for the operator and the client. */
    AWAITING_CONFIRMATION,
    ESTABLISHED,
    ABORTED,
    REJECTED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == ESTABLISHED || this == ABORTED || this == REJECTED || this == TIMED_OUT;
    }

    static PairingState of(PairingFailure failure) {
        return switch (failure.outcome()) {
            case REJECTED -> REJECTED;
            case TIMED_OUT -> TIMED_OUT;
            case ABORTED, ESTABLISHED -> ABORTED;
        };
    }
}
