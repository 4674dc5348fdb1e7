package org.endlesssource.mediarelay.protocol.message;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Why a pairing attempt did not establish trust.
 */
public enum PairingFailure {
    /** The confirmation MAC or signature did not verify: the two sides saw different codes. */
    CODE_MISMATCH(PairingOutcome.ABORTED),
    REJECTED_BY_OPERATOR(PairingOutcome.REJECTED),
    REJECTED_BY_CLIENT(PairingOutcome.REJECTED),
    /** The operator blocked the peer's address. */
    BLOCKED(PairingOutcome.REJECTED),
    TIMED_OUT(PairingOutcome.TIMED_OUT),
    TOO_MANY_PENDING(PairingOutcome.ABORTED),
    @JsonEnumDefaultValue
    PROTOCOL_ERROR(PairingOutcome.ABORTED),
    SHUTTING_DOWN(PairingOutcome.ABORTED);

    private final PairingOutcome outcome;

    PairingFailure(PairingOutcome outcome) {
        this.outcome = outcome;
    }

    public PairingOutcome outcome() {
        return outcome;
    }
}
