package org.endlesssource.mediarelay.agent.pairing;

import org.endlesssource.mediarelay.protocol.message.PairingFailure;

/**
 * A pairing attempt ended without establishing trust.
 */
public class PairingException extends Exception {
    private final PairingFailure failure;

    public PairingException(PairingFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PairingException(PairingFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public PairingFailure getFailure() {
        return failure;
    }
}
