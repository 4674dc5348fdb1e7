package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.message.PairingFailure;

/**
 * The agent or the local user ended the pairing attempt.
 */
public class PairingFailedException extends Exception {
    private final PairingFailure failure;

    public PairingFailedException(PairingFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PairingFailure getFailure() {
        return failure;
    }
}
