package org.endlesssource.mediarelay.client;

import org.endlesssource.mediarelay.protocol.message.ErrorCode;

import java.io.IOException;

/**
 * The agent ended the relay connection, or refused it.
 */
public class RelayClosedException extends IOException {
    private final ErrorCode code;

    public RelayClosedException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @return the agent's error code, or null when the connection closed without one
     */
    public ErrorCode getCode() {
        return code;
    }
}
