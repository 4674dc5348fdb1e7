package org.endlesssource.mediarelay.protocol;

import java.io.IOException;

/**
 * The peer sent something that is not a valid message for the current exchange.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
