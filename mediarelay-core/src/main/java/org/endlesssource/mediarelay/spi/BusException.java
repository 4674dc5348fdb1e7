package org.endlesssource.mediarelay.spi;

/**
 * Raised when the object bus or a remote player object cannot be reached.
 * Callers treat it as transient unless {@link MediaBus#isConnected()} says otherwise.
 */
public class BusException extends Exception {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
