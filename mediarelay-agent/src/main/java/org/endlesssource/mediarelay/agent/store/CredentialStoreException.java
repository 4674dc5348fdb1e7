package org.endlesssource.mediarelay.agent.store;

/**
 * The trust records could not be read or written.
 */
public class CredentialStoreException extends RuntimeException {

    public CredentialStoreException(String message) {
        super(message);
    }

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
