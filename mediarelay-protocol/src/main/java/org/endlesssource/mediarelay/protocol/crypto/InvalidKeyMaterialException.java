package org.endlesssource.mediarelay.protocol.crypto;

/**
 * A peer supplied a key, signature or MAC that cannot be used.
 */
public class InvalidKeyMaterialException extends Exception {

    public InvalidKeyMaterialException(String message) {
        super(message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
