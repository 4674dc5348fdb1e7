package org.endlesssource.mediarelay.protocol.crypto;

import org.bouncycastle.util.encoders.Hex;

/**
 * Client identities are the first 16 bytes of the SHA-256 of the identity public key, in hex.
 */
public final class Identities {
    private static final int IDENTITY_BYTES = 16;

    private Identities() {
    }

    public static String derive(byte[] identityKey) {
        if (identityKey == null || identityKey.length != IdentityKeyPair.KEY_LENGTH) {
            throw new IllegalArgumentException("Identity key must be " + IdentityKeyPair.KEY_LENGTH + " bytes");
        }
        return Hex.toHexString(CryptoPrimitives.sha256(identityKey), 0, IDENTITY_BYTES);
    }

    /**
     * @return whether {@code identity} is the identity of {@code identityKey}
     */
    public static boolean matches(String identity, byte[] identityKey) {
        if (identity == null || identityKey == null || identityKey.length != IdentityKeyPair.KEY_LENGTH) {
            return false;
        }
        return derive(identityKey).equals(identity);
    }
}
