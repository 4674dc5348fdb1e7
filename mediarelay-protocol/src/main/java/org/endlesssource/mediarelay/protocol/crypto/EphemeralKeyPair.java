package org.endlesssource.mediarelay.protocol.crypto;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * X25519 key pair used for a single pairing attempt.
 */
public final class EphemeralKeyPair implements AutoCloseable {
    public static final int KEY_LENGTH = X25519PublicKeyParameters.KEY_SIZE;

    private X25519PrivateKeyParameters privateKey;
    private final byte[] publicKey;

    private EphemeralKeyPair(X25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = privateKey.generatePublicKey().getEncoded();
    }

    public static EphemeralKeyPair generate() {
        byte[] seed = CryptoPrimitives.randomBytes(X25519PrivateKeyParameters.KEY_SIZE);
        try {
            return new EphemeralKeyPair(new X25519PrivateKeyParameters(seed, 0));
        } finally {
            CryptoPrimitives.wipe(seed);
        }
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    /**
     * Compute the shared secret with the peer's public key.
     *
     * @throws InvalidKeyMaterialException if the key is malformed or yields a degenerate secret
     */
    public byte[] agree(byte[] remotePublicKey) throws InvalidKeyMaterialException {
        X25519PrivateKeyParameters key = privateKey;
        if (key == null) {
            throw new IllegalStateException("Key pair already destroyed");
        }
        if (remotePublicKey == null || remotePublicKey.length != KEY_LENGTH) {
            throw new InvalidKeyMaterialException("Ephemeral key must be " + KEY_LENGTH + " bytes");
        }
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(key);
        byte[] secret = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(new X25519PublicKeyParameters(remotePublicKey, 0), secret, 0);
        } catch (IllegalStateException e) {
            throw new InvalidKeyMaterialException("Key agreement failed", e);
        }
        return secret;
    }

    /**
     * Drop the private key. Further calls to {@link #agree(byte[])} fail.
     */
    @Override
    public void close() {
        privateKey = null;
    }

    public boolean isDestroyed() {
        return privateKey == null;
    }
}
