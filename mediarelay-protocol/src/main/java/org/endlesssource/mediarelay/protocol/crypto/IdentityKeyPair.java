package org.endlesssource.mediarelay.protocol.crypto;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * A client's long-term Ed25519 key. Its public half determines the client's identity.
 */
public final class IdentityKeyPair {
    public static final int KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;
    public static final int SIGNATURE_LENGTH = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

    private final Ed25519PrivateKeyParameters privateKey;
    private final byte[] publicKey;

    private IdentityKeyPair(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = privateKey.generatePublicKey().getEncoded();
    }

    public static IdentityKeyPair generate() {
        return fromPrivateKey(CryptoPrimitives.randomBytes(Ed25519PrivateKeyParameters.KEY_SIZE));
    }

    /**
     * Restore a key pair from the 32 byte private key returned by {@link #privateKey()}.
     */
    public static IdentityKeyPair fromPrivateKey(byte[] encoded) {
        if (encoded == null || encoded.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Identity private key must be "
                    + Ed25519PrivateKeyParameters.KEY_SIZE + " bytes");
        }
        return new IdentityKeyPair(new Ed25519PrivateKeyParameters(encoded, 0));
    }

    public byte[] privateKey() {
        return privateKey.getEncoded();
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    public String identity() {
        return Identities.derive(publicKey);
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    /**
     * Verify an Ed25519 signature. Malformed keys or signatures simply fail verification.
     */
    public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey == null || publicKey.length != KEY_LENGTH
                || signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        Ed25519PublicKeyParameters key;
        try {
            key = new Ed25519PublicKeyParameters(publicKey, 0);
        } catch (IllegalArgumentException e) {
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, key);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }
}
