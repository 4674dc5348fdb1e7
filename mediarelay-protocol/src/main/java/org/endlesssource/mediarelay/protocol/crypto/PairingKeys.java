package org.endlesssource.mediarelay.protocol.crypto;

import org.endlesssource.mediarelay.protocol.Protocol;

/**
 * Everything derived from a pairing key agreement.
 * <p>
 * PRK = HKDF-Extract(SHA-256(transcript), sharedSecret); every output is an HKDF-Expand of the
 * PRK under its own label. The short authentication string is the first 8 expanded bytes,
 * read as an unsigned integer, modulo 10^digits. It therefore depends on the shared secret and on
 * both ephemeral keys, and neither side can choose it alone.
 */
public final class PairingKeys implements AutoCloseable {
    public static final int TOKEN_LENGTH = 32;

    private final String sas;
    private final byte[] clientConfirmKey;
    private final byte[] agentConfirmKey;
    private final byte[] trustToken;

    private PairingKeys(String sas, byte[] clientConfirmKey, byte[] agentConfirmKey, byte[] trustToken) {
        this.sas = sas;
        this.clientConfirmKey = clientConfirmKey;
        this.agentConfirmKey = agentConfirmKey;
        this.trustToken = trustToken;
    }

    public static PairingKeys derive(byte[] sharedSecret, byte[] transcript, int sasDigits) {
        if (sasDigits < Protocol.MIN_SAS_DIGITS || sasDigits > Protocol.MAX_SAS_DIGITS) {
            throw new IllegalArgumentException("SAS digits must be between " + Protocol.MIN_SAS_DIGITS
                    + " and " + Protocol.MAX_SAS_DIGITS + ", got " + sasDigits);
        }
        byte[] prk = CryptoPrimitives.hkdfExtract(CryptoPrimitives.sha256(transcript), sharedSecret);
        try {
            byte[] sasBytes = CryptoPrimitives.hkdfExpand(prk, "mediarelay sas", 8);
            String sas = formatSas(sasBytes, sasDigits);
            return new PairingKeys(sas,
                    CryptoPrimitives.hkdfExpand(prk, "mediarelay client confirm", CryptoPrimitives.HASH_LENGTH),
                    CryptoPrimitives.hkdfExpand(prk, "mediarelay agent confirm", CryptoPrimitives.HASH_LENGTH),
                    CryptoPrimitives.hkdfExpand(prk, "mediarelay trust token", TOKEN_LENGTH));
        } finally {
            CryptoPrimitives.wipe(prk);
        }
    }

    private static String formatSas(byte[] bytes, int digits) {
        long value = 0;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        long modulus = 1;
        for (int i = 0; i < digits; i++) {
            modulus *= 10;
        }
        long code = Long.remainderUnsigned(value, modulus);
        StringBuilder sb = new StringBuilder(Long.toString(code));
        while (sb.length() < digits) {
            sb.insert(0, '0');
        }
        return sb.toString();
    }

    public String sas() {
        return sas;
    }

    public byte[] clientConfirmation(byte[] transcript) {
        return CryptoPrimitives.hmacSha256(clientConfirmKey, transcript);
    }

    public byte[] agentConfirmation(byte[] transcript) {
        return CryptoPrimitives.hmacSha256(agentConfirmKey, transcript);
    }

    public boolean verifyClientConfirmation(byte[] transcript, byte[] confirmation) {
        return CryptoPrimitives.constantTimeEquals(clientConfirmation(transcript), confirmation);
    }

    public boolean verifyAgentConfirmation(byte[] transcript, byte[] confirmation) {
        return CryptoPrimitives.constantTimeEquals(agentConfirmation(transcript), confirmation);
    }

    public byte[] trustToken() {
        return trustToken.clone();
    }

    /**
     * Zero all derived key material.
     */
    @Override
    public void close() {
        CryptoPrimitives.wipe(clientConfirmKey);
        CryptoPrimitives.wipe(agentConfirmKey);
        CryptoPrimitives.wipe(trustToken);
    }
}
